package com.cardiacreport.config;

import com.fasterxml.jackson.databind.Module;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the lenient measurement module with the Spring-managed ObjectMapper.
 */
@Configuration
public class JacksonConfig {

    @Bean
    public Module measurementJsonModule() {
        return new MeasurementJsonModule();
    }
}
