package com.cardiacreport.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.Arrays;
import java.util.List;

/**
 * Spring Security configuration.
 *
 * Report composition is stateless and open to the report UI. Stored studies and
 * letters built from them contain patient data and require HTTP basic auth
 * (credentials from spring.security.user.*) unless security.auth.enabled is false.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final String[] OPEN_PATHS = {"/api/reports/**", "/h2-console/**"};
    private static final String[] PATIENT_DATA_PATHS = {"/api/studies/**", "/api/patients/**"};

    @Value("${security.auth.enabled:true}")
    private boolean authEnabled;

    @Value("${cors.allowed-origins:http://localhost:8501,http://127.0.0.1:8501}")
    private String allowedOriginsConfig;

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration reportUi = new CorsConfiguration();
        reportUi.setAllowedOrigins(parseOrigins(allowedOriginsConfig));
        // studies are imported and read, never edited
        reportUi.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
        reportUi.setAllowedHeaders(List.of("*"));
        reportUi.setAllowCredentials(true);
        reportUi.setMaxAge(3600L);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/**", reportUi);
        return source;
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http.cors(cors -> cors.configurationSource(corsConfigurationSource()))
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .headers(headers -> headers.frameOptions(frame -> frame.sameOrigin()));

        if (authEnabled) {
            http.authorizeHttpRequests(auth -> auth
                    .requestMatchers(OPEN_PATHS).permitAll()
                    .requestMatchers(PATIENT_DATA_PATHS).authenticated()
                    .anyRequest().authenticated())
                .httpBasic(Customizer.withDefaults());
        } else {
            http.authorizeHttpRequests(auth -> auth.anyRequest().permitAll());
        }
        return http.build();
    }

    static List<String> parseOrigins(String config) {
        return Arrays.stream(config.split(","))
            .map(String::trim)
            .filter(origin -> !origin.isEmpty())
            .toList();
    }
}
