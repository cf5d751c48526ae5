package com.cardiacreport.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SecurityConfigTest {

    @Test
    public void testParseOrigins_TrimsAndSkipsBlanks() {
        List<String> origins = SecurityConfig.parseOrigins(" http://localhost:8501, ,http://127.0.0.1:8501 ,");

        assertEquals(List.of("http://localhost:8501", "http://127.0.0.1:8501"), origins);
    }

    @Test
    public void testParseOrigins_SingleOrigin() {
        assertEquals(List.of("http://localhost:5173"), SecurityConfig.parseOrigins("http://localhost:5173"));
    }
}
