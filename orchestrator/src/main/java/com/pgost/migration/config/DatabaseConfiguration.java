package com.pgost.migration.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Configuration for shared infrastructure beans.
 */
@Configuration
public class DatabaseConfiguration {
    
    /**
     * ObjectMapper for JSON serialization/deserialization.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
            .findAndRegisterModules(); // Register Java 8 time module, etc.
    }
    
    /**
     * Clock used to stamp archived table names.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
