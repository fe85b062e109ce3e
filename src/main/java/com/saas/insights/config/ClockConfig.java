package com.saas.insights.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // Days are bucketed in UTC throughout the engine.
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
