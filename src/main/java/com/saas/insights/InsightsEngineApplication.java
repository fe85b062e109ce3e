package com.saas.insights;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class InsightsEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(InsightsEngineApplication.class, args);
    }
}
