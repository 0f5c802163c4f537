package com.jay.insight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InsightEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(InsightEngineApplication.class, args);
    }
}
