package com.counterfactual.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CounterfactualEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CounterfactualEngineApplication.class, args);
    }
}
