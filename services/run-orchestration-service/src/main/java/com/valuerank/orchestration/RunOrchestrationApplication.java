package com.valuerank.orchestration;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RunOrchestrationApplication {

    public static void main(String[] args) {
        SpringApplication.run(RunOrchestrationApplication.class, args);
    }
}
