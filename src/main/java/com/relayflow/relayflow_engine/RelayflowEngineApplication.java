package com.relayflow.relayflow_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RelayflowEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelayflowEngineApplication.class, args);
    }
}
