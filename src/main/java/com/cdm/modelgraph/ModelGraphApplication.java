package com.cdm.modelgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ModelGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelGraphApplication.class, args);
    }
}
