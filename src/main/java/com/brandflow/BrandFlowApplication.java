package com.brandflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BrandFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(BrandFlowApplication.class, args);
    }
}
