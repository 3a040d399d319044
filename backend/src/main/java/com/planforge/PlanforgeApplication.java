package com.planforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PlanforgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlanforgeApplication.class, args);
    }
}
