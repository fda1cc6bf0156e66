package com.demandplanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DemandPlannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DemandPlannerApplication.class, args);
    }
}
