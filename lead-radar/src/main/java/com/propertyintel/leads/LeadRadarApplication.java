package com.propertyintel.leads;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class LeadRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeadRadarApplication.class, args);
    }
}
