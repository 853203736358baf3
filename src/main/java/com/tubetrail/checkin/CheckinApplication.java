package com.tubetrail.checkin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main Spring Boot Application Class
 * Station Visit Verification & Duplicate-Guard Service
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CheckinApplication {

    public static void main(String[] args) {
        SpringApplication.run(CheckinApplication.class, args);
    }

}
