package com.tripsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TripSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(TripSyncApplication.class, args);
    }
}
