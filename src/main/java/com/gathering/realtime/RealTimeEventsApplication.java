package com.gathering.realtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Application entry point. Scheduling is enabled for the periodic statistics
 * report and the client keepalive.
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class RealTimeEventsApplication {

    public static void main(String[] args) {
        SpringApplication.run(RealTimeEventsApplication.class, args);
    }
}
