package com.williamcallahan.eventstream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class EventStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventStreamApplication.class, args);
    }

}
