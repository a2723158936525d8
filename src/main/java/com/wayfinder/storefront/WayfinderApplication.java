package com.wayfinder.storefront;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WayfinderApplication {

    public static void main(String[] args) {
        SpringApplication.run(WayfinderApplication.class, args);
    }
}
