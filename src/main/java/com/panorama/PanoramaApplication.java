package com.panorama;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PanoramaApplication {
    public static void main(String[] args) {
        SpringApplication.run(PanoramaApplication.class, args);
    }
}
