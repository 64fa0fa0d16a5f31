package com.labelbridge.labelservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class LabelServiceMockApplication {

    public static void main(String[] args) {
        SpringApplication.run(LabelServiceMockApplication.class, args);
    }
}
