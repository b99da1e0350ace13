package com.autobot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AutobotApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutobotApplication.class, args);
    }
}
