package com.toyc.playground;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ToyCPlaygroundApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToyCPlaygroundApplication.class, args);
    }
}
