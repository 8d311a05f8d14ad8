package com.example.cafeshift;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CafeShiftApplication {

    public static void main(String[] args) {
        SpringApplication.run(CafeShiftApplication.class, args);
    }
}
