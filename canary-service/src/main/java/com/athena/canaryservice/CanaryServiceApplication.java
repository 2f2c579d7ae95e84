package com.athena.canaryservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CanaryServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(CanaryServiceApplication.class, args);
    }
}
