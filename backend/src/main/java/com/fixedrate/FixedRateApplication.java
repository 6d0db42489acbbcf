package com.fixedrate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FixedRateApplication {

    public static void main(String[] args) {
        SpringApplication.run(FixedRateApplication.class, args);
    }
}
