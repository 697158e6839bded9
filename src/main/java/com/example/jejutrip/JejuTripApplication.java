package com.example.jejutrip;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JejuTripApplication {

    public static void main(String[] args) {
        SpringApplication.run(JejuTripApplication.class, args);
    }
}
