package com.siy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SiyApplication {

    public static void main(String[] args) {
        SpringApplication.run(SiyApplication.class, args);
    }
}
