package com.cinegen.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CinegenApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(CinegenApiApplication.class, args);
    }
}
