package com.covidamp.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CovidAmpApplication {

    public static void main(String[] args) {
        SpringApplication.run(CovidAmpApplication.class, args);
    }
}
