package com.koni.climate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClimateIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClimateIngestApplication.class, args);
    }
}
