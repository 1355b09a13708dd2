package com.example.canonical.ingestion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CanonicalIngestionApplication {

    public static void main(String[] args) {
        SpringApplication.run(CanonicalIngestionApplication.class, args);
    }
}
