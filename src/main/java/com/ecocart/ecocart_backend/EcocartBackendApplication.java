package com.ecocart.ecocart_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EcocartBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(EcocartBackendApplication.class, args);
    }
}
