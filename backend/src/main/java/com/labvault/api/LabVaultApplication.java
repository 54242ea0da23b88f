package com.labvault.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LabVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(LabVaultApplication.class, args);
    }
}
