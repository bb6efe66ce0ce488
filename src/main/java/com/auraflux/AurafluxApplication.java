package com.auraflux;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AurafluxApplication {

    public static void main(String[] args) {
        SpringApplication.run(AurafluxApplication.class, args);
    }
}
