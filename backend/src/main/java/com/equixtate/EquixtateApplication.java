package com.equixtate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EquixtateApplication {

    public static void main(String[] args) {
        SpringApplication.run(EquixtateApplication.class, args);
    }
}
