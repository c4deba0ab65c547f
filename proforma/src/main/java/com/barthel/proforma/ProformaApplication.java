package com.barthel.proforma;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProformaApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProformaApplication.class, args);
    }
}
