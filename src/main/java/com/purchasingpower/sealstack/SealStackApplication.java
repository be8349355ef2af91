package com.purchasingpower.sealstack;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SealStackApplication {

    public static void main(String[] args) {
        SpringApplication.run(SealStackApplication.class, args);
    }
}
