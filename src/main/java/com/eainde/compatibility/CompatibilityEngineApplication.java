package com.eainde.compatibility;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CompatibilityEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CompatibilityEngineApplication.class, args);
    }
}
