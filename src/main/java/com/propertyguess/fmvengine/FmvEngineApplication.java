package com.propertyguess.fmvengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FmvEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(FmvEngineApplication.class, args);
    }
}
