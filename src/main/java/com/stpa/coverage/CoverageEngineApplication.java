package com.stpa.coverage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CoverageEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoverageEngineApplication.class, args);
    }
}
