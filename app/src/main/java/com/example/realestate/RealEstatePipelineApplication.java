package com.example.realestate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RealEstatePipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RealEstatePipelineApplication.class, args);
    }
}
