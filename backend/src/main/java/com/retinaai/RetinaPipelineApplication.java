package com.retinaai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RetinaPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RetinaPipelineApplication.class, args);
    }
}
