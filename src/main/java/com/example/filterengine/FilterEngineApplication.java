package com.example.filterengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FilterEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(FilterEngineApplication.class, args);
    }
}
