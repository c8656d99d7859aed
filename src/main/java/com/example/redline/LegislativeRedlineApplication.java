package com.example.redline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LegislativeRedlineApplication {
    public static void main(String[] args) {
        SpringApplication.run(LegislativeRedlineApplication.class, args);
    }
}
