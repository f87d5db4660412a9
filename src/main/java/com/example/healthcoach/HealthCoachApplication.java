package com.example.healthcoach;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HealthCoachApplication {

    public static void main(String[] args) {
        SpringApplication.run(HealthCoachApplication.class, args);
    }

}
