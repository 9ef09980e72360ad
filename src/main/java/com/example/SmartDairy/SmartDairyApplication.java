package com.example.SmartDairy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SmartDairyApplication {

    public static void main(String[] args) {
        SpringApplication.run(SmartDairyApplication.class, args);
    }
}
