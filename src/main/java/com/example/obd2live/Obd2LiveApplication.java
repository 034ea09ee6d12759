package com.example.obd2live;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Obd2LiveApplication {

    public static void main(String[] args) {
        SpringApplication.run(Obd2LiveApplication.class, args);
    }
}
