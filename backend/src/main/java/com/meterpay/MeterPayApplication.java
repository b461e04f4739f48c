package com.meterpay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MeterPayApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeterPayApplication.class, args);
    }
}
