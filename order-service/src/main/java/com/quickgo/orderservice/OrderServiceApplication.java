package com.quickgo.orderservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

// Scans com.quickgo so the shared JacksonConfig from common is picked up
@SpringBootApplication(scanBasePackages = "com.quickgo")
public class OrderServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderServiceApplication.class, args);
    }
}
