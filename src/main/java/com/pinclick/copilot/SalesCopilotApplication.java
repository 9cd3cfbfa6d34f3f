package com.pinclick.copilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SalesCopilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalesCopilotApplication.class, args);
    }
}
