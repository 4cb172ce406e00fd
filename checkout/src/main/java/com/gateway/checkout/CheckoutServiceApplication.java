package com.gateway.checkout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Checkout Service — Entry Point
 *
 * Event-sourced checkout sessions, idempotent writes, signed webhooks.
 *
 * Port: 8080 (see application.yml)
 */
@SpringBootApplication(scanBasePackages = {"com.gateway.checkout", "com.gateway.shared"})
public class CheckoutServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(CheckoutServiceApplication.class, args);
    }
}
