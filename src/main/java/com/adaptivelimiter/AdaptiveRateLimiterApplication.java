package com.adaptivelimiter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AdaptiveRateLimiterApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdaptiveRateLimiterApplication.class, args);
    }
}
