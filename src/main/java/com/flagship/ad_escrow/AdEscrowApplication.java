package com.flagship.ad_escrow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

@SpringBootApplication
@EnableRetry
public class AdEscrowApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdEscrowApplication.class, args);
    }
}
