package com.flagship.wager_escrow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WagerEscrowApplication {

    public static void main(String[] args) {
        SpringApplication.run(WagerEscrowApplication.class, args);
    }
}
