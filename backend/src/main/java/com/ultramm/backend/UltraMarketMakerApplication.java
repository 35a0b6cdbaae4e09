package com.ultramm.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class UltraMarketMakerApplication {
    public static void main(String[] args) {
        SpringApplication.run(UltraMarketMakerApplication.class, args);
    }
}
