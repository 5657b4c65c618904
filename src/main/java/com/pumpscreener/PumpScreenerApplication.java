package com.pumpscreener;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PumpScreenerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PumpScreenerApplication.class, args);
    }
}
