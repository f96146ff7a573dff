package com.purchasingpower.signalintel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SignalIntelligenceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalIntelligenceApplication.class, args);
    }
}
