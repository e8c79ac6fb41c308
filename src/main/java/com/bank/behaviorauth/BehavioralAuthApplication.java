package com.bank.behaviorauth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class BehavioralAuthApplication {

    public static void main(String[] args) {
        SpringApplication.run(BehavioralAuthApplication.class, args);
    }
}
