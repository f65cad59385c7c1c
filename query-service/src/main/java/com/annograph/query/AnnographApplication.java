package com.annograph.query;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.annograph")
@EnableScheduling
public class AnnographApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnnographApplication.class, args);
    }
}
