package com.hpcwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class HpcWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(HpcWatchApplication.class, args);
    }
}
