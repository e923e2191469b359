package com.wanradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WanRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(WanRadarApplication.class, args);
    }
}
