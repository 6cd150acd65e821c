package com.snapkeeper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SnapkeeperApplication {

    public static void main(String[] args) {
        SpringApplication.run(SnapkeeperApplication.class, args);
    }
}
