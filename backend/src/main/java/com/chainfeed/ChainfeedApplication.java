package com.chainfeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChainfeedApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChainfeedApplication.class, args);
    }
}
