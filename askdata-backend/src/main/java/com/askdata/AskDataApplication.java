package com.askdata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point of the ask-your-data backend.
 */
@SpringBootApplication
public class AskDataApplication {

    public static void main(String[] args) {
        SpringApplication.run(AskDataApplication.class, args);
    }
}
