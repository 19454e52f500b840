package com.example.threadlog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ThreadLogApplication {

    public static void main(String[] args) {
        SpringApplication.run(ThreadLogApplication.class, args);
    }

}
