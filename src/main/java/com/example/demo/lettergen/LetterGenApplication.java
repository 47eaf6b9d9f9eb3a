package com.example.demo.lettergen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LetterGenApplication {

    public static void main(String[] args) {
        SpringApplication.run(LetterGenApplication.class, args);
    }
}
