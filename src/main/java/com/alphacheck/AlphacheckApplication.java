package com.alphacheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AlphacheckApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlphacheckApplication.class, args);
    }
}
