package com.belgraph.compiler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BelGraphCompilerApplication {
    public static void main(String[] args) {
        SpringApplication.run(BelGraphCompilerApplication.class, args);
    }
}
