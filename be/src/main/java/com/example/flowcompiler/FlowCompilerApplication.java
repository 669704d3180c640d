package com.example.flowcompiler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlowCompilerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowCompilerApplication.class, args);
    }
}
