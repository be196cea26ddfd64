package com.ace.eval;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AceEvalApplication {
    public static void main(String[] args) {
        SpringApplication.run(AceEvalApplication.class, args);
    }
}
