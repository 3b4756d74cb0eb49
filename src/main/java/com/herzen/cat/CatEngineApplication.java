package com.herzen.cat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CatEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(CatEngineApplication.class, args);
    }
}
