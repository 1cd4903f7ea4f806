package com.ardesk.collections;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CollectionsEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CollectionsEngineApplication.class, args);
    }
}
