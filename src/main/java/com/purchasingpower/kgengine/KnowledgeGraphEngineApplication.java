package com.purchasingpower.kgengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KnowledgeGraphEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(KnowledgeGraphEngineApplication.class, args);
    }
}
