package com.purchasingpower.workgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorkGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkGraphApplication.class, args);
    }
}
