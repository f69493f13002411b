package com.queryguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QueryGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueryGuardApplication.class, args);
    }
}
