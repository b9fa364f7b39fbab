package com.bayesenum.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BayesEnumApplication {

    public static void main(String[] args) {
        SpringApplication.run(BayesEnumApplication.class, args);
    }
}
