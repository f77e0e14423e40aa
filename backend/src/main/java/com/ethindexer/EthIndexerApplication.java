package com.ethindexer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EthIndexerApplication {

    public static void main(String[] args) {
        SpringApplication.run(EthIndexerApplication.class, args);
    }
}
