package com.catalogizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CatalogizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CatalogizerApplication.class, args);
    }
}
