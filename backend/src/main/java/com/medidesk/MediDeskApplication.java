package com.medidesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MediDeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediDeskApplication.class, args);
    }
}
