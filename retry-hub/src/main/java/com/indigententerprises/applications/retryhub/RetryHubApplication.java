package com.indigententerprises.applications.retryhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RetryHubApplication {

    public static void main(final String[] args) {
        SpringApplication.run(RetryHubApplication.class, args);
    }
}
