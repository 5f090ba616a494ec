package com.iptvcheck.validator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class IptvValidatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(IptvValidatorApplication.class, args);
    }
}
