package com.fedsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FedSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(FedSearchApplication.class, args);
    }
}
