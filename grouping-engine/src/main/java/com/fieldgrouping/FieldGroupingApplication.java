package com.fieldgrouping;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FieldGroupingApplication {

    public static void main(String[] args) {
        SpringApplication.run(FieldGroupingApplication.class, args);
    }
}
