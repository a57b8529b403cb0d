package com.flagship.entity_store;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class EntityStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(EntityStoreApplication.class, args);
    }
}
