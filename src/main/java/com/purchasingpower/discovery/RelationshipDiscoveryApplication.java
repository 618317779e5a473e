package com.purchasingpower.discovery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RelationshipDiscoveryApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelationshipDiscoveryApplication.class, args);
    }

}
