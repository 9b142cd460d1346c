package com.socialfusion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SocialFusionApplication {

    public static void main(String[] args) {
        SpringApplication.run(SocialFusionApplication.class, args);
    }
}
