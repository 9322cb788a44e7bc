package com.linkfolio.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LinkfolioAuthApplication {

    public static void main(String[] args) {
        SpringApplication.run(LinkfolioAuthApplication.class, args);
    }
}
