package com.dealbot.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.dealbot")
@EntityScan("com.dealbot.data.entity")
@EnableJpaRepositories("com.dealbot.data.repository")
@EnableScheduling
public class DealbotApplication {

    public static void main(String[] args) {
        SpringApplication.run(DealbotApplication.class, args);
    }
}
