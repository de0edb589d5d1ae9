package com.partd.campusqa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication
@EnableJpaRepositories
public class CampusQaApplication {
    public static void main(String[] args) {
        SpringApplication.run(CampusQaApplication.class, args);
    }
}
