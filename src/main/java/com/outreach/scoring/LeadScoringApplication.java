package com.outreach.scoring;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LeadScoringApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeadScoringApplication.class, args);
    }
}
