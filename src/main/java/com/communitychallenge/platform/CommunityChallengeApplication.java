package com.communitychallenge.platform;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CommunityChallengeApplication {

    public static void main(String[] args) {
        SpringApplication.run(CommunityChallengeApplication.class, args);
    }
}
