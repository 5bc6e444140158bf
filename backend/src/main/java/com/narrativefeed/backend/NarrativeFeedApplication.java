package com.narrativefeed.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class NarrativeFeedApplication {

    public static void main(String[] args) {
        SpringApplication.run(NarrativeFeedApplication.class, args);
    }
}
