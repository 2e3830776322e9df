package com.tournament.platform;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TournamentPlatformApplication {

    public static void main(String[] args) {
        SpringApplication.run(TournamentPlatformApplication.class, args);
    }
}
