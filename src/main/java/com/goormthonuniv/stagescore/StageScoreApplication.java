package com.goormthonuniv.stagescore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class StageScoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(StageScoreApplication.class, args);
    }
}
