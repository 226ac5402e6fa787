package com.example.surveysession;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SurveySessionApplication {

    public static void main(String[] args) {
        SpringApplication.run(SurveySessionApplication.class, args);
    }
}
