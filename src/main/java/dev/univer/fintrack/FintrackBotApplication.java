package dev.univer.fintrack;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FintrackBotApplication {
    public static void main(String[] args) {
        SpringApplication.run(FintrackBotApplication.class, args);
    }
}
