package dev.univer.notoc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class NotocBotApplication {
    public static void main(String[] args) {
        SpringApplication.run(NotocBotApplication.class, args);
    }
}
