package org.example.verse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DailyVerseApplication {

    public static void main(String[] args) {
        SpringApplication.run(DailyVerseApplication.class, args);
    }
}
