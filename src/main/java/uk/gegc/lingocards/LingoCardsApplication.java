package uk.gegc.lingocards;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LingoCardsApplication {

    public static void main(String[] args) {
        SpringApplication.run(LingoCardsApplication.class, args);
    }

}
