package org.example.diary;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DiaryApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(DiaryApplication.class, args)));
    }
}
