package com.example.game2048;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Game2048Application {

    public static void main(String[] args) {
        SpringApplication.run(Game2048Application.class, args);
    }

}
