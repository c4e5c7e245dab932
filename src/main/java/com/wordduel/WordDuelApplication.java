package com.wordduel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WordDuelApplication {
    public static void main(String[] args) {
        SpringApplication.run(WordDuelApplication.class, args);
    }
}
