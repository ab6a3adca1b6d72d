package com.example.audioextract;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AudioExtractApplication {

    public static void main(String[] args) {
        SpringApplication.run(AudioExtractApplication.class, args);
    }
}
