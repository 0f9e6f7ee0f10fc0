package com.stream.capacity.topograph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TopographApplication {

    public static void main(String[] args) {
        SpringApplication.run(TopographApplication.class, args);
    }
}
