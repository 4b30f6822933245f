package com.infergate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Infergate - OpenAI-compatible gateway in front of a single vLLM backend.
 */
@SpringBootApplication
public class InfergateApplication {

    public static void main(String[] args) {
        SpringApplication.run(InfergateApplication.class, args);
    }
}
