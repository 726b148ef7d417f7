package com.whereq.memori;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Memori worker.
 * Consumes LLM jobs from Redis Streams, runs them against a local model and
 * talks back to users through the chat gateway.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class MemoriWorkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoriWorkerApplication.class, args);
    }
}
