package com.kotsin.aggregation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot entry point: batches uploaded CSV records and aggregates them over sliding windows.
 */
@SpringBootApplication
@EnableScheduling
public class StreamingAggregatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamingAggregatorApplication.class, args);
    }
}
