package com.placerank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Placerank - quota-aware places cache and preference ranking.
 */
@SpringBootApplication
public class PlacerankApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlacerankApplication.class, args);
    }
}
