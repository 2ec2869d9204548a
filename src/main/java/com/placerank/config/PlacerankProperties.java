package com.placerank.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for Placerank.
 */
@Data
@Component
@ConfigurationProperties(prefix = "placerank")
public class PlacerankProperties {

    private CacheConfig cache = new CacheConfig();
    private FetchConfig fetch = new FetchConfig();
    private RecommendationConfig recommendation = new RecommendationConfig();
    private Map<String, CategoryConfig> categories = new LinkedHashMap<>();
    private Map<String, DestinationConfig> destinations = new LinkedHashMap<>();

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private String directory = "cache";
        private Duration ttl = Duration.ofHours(1);
        private int memoMaxSize = 1000;
    }

    @Data
    public static class FetchConfig {
        /**
         * Per-category ceiling on raw results requested upstream.
         */
        private int maxResults = 8;
        private int batchSize = 3;
        private Duration pacing = Duration.ofMillis(100);
        private int maxRetries = 2;
        private boolean exponentialBackoff = false;
        private Duration maxBackoff = Duration.ofSeconds(2);
        private int maxConcurrentUpstreamCalls = 6;
        /**
         * How long a call may wait for a free upstream slot before failing as unavailable.
         */
        private Duration upstreamSlotWait = Duration.ofSeconds(10);
        private int defaultRadius = 20000;
        private String language = "es";
        private boolean fetchDetails = true;
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class RecommendationConfig {
        private int topPerCategory = 5;
        /**
         * Ranked places must score above this to be recommended.
         */
        private double scoreThreshold = 0.3;
        private List<String> defaultCategories = List.of("restaurants", "attractions", "hotels");
    }

    @Data
    public static class CategoryConfig {
        /**
         * Upstream place type used as the type filter.
         */
        private String type;
        /**
         * Default query text, the destination name is appended.
         */
        private String query;
    }

    @Data
    public static class DestinationConfig {
        private String name;
        private double latitude;
        private double longitude;
    }
}
