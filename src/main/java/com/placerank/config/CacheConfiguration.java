package com.placerank.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.placerank.repository.CacheStore;
import com.placerank.repository.FileCacheStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Cache store configuration: gzip record files with a Caffeine memo in front.
 */
@Configuration
public class CacheConfiguration {

    private final PlacerankProperties properties;

    public CacheConfiguration(PlacerankProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CacheStore cacheStore(ObjectMapper objectMapper, Clock clock) {
        PlacerankProperties.CacheConfig cache = properties.getCache();
        return new FileCacheStore(
                Path.of(cache.getDirectory()),
                cache.getTtl(),
                cache.getMemoMaxSize(),
                objectMapper,
                clock);
    }
}
