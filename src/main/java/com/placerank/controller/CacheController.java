package com.placerank.controller;

import com.placerank.model.dto.CacheStatistics;
import com.placerank.service.RecommendationAssembler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Cache management controller.
 * Provides statistics, expiry purge and clear for the places cache.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final RecommendationAssembler assembler;

    public CacheController(RecommendationAssembler assembler) {
        this.assembler = assembler;
    }

    /**
     * Get cache statistics.
     */
    @GetMapping("/stats")
    public Mono<ResponseEntity<CacheStatistics>> getStats() {
        return assembler.cacheStats().map(ResponseEntity::ok);
    }

    /**
     * Remove expired records.
     */
    @PostMapping("/purge")
    public Mono<ResponseEntity<Map<String, Object>>> purgeExpired() {
        log.info("Cache purge requested");
        return assembler.purgeExpiredCache()
                .map(removed -> ResponseEntity.ok(Map.<String, Object>of(
                        "status", "success",
                        "removed", removed
                )));
    }

    /**
     * Clear the cache.
     */
    @PostMapping("/clear")
    public Mono<ResponseEntity<Map<String, Object>>> clearCache() {
        log.info("Cache clear requested");
        return assembler.clearCache()
                .map(removed -> ResponseEntity.ok(Map.<String, Object>of(
                        "status", "success",
                        "removed", removed
                )));
    }
}
