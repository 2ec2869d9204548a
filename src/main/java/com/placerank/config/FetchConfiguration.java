package com.placerank.config;

import com.placerank.provider.PlacesSearchClient;
import com.placerank.provider.UnconfiguredPlacesSearchClient;
import com.placerank.service.fetch.FetchSettings;
import com.placerank.service.fetch.Pacer;
import com.placerank.service.fetch.RetryPolicy;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Upstream fetch configuration: settings, retry policy, pacing and the shared upstream bulkhead.
 */
@Configuration
public class FetchConfiguration {

    public static final String UPSTREAM_BULKHEAD = "placesUpstream";

    private final PlacerankProperties properties;

    public FetchConfiguration(PlacerankProperties properties) {
        this.properties = properties;
    }

    @Bean
    public FetchSettings fetchSettings() {
        return FetchSettings.from(properties);
    }

    @Bean
    public RetryPolicy retryPolicy() {
        return RetryPolicy.from(properties.getFetch());
    }

    @Bean
    public Pacer pacer() {
        return Pacer.reactorDelay();
    }

    @Bean
    public BulkheadRegistry bulkheadRegistry() {
        PlacerankProperties.FetchConfig fetch = properties.getFetch();
        BulkheadConfig config = BulkheadConfig.custom()
                .maxConcurrentCalls(fetch.getMaxConcurrentUpstreamCalls())
                .maxWaitDuration(fetch.getUpstreamSlotWait())
                .build();
        return BulkheadRegistry.of(config);
    }

    /**
     * Process-wide cap on in-flight upstream calls, shared by every category fetch.
     */
    @Bean
    public Bulkhead upstreamBulkhead(BulkheadRegistry bulkheadRegistry) {
        return bulkheadRegistry.bulkhead(UPSTREAM_BULKHEAD);
    }

    @Bean
    @ConditionalOnMissingBean(PlacesSearchClient.class)
    public PlacesSearchClient placesSearchClient() {
        return new UnconfiguredPlacesSearchClient();
    }
}
