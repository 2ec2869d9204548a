package com.placerank.controller;

import com.placerank.config.PlacerankProperties;
import com.placerank.exception.QuotaExceededException;
import com.placerank.exception.UpstreamUnavailableException;
import com.placerank.model.CategoryRecommendation;
import com.placerank.model.RecommendationQuery;
import com.placerank.model.RecommendationResult;
import com.placerank.model.ScoredPlace;
import com.placerank.model.SearchParams;
import com.placerank.model.UserPreferenceProfile;
import com.placerank.service.RecommendationAssembler;
import com.placerank.support.TestPlaces;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for RecommendationController and its error mapping.
 */
@ExtendWith(MockitoExtension.class)
class RecommendationControllerTest {

    @Mock
    private RecommendationAssembler assembler;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        PlacerankProperties properties = new PlacerankProperties();
        PlacerankProperties.CategoryConfig museums = new PlacerankProperties.CategoryConfig();
        museums.setType("museum");
        museums.setQuery("museos");
        properties.getCategories().put("museums", museums);

        client = WebTestClient.bindToController(new RecommendationController(assembler, properties))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void rankCategoryUsesCatalogDefaults() {
        ScoredPlace scored = ScoredPlace.builder()
                .place(TestPlaces.rated("m1", "Museo del Oro", 4.8, 120))
                .aiScore(0.91)
                .matchReasons(List.of("high rating", "well reviewed"))
                .build();
        when(assembler.getRankedPlaces(eq("museums"), any(), any(), anyInt())).thenReturn(Mono.just(List.of(scored)));

        client.post().uri("/v1/recommendations/museums")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("latitude", 4.6097, "longitude", -74.0817, "maxCount", 5))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].place.id").isEqualTo("m1")
                .jsonPath("$[0].aiScore").isEqualTo(0.91)
                .jsonPath("$[0].matchReasons[0]").isEqualTo("high rating");

        ArgumentCaptor<SearchParams> params = ArgumentCaptor.forClass(SearchParams.class);
        verify(assembler).getRankedPlaces(eq("museums"), params.capture(), any(UserPreferenceProfile.class), eq(5));
        assertThat(params.getValue().getTypeFilter()).isEqualTo("museum");
        assertThat(params.getValue().getQuery()).isEqualTo("museos");
        assertThat(params.getValue().getRadius()).isEqualTo(20000);
    }

    @Test
    void rankCategoryRequiresCoordinates() {
        client.post().uri("/v1/recommendations/museums")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "museos"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("bad_request");
    }

    @Test
    void quotaExhaustionMapsTo429() {
        when(assembler.getRankedPlaces(any(), any(), any(), anyInt()))
                .thenReturn(Mono.error(new QuotaExceededException("OVER_QUERY_LIMIT")));

        client.post().uri("/v1/recommendations/museums")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("latitude", 4.6097, "longitude", -74.0817))
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.TOO_MANY_REQUESTS)
                .expectBody()
                .jsonPath("$.code").isEqualTo("quota_exceeded");
    }

    @Test
    void upstreamUnavailableMapsTo503() {
        when(assembler.getRankedPlaces(any(), any(), any(), anyInt()))
                .thenReturn(Mono.error(new UpstreamUnavailableException("connection reset")));

        client.post().uri("/v1/recommendations/museums")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("latitude", 4.6097, "longitude", -74.0817))
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.SERVICE_UNAVAILABLE)
                .expectBody()
                .jsonPath("$.code").isEqualTo("upstream_unavailable");
    }

    @Test
    void recommendReturnsCategoriesInOrder() {
        Map<String, CategoryRecommendation> categories = new LinkedHashMap<>();
        categories.put("museums", CategoryRecommendation.builder().category("museums").totalFound(4).aiFiltered(3).build());
        categories.put("hotels", CategoryRecommendation.failed("hotels", "quota_exceeded"));
        when(assembler.recommend(any(), any())).thenReturn(Mono.just(RecommendationResult.builder()
                .destination("bogota")
                .generatedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .categories(categories)
                .build()));

        client.post().uri("/v1/recommendations")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of(
                        "destination", "bogota",
                        "categories", List.of("museums", "hotels"),
                        "profile", Map.of("travelStyle", "CULTURAL", "budget", "MEDIUM")))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.destination").isEqualTo("bogota")
                .jsonPath("$.categories.museums.totalFound").isEqualTo(4)
                .jsonPath("$.categories.hotels.failureReason").isEqualTo("quota_exceeded");

        ArgumentCaptor<RecommendationQuery> query = ArgumentCaptor.forClass(RecommendationQuery.class);
        ArgumentCaptor<UserPreferenceProfile> profile = ArgumentCaptor.forClass(UserPreferenceProfile.class);
        verify(assembler).recommend(query.capture(), profile.capture());
        assertThat(query.getValue().getCategories()).containsExactly("museums", "hotels");
        assertThat(profile.getValue().getMinimumRating()).isEqualTo(4.0);
    }
}
