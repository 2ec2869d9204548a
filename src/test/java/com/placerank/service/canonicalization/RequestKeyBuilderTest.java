package com.placerank.service.canonicalization;

import com.placerank.model.CacheKey;
import com.placerank.model.Coordinates;
import com.placerank.model.SearchParams;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RequestKeyBuilder.
 */
class RequestKeyBuilderTest {

    private RequestKeyBuilder keyBuilder;

    @BeforeEach
    void setUp() {
        keyBuilder = new RequestKeyBuilder();
    }

    @Test
    void testSameRequestSameKey() {
        CacheKey first = keyBuilder.build("restaurantes Bogota", Coordinates.of(4.6097, -74.0817), 20000, "restaurant");
        CacheKey second = keyBuilder.build("restaurantes Bogota", Coordinates.of(4.6097, -74.0817), 20000, "restaurant");

        assertEquals(first, second);
        assertTrue(first.value().startsWith("search:"));
        assertEquals("search:".length() + 64, first.value().length());
    }

    @Test
    void testCaseAndWhitespaceNormalized() {
        CacheKey plain = keyBuilder.build("museos bogota", Coordinates.of(4.6097, -74.0817), 5000, "museum");
        CacheKey messy = keyBuilder.build("  Museos   BOGOTA ", Coordinates.of(4.6097, -74.0817), 5000, "museum");

        assertEquals(plain, messy);
    }

    @Test
    void testParameterOrderIndependent() {
        SearchParams queryFirst = SearchParams.builder()
                .query("parques")
                .location(Coordinates.of(6.2442, -75.5812))
                .radius(1000)
                .typeFilter("park")
                .build();
        SearchParams typeFirst = SearchParams.builder()
                .typeFilter("park")
                .radius(1000)
                .location(Coordinates.of(6.2442, -75.5812))
                .query("parques")
                .build();

        assertEquals(keyBuilder.build(queryFirst), keyBuilder.build(typeFirst));
        assertEquals(keyBuilder.canonicalize(queryFirst), keyBuilder.canonicalize(typeFirst));
    }

    @Test
    void testNearbyLocationsCollapse() {
        CacheKey a = keyBuilder.build("hoteles", Coordinates.of(4.60971, -74.08172), null, null);
        CacheKey b = keyBuilder.build("hoteles", Coordinates.of(4.60974, -74.08168), null, null);

        assertEquals(a, b);
    }

    @Test
    void testDifferentParametersDifferentKeys() {
        Coordinates bogota = Coordinates.of(4.6097, -74.0817);
        CacheKey base = keyBuilder.build("hoteles", bogota, 20000, "lodging");

        assertNotEquals(base, keyBuilder.build("hoteles", bogota, 10000, "lodging"));
        assertNotEquals(base, keyBuilder.build("hoteles", bogota, 20000, "restaurant"));
        assertNotEquals(base, keyBuilder.build("hostales", bogota, 20000, "lodging"));
        assertNotEquals(base, keyBuilder.build("hoteles", Coordinates.of(6.2442, -75.5812), 20000, "lodging"));
    }

    @Test
    void testAbsentParametersOmitted() {
        String canonical = keyBuilder.canonicalize(SearchParams.builder().query("Cafe").build());

        assertEquals("{\"query\":\"cafe\"}", canonical);
    }

    @Test
    void testCanonicalFormSortedAndRounded() {
        String canonical = keyBuilder.canonicalize(SearchParams.builder()
                .query("Bares")
                .location(Coordinates.of(10.39104, -75.47946))
                .radius(500)
                .typeFilter("bar")
                .language("ES")
                .build());

        assertEquals("{\"language\":\"es\",\"location\":\"10.3910,-75.4795\",\"query\":\"bares\","
                + "\"radius\":\"500\",\"type\":\"bar\"}", canonical);
    }

    @Test
    void testLanguageChangesKey() {
        SearchParams spanish = SearchParams.builder().query("museos").language("es").build();
        SearchParams english = spanish.toBuilder().language("en").build();

        assertNotEquals(keyBuilder.build(spanish), keyBuilder.build(english));
    }

    @Test
    void testNullQueryTreatedAsEmpty() {
        assertEquals(keyBuilder.build(SearchParams.builder().query("").build()),
                keyBuilder.build(SearchParams.builder().build()));
    }

    @Test
    void testDetailsKey() {
        assertEquals("details:ChIJ123", keyBuilder.detailsKey(" ChIJ123 ").value());
        assertThrows(IllegalArgumentException.class, () -> keyBuilder.detailsKey(" "));
    }
}
