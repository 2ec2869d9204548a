package com.placerank.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A place returned by the upstream search API.
 *
 * Immutable once fetched; the same instance may be served from cache to many callers.
 * Optional numeric features ({@code rating}, {@code priceTier}) are null when the upstream
 * did not report them.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Place {

    /**
     * Maximum photo references kept per place.
     */
    public static final int MAX_PHOTOS = 5;

    String id;

    String name;

    String address;

    Coordinates coordinates;

    /**
     * Rating in [0, 5], null when absent.
     */
    Double rating;

    /**
     * Price tier in 0..4, null when absent.
     */
    Integer priceTier;

    int reviewCount;

    @Builder.Default
    List<String> categoryTags = List.of();

    @Builder.Default
    OpenStatus openStatus = OpenStatus.UNKNOWN;

    String businessStatus;

    @Builder.Default
    List<String> photoReferences = List.of();

    String phoneNumber;

    String website;

    public boolean hasRating() {
        return rating != null;
    }

    public boolean hasPriceTier() {
        return priceTier != null;
    }

    /**
     * Copy with photo references capped at {@link #MAX_PHOTOS}.
     */
    public Place withPhotoCap() {
        if (photoReferences == null || photoReferences.size() <= MAX_PHOTOS) {
            return this;
        }
        return toBuilder()
                .photoReferences(List.copyOf(photoReferences.subList(0, MAX_PHOTOS)))
                .build();
    }
}
