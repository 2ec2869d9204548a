package com.placerank.service;

import com.placerank.model.Place;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Bounds a place list: duplicates by id are dropped (first occurrence wins), then the first
 * {@code maxCount} places are kept in their original order.
 */
@Component
public class ResultLimiter {

    public List<Place> limit(List<Place> places, int maxCount) {
        if (places == null || places.isEmpty() || maxCount <= 0) {
            return List.of();
        }

        Set<String> seen = new HashSet<>();
        List<Place> limited = new ArrayList<>(Math.min(maxCount, places.size()));
        for (Place place : places) {
            if (limited.size() == maxCount) {
                break;
            }
            // Places without an id cannot be duplicates of each other
            if (place.getId() != null && !seen.add(place.getId())) {
                continue;
            }
            limited.add(place);
        }
        return List.copyOf(limited);
    }
}
