package com.placerank.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body for multi-category recommendations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationRequest {

    private String destination;
    private Double latitude;
    private Double longitude;
    private List<String> categories;
    private String query;
    private Integer radius;
    private ProfileRequest profile;
}
