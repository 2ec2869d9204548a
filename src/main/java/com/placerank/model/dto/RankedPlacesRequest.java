package com.placerank.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for ranking one category.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankedPlacesRequest {

    private String query;
    private Double latitude;
    private Double longitude;
    private Integer radius;
    private String type;
    private String language;
    private Integer maxCount;
    private ProfileRequest profile;
}
