package com.placerank.model.dto;

import com.placerank.model.BudgetRange;
import com.placerank.model.TravelStyle;
import com.placerank.model.UserPreferenceProfile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * User preferences as sent by clients.
 * Either a travel style (with optional budget) or explicit values; explicit values win.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileRequest {

    private TravelStyle travelStyle;
    private BudgetRange budget;
    private Double minimumRating;
    private Integer maximumPriceTier;
    private Map<String, Double> preferredCategoryWeights;

    public UserPreferenceProfile toProfile() {
        UserPreferenceProfile base = travelStyle != null
                ? UserPreferenceProfile.forTravelStyle(travelStyle, budget)
                : UserPreferenceProfile.builder().budget(budget).build();

        if (budget != null && travelStyle == null) {
            base = base.toBuilder().maximumPriceTier(budget.getMaximumPriceTier()).build();
        }

        UserPreferenceProfile.UserPreferenceProfileBuilder builder = base.toBuilder();
        if (minimumRating != null) {
            builder.minimumRating(minimumRating);
        }
        if (maximumPriceTier != null) {
            builder.maximumPriceTier(maximumPriceTier);
        }
        if (preferredCategoryWeights != null) {
            builder.preferredCategoryWeights(Map.copyOf(preferredCategoryWeights));
        }
        return builder.build();
    }
}
