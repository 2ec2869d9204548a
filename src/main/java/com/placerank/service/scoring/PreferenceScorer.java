package com.placerank.service.scoring;

import com.placerank.config.PlacerankProperties;
import com.placerank.model.OpenStatus;
import com.placerank.model.Place;
import com.placerank.model.ScoredPlace;
import com.placerank.model.UserPreferenceProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Composite scoring of places against a user's preferences.
 *
 * Combines four normalized signals:
 * - Rating (rating / 5, absent = 0) - PRIMARY
 * - Price fit (1 within budget, minus 0.25 per tier above it)
 * - Popularity (log-scaled review count, saturating at 100 reviews)
 * - Category match (highest preference weight among the place's types)
 *
 * Formula:
 * score = 0.4 * rating + 0.2 * priceFit + 0.2 * popularity + 0.2 * categoryMatch
 *
 * Places rated below the profile's minimum are excluded. Places without a rating are kept
 * by the rating floor, but ranking also drops every place scoring at or below the configured
 * threshold (0.3 by default).
 */
@Slf4j
@Service
public class PreferenceScorer {

    // Scoring weights (sum to 1)
    static final double WEIGHT_RATING = 0.4;
    static final double WEIGHT_PRICE = 0.2;
    static final double WEIGHT_POPULARITY = 0.2;
    static final double WEIGHT_CATEGORY = 0.2;

    static final double MAX_RATING = 5.0;
    static final double PRICE_PENALTY_PER_TIER = 0.25;
    static final int POPULARITY_SATURATION_REVIEWS = 100;
    static final double DEFAULT_CATEGORY_MATCH = 0.1;

    // Match reason thresholds
    static final double HIGH_RATING = 4.0;
    static final int BUDGET_FRIENDLY_MAX_TIER = 2;
    static final int WELL_REVIEWED_MIN_REVIEWS = 10;
    static final double INTEREST_MATCH_WEIGHT = 0.5;
    static final int MAX_REASONS = 3;

    public static final String REASON_HIGH_RATING = "high rating";
    public static final String REASON_BUDGET_FRIENDLY = "budget friendly";
    public static final String REASON_WELL_REVIEWED = "well reviewed";
    public static final String REASON_MATCHES_INTERESTS = "matches your interests";
    public static final String REASON_OPEN_NOW = "open now";

    /**
     * Score, then reviews, then name.
     */
    static final Comparator<ScoredPlace> RANKING = Comparator
            .comparingDouble(ScoredPlace::getAiScore).reversed()
            .thenComparing(scored -> scored.getPlace().getReviewCount(), Comparator.reverseOrder())
            .thenComparing(scored -> nameOf(scored.getPlace()));

    private final double scoreThreshold;

    public PreferenceScorer(PlacerankProperties properties) {
        this.scoreThreshold = properties.getRecommendation().getScoreThreshold();
    }

    /**
     * Score one place.
     *
     * @param place   candidate place
     * @param profile user preferences
     * @return the scored place, or empty when its rating is below the profile minimum
     */
    public Optional<ScoredPlace> score(Place place, UserPreferenceProfile profile) {
        if (place.hasRating() && place.getRating() < profile.getMinimumRating()) {
            log.debug("Excluding '{}': rating {} below minimum {}",
                    place.getName(), place.getRating(), profile.getMinimumRating());
            return Optional.empty();
        }

        double rating = ratingScore(place);
        double priceFit = priceFitScore(place, profile);
        double popularity = popularityScore(place.getReviewCount());
        OptionalDouble interest = interestWeight(place, profile);
        double categoryMatch = interest.isPresent() ? interest.getAsDouble() : DEFAULT_CATEGORY_MATCH;

        double composite = WEIGHT_RATING * rating
                + WEIGHT_PRICE * priceFit
                + WEIGHT_POPULARITY * popularity
                + WEIGHT_CATEGORY * categoryMatch;

        return Optional.of(ScoredPlace.builder()
                .place(place)
                .aiScore(clamp(composite))
                .matchReasons(matchReasons(place, priceFit, interest))
                .breakdown(new ScoredPlace.ScoreBreakdown(rating, priceFit, popularity, categoryMatch))
                .build());
    }

    /**
     * Score every place, drop excluded ones and those not above the score threshold,
     * then sort best first.
     */
    public List<ScoredPlace> rank(List<Place> places, UserPreferenceProfile profile) {
        List<ScoredPlace> ranked = places.stream()
                .map(place -> score(place, profile))
                .flatMap(Optional::stream)
                .filter(this::aboveThreshold)
                .sorted(RANKING)
                .collect(Collectors.toList());

        log.debug("Ranked {} of {} places", ranked.size(), places.size());
        return ranked;
    }

    private boolean aboveThreshold(ScoredPlace scored) {
        if (scored.getAiScore() > scoreThreshold) {
            return true;
        }
        log.debug("Excluding '{}': score {} not above threshold {}",
                scored.getPlace().getName(), scored.getAiScore(), scoreThreshold);
        return false;
    }

    double ratingScore(Place place) {
        if (!place.hasRating()) {
            return 0.0;
        }
        return clamp(place.getRating() / MAX_RATING);
    }

    double priceFitScore(Place place, UserPreferenceProfile profile) {
        if (!place.hasPriceTier() || place.getPriceTier() <= profile.getMaximumPriceTier()) {
            return 1.0;
        }
        int tiersOver = place.getPriceTier() - profile.getMaximumPriceTier();
        return Math.max(0.0, 1.0 - PRICE_PENALTY_PER_TIER * tiersOver);
    }

    double popularityScore(int reviewCount) {
        if (reviewCount <= 0) {
            return 0.0;
        }
        return Math.min(1.0, Math.log1p(reviewCount) / Math.log1p(POPULARITY_SATURATION_REVIEWS));
    }

    /**
     * Highest preference weight among the place's types, if any type is weighted.
     */
    private OptionalDouble interestWeight(Place place, UserPreferenceProfile profile) {
        if (place.getCategoryTags() == null) {
            return OptionalDouble.empty();
        }
        return place.getCategoryTags().stream()
                .map(profile::weightFor)
                .filter(OptionalDouble::isPresent)
                .mapToDouble(weight -> clamp(weight.getAsDouble()))
                .max();
    }

    private List<String> matchReasons(Place place, double priceFit, OptionalDouble interest) {
        List<String> reasons = new ArrayList<>(MAX_REASONS);

        if (place.hasRating() && place.getRating() >= HIGH_RATING) {
            reasons.add(REASON_HIGH_RATING);
        }
        if (priceFit == 1.0 && place.hasPriceTier() && place.getPriceTier() <= BUDGET_FRIENDLY_MAX_TIER) {
            reasons.add(REASON_BUDGET_FRIENDLY);
        }
        if (place.getReviewCount() >= WELL_REVIEWED_MIN_REVIEWS) {
            reasons.add(REASON_WELL_REVIEWED);
        }
        if (interest.isPresent() && interest.getAsDouble() >= INTEREST_MATCH_WEIGHT) {
            reasons.add(REASON_MATCHES_INTERESTS);
        }
        if (place.getOpenStatus() == OpenStatus.OPEN) {
            reasons.add(REASON_OPEN_NOW);
        }

        return List.copyOf(reasons.subList(0, Math.min(MAX_REASONS, reasons.size())));
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String nameOf(Place place) {
        return place.getName() == null ? "" : place.getName();
    }
}
