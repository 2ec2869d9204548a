package com.placerank.model;

/**
 * Budget descriptor of a user, mapped to the highest acceptable price tier.
 */
public enum BudgetRange {

    ECONOMY(3),

    MEDIUM(4),

    PREMIUM(4);

    private final int maximumPriceTier;

    BudgetRange(int maximumPriceTier) {
        this.maximumPriceTier = maximumPriceTier;
    }

    public int getMaximumPriceTier() {
        return maximumPriceTier;
    }
}
