package com.example.pms.router.relation;

import com.example.pms.router.model.FkTier;

/**
 * Base scores per tier. The gap between adjacent tiers must exceed the largest possible
 * semantic boost ({@value #MAX_SEMANTIC_BOOST} at alpha 1) so that no amount of similarity
 * lets a weaker tier overtake a stronger one.
 */
public record TierWeights(int direct, int sameParent, int sameCategory) {

    public static final int MAX_SEMANTIC_BOOST = 100;

    public TierWeights {
        if (sameCategory < 0) {
            throw new IllegalArgumentException("Tier weights must be non-negative");
        }
        if (direct - sameParent <= MAX_SEMANTIC_BOOST || sameParent - sameCategory <= MAX_SEMANTIC_BOOST) {
            throw new IllegalArgumentException(String.format(
                    "Tier weights %d/%d/%d must be separated by more than %d",
                    direct, sameParent, sameCategory, MAX_SEMANTIC_BOOST));
        }
    }

    public static TierWeights defaults() {
        return new TierWeights(500, 300, 100);
    }

    public int weightOf(FkTier tier) {
        return switch (tier) {
            case DIRECT -> direct;
            case SAME_PARENT -> sameParent;
            case SAME_CATEGORY -> sameCategory;
        };
    }
}
