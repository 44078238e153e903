package com.ecocart.ecocart_backend.model;

public record SubstituteCandidate(
        ScoredProduct candidate,
        double economicImprovement,
        double environmentalImprovement,
        double socialImprovement,
        double priceDifference,
        double categoryBonus,
        RecommendationType recommendationType
) {

    public Product product() {
        return candidate.product();
    }

    public double total() {
        return candidate.totalOrZero();
    }

    public double adjustedScore() {
        return candidate.totalOrZero() + categoryBonus;
    }

    public String recommendationLabel() {
        return recommendationType == null ? "" : recommendationType.getLabel();
    }

    public SubstituteCandidate labelled(RecommendationType type) {
        return new SubstituteCandidate(candidate, economicImprovement, environmentalImprovement, socialImprovement,
                priceDifference, categoryBonus, type);
    }
}
