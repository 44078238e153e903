package com.ecocart.ecocart_backend.model;

public record SustainabilityScore(double total, ScoreBreakdown breakdown, ScoreWeights weights) {

    public SustainabilityScore {
        breakdown = breakdown == null ? ScoreBreakdown.ZERO : breakdown;
        weights = weights == null ? ScoreWeights.DEFAULT : weights;
    }
}
