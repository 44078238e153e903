package com.ecocart.ecocart_backend.model;

/**
 * Dimension weights for the composite score. The sum is not validated; callers are expected to pass weights
 * that add up to 1.0.
 */
public record ScoreWeights(double economic, double environmental, double social) {

    public static final ScoreWeights DEFAULT = new ScoreWeights(0.4, 0.4, 0.2);
}
