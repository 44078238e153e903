package com.ecocart.ecocart_backend.model;

public record ScoredProduct(Product product, SustainabilityScore score) {

    public boolean isScored() {
        return score != null;
    }

    public double totalOrZero() {
        return score == null ? 0.0 : score.total();
    }

    public ScoreBreakdown breakdownOrZero() {
        return score == null ? ScoreBreakdown.ZERO : score.breakdown();
    }

    public ScoredProduct withQuantity(int quantity) {
        return new ScoredProduct(product.withQuantity(quantity), score);
    }
}
