package com.ecocart.ecocart_backend.dto;

public class OptimizationOptions {

    private Double minScore;
    private Boolean prioritizeSustainability;
    private Boolean allowPartial;

    public OptimizationOptions() {
    }

    public OptimizationOptions(Double minScore, Boolean prioritizeSustainability, Boolean allowPartial) {
        this.minScore = minScore;
        this.prioritizeSustainability = prioritizeSustainability;
        this.allowPartial = allowPartial;
    }

    public Double getMinScore() {
        return minScore;
    }

    public void setMinScore(Double minScore) {
        this.minScore = minScore;
    }

    public Boolean getPrioritizeSustainability() {
        return prioritizeSustainability;
    }

    public void setPrioritizeSustainability(Boolean prioritizeSustainability) {
        this.prioritizeSustainability = prioritizeSustainability;
    }

    // Accepted for request compatibility; no strategy reads it.
    public Boolean getAllowPartial() {
        return allowPartial;
    }

    public void setAllowPartial(Boolean allowPartial) {
        this.allowPartial = allowPartial;
    }
}
