package com.ecocart.ecocart_backend.dto;

/**
 * Search criteria for substitutes. Null fields fall back to the configured {@code substitution.*} defaults.
 */
public class SubstitutionCriteria {

    private Double minScoreImprovement;
    private Boolean sameCategory;
    private Integer maxResults;
    private Double maxPriceIncrease;
    private DietaryRestrictions dietaryRestrictions;

    public SubstitutionCriteria() {
    }

    public Double getMinScoreImprovement() {
        return minScoreImprovement;
    }

    public void setMinScoreImprovement(Double minScoreImprovement) {
        this.minScoreImprovement = minScoreImprovement;
    }

    public Boolean getSameCategory() {
        return sameCategory;
    }

    public void setSameCategory(Boolean sameCategory) {
        this.sameCategory = sameCategory;
    }

    public Integer getMaxResults() {
        return maxResults;
    }

    public void setMaxResults(Integer maxResults) {
        this.maxResults = maxResults;
    }

    public Double getMaxPriceIncrease() {
        return maxPriceIncrease;
    }

    public void setMaxPriceIncrease(Double maxPriceIncrease) {
        this.maxPriceIncrease = maxPriceIncrease;
    }

    public DietaryRestrictions getDietaryRestrictions() {
        return dietaryRestrictions;
    }

    public void setDietaryRestrictions(DietaryRestrictions dietaryRestrictions) {
        this.dietaryRestrictions = dietaryRestrictions;
    }
}
