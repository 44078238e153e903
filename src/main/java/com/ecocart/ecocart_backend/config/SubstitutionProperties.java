package com.ecocart.ecocart_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "substitution")
public class SubstitutionProperties {

    private double minScoreImprovement = 0.1;
    private boolean sameCategory = true;
    private int maxResults = 5;
    private double maxPriceIncrease = 0.2;
    private String rulesResource = "classpath:substitution/category-rules.json";
    private Tolerances tolerances = new Tolerances();
    private Best best = new Best();

    public double getMinScoreImprovement() {
        return minScoreImprovement;
    }

    public void setMinScoreImprovement(double minScoreImprovement) {
        this.minScoreImprovement = minScoreImprovement;
    }

    public boolean isSameCategory() {
        return sameCategory;
    }

    public void setSameCategory(boolean sameCategory) {
        this.sameCategory = sameCategory;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public void setMaxResults(int maxResults) {
        this.maxResults = maxResults;
    }

    public double getMaxPriceIncrease() {
        return maxPriceIncrease;
    }

    public void setMaxPriceIncrease(double maxPriceIncrease) {
        this.maxPriceIncrease = maxPriceIncrease;
    }

    public String getRulesResource() {
        return rulesResource;
    }

    public void setRulesResource(String rulesResource) {
        this.rulesResource = rulesResource;
    }

    public Tolerances getTolerances() {
        return tolerances;
    }

    public void setTolerances(Tolerances tolerances) {
        this.tolerances = tolerances;
    }

    public Best getBest() {
        return best;
    }

    public void setBest(Best best) {
        this.best = best;
    }

    public static class Tolerances {
        private double sharedCategory = 0.05;
        private double similarCategory = 0.03;
        private double balanced = 0.02;
        private double dimensionTieMargin = 0.05;

        public double getSharedCategory() {
            return sharedCategory;
        }

        public void setSharedCategory(double sharedCategory) {
            this.sharedCategory = sharedCategory;
        }

        public double getSimilarCategory() {
            return similarCategory;
        }

        public void setSimilarCategory(double similarCategory) {
            this.similarCategory = similarCategory;
        }

        public double getBalanced() {
            return balanced;
        }

        public void setBalanced(double balanced) {
            this.balanced = balanced;
        }

        public double getDimensionTieMargin() {
            return dimensionTieMargin;
        }

        public void setDimensionTieMargin(double dimensionTieMargin) {
            this.dimensionTieMargin = dimensionTieMargin;
        }
    }

    public static class Best {
        private double minScoreImprovement = 0.05;
        private int maxResults = 10;

        public double getMinScoreImprovement() {
            return minScoreImprovement;
        }

        public void setMinScoreImprovement(double minScoreImprovement) {
            this.minScoreImprovement = minScoreImprovement;
        }

        public int getMaxResults() {
            return maxResults;
        }

        public void setMaxResults(int maxResults) {
            this.maxResults = maxResults;
        }
    }
}
