package com.ecocart.ecocart_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import com.ecocart.ecocart_backend.model.ScoreWeights;

@Component
@ConfigurationProperties(prefix = "scoring")
public class ScoringProperties {

    private String version = "v1-weighted";
    private double neutralScore = 0.5;
    private double priceCeiling = 50.0;
    private double carbonCeilingKg = 5.0;
    private double carbonBlendWeight = 0.3;
    private Weights weights = new Weights();
    private Bonuses bonuses = new Bonuses();

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public double getNeutralScore() {
        return neutralScore;
    }

    public void setNeutralScore(double neutralScore) {
        this.neutralScore = neutralScore;
    }

    public double getPriceCeiling() {
        return priceCeiling;
    }

    public void setPriceCeiling(double priceCeiling) {
        this.priceCeiling = priceCeiling;
    }

    public double getCarbonCeilingKg() {
        return carbonCeilingKg;
    }

    public void setCarbonCeilingKg(double carbonCeilingKg) {
        this.carbonCeilingKg = carbonCeilingKg;
    }

    public double getCarbonBlendWeight() {
        return carbonBlendWeight;
    }

    public void setCarbonBlendWeight(double carbonBlendWeight) {
        this.carbonBlendWeight = carbonBlendWeight;
    }

    public Weights getWeights() {
        return weights;
    }

    public void setWeights(Weights weights) {
        this.weights = weights;
    }

    public Bonuses getBonuses() {
        return bonuses;
    }

    public void setBonuses(Bonuses bonuses) {
        this.bonuses = bonuses;
    }

    public static class Weights {
        private double economic = 0.4;
        private double environmental = 0.4;
        private double social = 0.2;

        public double getEconomic() {
            return economic;
        }

        public void setEconomic(double economic) {
            this.economic = economic;
        }

        public double getEnvironmental() {
            return environmental;
        }

        public void setEnvironmental(double environmental) {
            this.environmental = environmental;
        }

        public double getSocial() {
            return social;
        }

        public void setSocial(double social) {
            this.social = social;
        }

        public ScoreWeights toScoreWeights() {
            return new ScoreWeights(economic, environmental, social);
        }
    }

    public static class Bonuses {
        private double nutrition = 0.1;
        private double sustainablePackaging = 0.1;
        private double localOrigin = 0.05;
        private double fairTrade = 0.3;
        private double organic = 0.2;
        private double rainforestAlliance = 0.1;
        private double traceableOrigin = 0.1;
        private double additivePenalty = 0.1;
        private int additiveLimit = 5;

        public double getNutrition() {
            return nutrition;
        }

        public void setNutrition(double nutrition) {
            this.nutrition = nutrition;
        }

        public double getSustainablePackaging() {
            return sustainablePackaging;
        }

        public void setSustainablePackaging(double sustainablePackaging) {
            this.sustainablePackaging = sustainablePackaging;
        }

        public double getLocalOrigin() {
            return localOrigin;
        }

        public void setLocalOrigin(double localOrigin) {
            this.localOrigin = localOrigin;
        }

        public double getFairTrade() {
            return fairTrade;
        }

        public void setFairTrade(double fairTrade) {
            this.fairTrade = fairTrade;
        }

        public double getOrganic() {
            return organic;
        }

        public void setOrganic(double organic) {
            this.organic = organic;
        }

        public double getRainforestAlliance() {
            return rainforestAlliance;
        }

        public void setRainforestAlliance(double rainforestAlliance) {
            this.rainforestAlliance = rainforestAlliance;
        }

        public double getTraceableOrigin() {
            return traceableOrigin;
        }

        public void setTraceableOrigin(double traceableOrigin) {
            this.traceableOrigin = traceableOrigin;
        }

        public double getAdditivePenalty() {
            return additivePenalty;
        }

        public void setAdditivePenalty(double additivePenalty) {
            this.additivePenalty = additivePenalty;
        }

        public int getAdditiveLimit() {
            return additiveLimit;
        }

        public void setAdditiveLimit(int additiveLimit) {
            this.additiveLimit = additiveLimit;
        }
    }
}
