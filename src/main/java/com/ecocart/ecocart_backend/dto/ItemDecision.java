package com.ecocart.ecocart_backend.dto;

import com.ecocart.ecocart_backend.model.ScoredProduct;

public class ItemDecision {

    public enum Reason {
        NO_SUBSTITUTES,
        SAME_PRODUCT,
        NO_SCORE_IMPROVEMENT,
        EXCEEDS_BUDGET,
        SWAPPED_CHEAPER,
        SWAPPED_WITHIN_BUDGET
    }

    private ScoredProduct original;
    private ScoredProduct chosen;
    private boolean swapped;
    private Reason reason;
    private double scoreImprovement;
    private double costDifference;

    public ItemDecision() {
    }

    public ItemDecision(ScoredProduct original, ScoredProduct chosen, Reason reason,
                        double scoreImprovement, double costDifference) {
        this.original = original;
        this.chosen = chosen;
        this.swapped = reason == Reason.SWAPPED_CHEAPER || reason == Reason.SWAPPED_WITHIN_BUDGET;
        this.reason = reason;
        this.scoreImprovement = scoreImprovement;
        this.costDifference = costDifference;
    }

    public ScoredProduct getOriginal() {
        return original;
    }

    public void setOriginal(ScoredProduct original) {
        this.original = original;
    }

    public ScoredProduct getChosen() {
        return chosen;
    }

    public void setChosen(ScoredProduct chosen) {
        this.chosen = chosen;
    }

    public boolean isSwapped() {
        return swapped;
    }

    public void setSwapped(boolean swapped) {
        this.swapped = swapped;
    }

    public Reason getReason() {
        return reason;
    }

    public void setReason(Reason reason) {
        this.reason = reason;
    }

    public double getScoreImprovement() {
        return scoreImprovement;
    }

    public void setScoreImprovement(double scoreImprovement) {
        this.scoreImprovement = scoreImprovement;
    }

    public double getCostDifference() {
        return costDifference;
    }

    public void setCostDifference(double costDifference) {
        this.costDifference = costDifference;
    }
}
