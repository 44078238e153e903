package com.ecocart.ecocart_backend.dto;

import java.util.List;

import com.ecocart.ecocart_backend.model.ScoredProduct;

public class OptimizationResult {

    private List<ScoredProduct> selected = List.of();
    private double totalCost;
    private double totalScore;
    private double totalCarbon;
    private Savings savings = new Savings();
    private double budgetUsed;
    private String strategy;
    private String message;

    public OptimizationResult() {
    }

    public List<ScoredProduct> getSelected() {
        return selected;
    }

    public void setSelected(List<ScoredProduct> selected) {
        this.selected = selected == null ? List.of() : List.copyOf(selected);
    }

    public double getTotalCost() {
        return totalCost;
    }

    public void setTotalCost(double totalCost) {
        this.totalCost = totalCost;
    }

    public double getTotalScore() {
        return totalScore;
    }

    public void setTotalScore(double totalScore) {
        this.totalScore = totalScore;
    }

    public double getTotalCarbon() {
        return totalCarbon;
    }

    public void setTotalCarbon(double totalCarbon) {
        this.totalCarbon = totalCarbon;
    }

    public Savings getSavings() {
        return savings;
    }

    public void setSavings(Savings savings) {
        this.savings = savings;
    }

    public double getBudgetUsed() {
        return budgetUsed;
    }

    public void setBudgetUsed(double budgetUsed) {
        this.budgetUsed = budgetUsed;
    }

    public String getStrategy() {
        return strategy;
    }

    public void setStrategy(String strategy) {
        this.strategy = strategy;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
