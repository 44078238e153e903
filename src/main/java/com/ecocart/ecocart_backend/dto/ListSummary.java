package com.ecocart.ecocart_backend.dto;

import java.util.List;

import com.ecocart.ecocart_backend.model.ScoredProduct;

public class ListSummary {

    private List<ScoredProduct> items = List.of();
    private double totalCost;
    private double totalCarbon;
    private double averageScore;

    public ListSummary() {
    }

    public ListSummary(List<ScoredProduct> items, double totalCost, double totalCarbon, double averageScore) {
        this.items = items == null ? List.of() : List.copyOf(items);
        this.totalCost = totalCost;
        this.totalCarbon = totalCarbon;
        this.averageScore = averageScore;
    }

    public List<ScoredProduct> getItems() {
        return items;
    }

    public void setItems(List<ScoredProduct> items) {
        this.items = items;
    }

    public double getTotalCost() {
        return totalCost;
    }

    public void setTotalCost(double totalCost) {
        this.totalCost = totalCost;
    }

    public double getTotalCarbon() {
        return totalCarbon;
    }

    public void setTotalCarbon(double totalCarbon) {
        this.totalCarbon = totalCarbon;
    }

    public double getAverageScore() {
        return averageScore;
    }

    public void setAverageScore(double averageScore) {
        this.averageScore = averageScore;
    }
}
