package com.ecocart.ecocart_backend.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.springframework.stereotype.Component;

import com.ecocart.ecocart_backend.model.ScoredProduct;

/**
 * Sorts by score per currency unit and takes every item that still fits. Ties keep input order.
 */
@Component
public class GreedySelectionStrategy implements SelectionStrategy {

    public static final String NAME = "greedy";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Selection select(List<ScoredProduct> eligible, double maxBudget, double minScore) {
        List<ScoredProduct> sorted = new ArrayList<>(eligible);
        sorted.sort(Comparator.comparingDouble(this::ratio).reversed());

        List<ScoredProduct> selected = new ArrayList<>();
        double remainingBudget = maxBudget;
        for (ScoredProduct item : sorted) {
            double cost = item.product().lineCost();
            if (cost <= remainingBudget && item.totalOrZero() >= minScore) {
                selected.add(item);
                remainingBudget -= cost;
            }
        }
        return new Selection(selected, "Selected %d products using the greedy strategy".formatted(selected.size()));
    }

    private double ratio(ScoredProduct item) {
        return item.totalOrZero() / item.product().priceOrZero();
    }
}
