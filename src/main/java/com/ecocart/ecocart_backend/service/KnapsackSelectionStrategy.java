package com.ecocart.ecocart_backend.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.springframework.stereotype.Component;

import com.ecocart.ecocart_backend.model.ScoredProduct;

/**
 * Exact 0/1 knapsack over a budget discretized to whole cents. Time and memory grow with
 * items x budget-in-cents, so large budgets should go through the hybrid entrypoint.
 */
@Component
public class KnapsackSelectionStrategy implements SelectionStrategy {

    public static final String NAME = "dynamic_programming";
    static final String NO_ITEM_MEETS_MIN_SCORE = "No product meets the minimum score";

    // Absorbs binary noise such as 0.29 * 100 = 28.999999999999996 before flooring.
    private static final double CENT_EPSILON = 1e-6;

    // Largest table row the JVM can allocate, minus the slot for a zero budget.
    static final int MAX_BUDGET_CENTS = Integer.MAX_VALUE - 9;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Selection select(List<ScoredProduct> eligible, double maxBudget, double minScore) {
        List<ScoredProduct> items = eligible.stream()
                .filter(item -> item.totalOrZero() >= minScore)
                .toList();
        if (items.isEmpty()) {
            return new Selection(List.of(), NO_ITEM_MEETS_MIN_SCORE);
        }

        int n = items.size();
        int[] costs = new int[n];
        long totalCents = 0;
        for (int i = 0; i < n; i++) {
            costs[i] = (int) Math.min(Integer.MAX_VALUE, toCents(items.get(i).product().lineCost()));
            totalCents += costs[i];
        }
        // Capacity beyond the cost of taking everything cannot change the optimum.
        long capacity = Math.min(toCents(maxBudget), totalCents);
        if (capacity > MAX_BUDGET_CENTS) {
            throw new IllegalArgumentException("Budget of %d cents exceeds the dynamic programming table bound of %d cents"
                    .formatted(capacity, MAX_BUDGET_CENTS));
        }
        int budgetCents = (int) capacity;

        // best[w] holds dp[i][w] for the row being filled; iterating w downwards keeps dp[i-1] intact.
        double[] best = new double[budgetCents + 1];
        boolean[][] taken = new boolean[n + 1][budgetCents + 1];
        for (int i = 1; i <= n; i++) {
            int cost = costs[i - 1];
            double score = items.get(i - 1).totalOrZero();
            for (int w = budgetCents; w >= cost; w--) {
                double withItem = best[w - cost] + score;
                if (withItem > best[w]) {
                    best[w] = withItem;
                    taken[i][w] = true;
                }
            }
        }

        List<ScoredProduct> selected = new ArrayList<>();
        int w = budgetCents;
        for (int i = n; i > 0; i--) {
            if (taken[i][w]) {
                selected.add(items.get(i - 1));
                w -= costs[i - 1];
            }
        }
        Collections.reverse(selected);
        return new Selection(selected,
                "Selected %d products using dynamic programming".formatted(selected.size()));
    }

    static long toCents(double amount) {
        return (long) Math.floor(amount * 100.0 + CENT_EPSILON);
    }
}
