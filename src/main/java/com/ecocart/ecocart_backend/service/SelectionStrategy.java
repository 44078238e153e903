package com.ecocart.ecocart_backend.service;

import java.util.List;

import com.ecocart.ecocart_backend.model.ScoredProduct;

/**
 * Chooses a subset of eligible items (positive price, non-null score) whose line costs fit the budget.
 */
public interface SelectionStrategy {

    String name();

    Selection select(List<ScoredProduct> eligible, double maxBudget, double minScore);

    record Selection(List<ScoredProduct> selected, String message) {

        public Selection {
            selected = selected == null ? List.of() : List.copyOf(selected);
        }
    }
}
