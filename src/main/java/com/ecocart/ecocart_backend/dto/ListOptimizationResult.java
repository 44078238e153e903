package com.ecocart.ecocart_backend.dto;

import java.util.List;

public class ListOptimizationResult {

    private ListSummary original = new ListSummary();
    private OptimizationResult optimized = new OptimizationResult();
    private List<ItemDecision> decisions = List.of();

    public ListOptimizationResult() {
    }

    public ListSummary getOriginal() {
        return original;
    }

    public void setOriginal(ListSummary original) {
        this.original = original;
    }

    public OptimizationResult getOptimized() {
        return optimized;
    }

    public void setOptimized(OptimizationResult optimized) {
        this.optimized = optimized;
    }

    public List<ItemDecision> getDecisions() {
        return decisions;
    }

    public void setDecisions(List<ItemDecision> decisions) {
        this.decisions = decisions == null ? List.of() : List.copyOf(decisions);
    }

    public long getSwapCount() {
        return decisions.stream().filter(ItemDecision::isSwapped).count();
    }
}
