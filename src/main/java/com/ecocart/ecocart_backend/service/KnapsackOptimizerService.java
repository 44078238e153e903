package com.ecocart.ecocart_backend.service;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.ecocart.ecocart_backend.config.OptimizerProperties;
import com.ecocart.ecocart_backend.dto.OptimizationOptions;
import com.ecocart.ecocart_backend.dto.OptimizationResult;
import com.ecocart.ecocart_backend.dto.Savings;
import com.ecocart.ecocart_backend.model.Product;
import com.ecocart.ecocart_backend.model.ScoredProduct;

/**
 * Budget-constrained selection that maximizes the aggregate sustainability score.
 *
 * <p>{@link #optimize} picks the strategy from {@code prioritizeSustainability}: greedy-by-ratio when true,
 * exact DP when false. {@link #optimizeHybrid} picks by size instead. Inputs are never modified.</p>
 */
@Service
public class KnapsackOptimizerService {

    private static final Logger log = LoggerFactory.getLogger(KnapsackOptimizerService.class);
    static final String NO_VALID_PRODUCTS = "No valid products to optimize";
    static final String NO_STRATEGY = "none";

    private final GreedySelectionStrategy greedyStrategy;
    private final KnapsackSelectionStrategy knapsackStrategy;
    private final OptimizerProperties optimizerProperties;

    public KnapsackOptimizerService(
            GreedySelectionStrategy greedyStrategy,
            KnapsackSelectionStrategy knapsackStrategy,
            OptimizerProperties optimizerProperties
    ) {
        this.greedyStrategy = greedyStrategy;
        this.knapsackStrategy = knapsackStrategy;
        this.optimizerProperties = optimizerProperties;
    }

    public OptimizationResult optimize(List<ScoredProduct> products, double maxBudget) {
        return optimize(products, maxBudget, null);
    }

    public OptimizationResult optimize(List<ScoredProduct> products, double maxBudget, OptimizationOptions options) {
        validateBudget(maxBudget);
        List<ScoredProduct> input = products == null ? List.of() : products;
        List<ScoredProduct> eligible = eligibleItems(input);
        if (eligible.isEmpty()) {
            log.info("Optimization skipped: no eligible items among {} products.", input.size());
            return emptyResult(input, maxBudget, NO_VALID_PRODUCTS);
        }
        SelectionStrategy strategy = prioritizeSustainability(options) ? greedyStrategy : knapsackStrategy;
        return run(strategy, input, eligible, maxBudget, minScore(options));
    }

    public OptimizationResult optimizeHybrid(List<ScoredProduct> products, double maxBudget, OptimizationOptions options) {
        validateBudget(maxBudget);
        List<ScoredProduct> input = products == null ? List.of() : products;
        List<ScoredProduct> eligible = eligibleItems(input);
        if (eligible.isEmpty()) {
            log.info("Hybrid optimization skipped: no eligible items among {} products.", input.size());
            return emptyResult(input, maxBudget, NO_VALID_PRODUCTS);
        }
        long tableCells = (long) eligible.size() * KnapsackSelectionStrategy.toCents(maxBudget);
        boolean exact = eligible.size() <= optimizerProperties.getHybridThreshold()
                && tableCells <= optimizerProperties.getMaxTableCells();
        if (!exact) {
            log.debug("Hybrid optimization using greedy: items={}, tableCells={}", eligible.size(), tableCells);
        }
        return run(exact ? knapsackStrategy : greedyStrategy, input, eligible, maxBudget, minScore(options));
    }

    private OptimizationResult run(
            SelectionStrategy strategy,
            List<ScoredProduct> input,
            List<ScoredProduct> eligible,
            double maxBudget,
            double minScore
    ) {
        long startTime = System.currentTimeMillis();
        SelectionStrategy.Selection selection = strategy.select(eligible, maxBudget, minScore);
        OptimizationResult result = summarize(input, selection.selected(), maxBudget);
        result.setStrategy(strategy.name());
        result.setMessage(selection.message());
        log.info("Optimization finished: strategy={}, eligible={}, selected={}, totalCost={}, budget={}, elapsedMs={}",
                strategy.name(), eligible.size(), selection.selected().size(), result.getTotalCost(), maxBudget,
                System.currentTimeMillis() - startTime);
        return result;
    }

    /**
     * Totals, savings and budget usage of {@code selected} measured against the full {@code original} list.
     */
    public OptimizationResult summarize(List<ScoredProduct> original, List<ScoredProduct> selected, double maxBudget) {
        double totalCost = 0.0;
        double totalScore = 0.0;
        double totalCarbon = 0.0;
        for (ScoredProduct item : selected) {
            Product product = item.product();
            int quantity = product.quantityOrDefault();
            totalCost += product.priceOrZero() * quantity;
            totalScore += item.totalOrZero() * quantity;
            totalCarbon += product.carbonOrZero() * quantity;
        }

        double originalCost = 0.0;
        double originalCarbon = 0.0;
        for (ScoredProduct item : original) {
            Product product = item.product();
            originalCost += product.lineCost();
            originalCarbon += product.carbonOrZero() * product.quantityOrDefault();
        }

        OptimizationResult result = new OptimizationResult();
        result.setSelected(selected);
        result.setTotalCost(round2(totalCost));
        result.setTotalScore(round2(totalScore));
        result.setTotalCarbon(round2(totalCarbon));
        result.setSavings(new Savings(
                Math.max(0.0, round2(originalCost - totalCost)),
                Math.max(0.0, round2(originalCarbon - totalCarbon)),
                originalCost > 0 ? (int) Math.round((originalCost - totalCost) / originalCost * 100.0) : 0
        ));
        result.setBudgetUsed(maxBudget > 0 ? round2(totalCost / maxBudget) : 0.0);
        return result;
    }

    public void validateBudget(double maxBudget) {
        if (!Double.isFinite(maxBudget) || maxBudget < 0) {
            throw new IllegalArgumentException("maxBudget must be a finite, non-negative amount but was " + maxBudget);
        }
    }

    private List<ScoredProduct> eligibleItems(List<ScoredProduct> products) {
        return products.stream()
                .filter(item -> item != null && item.product() != null)
                .filter(ScoredProduct::isScored)
                .filter(item -> item.product().hasPrice() && item.product().price() > 0)
                .toList();
    }

    private OptimizationResult emptyResult(List<ScoredProduct> input, double maxBudget, String message) {
        List<ScoredProduct> original = input.stream()
                .filter(item -> item != null && item.product() != null)
                .toList();
        OptimizationResult result = summarize(original, List.of(), maxBudget);
        result.setStrategy(NO_STRATEGY);
        result.setMessage(message);
        return result;
    }

    private boolean prioritizeSustainability(OptimizationOptions options) {
        return options == null || options.getPrioritizeSustainability() == null
                || options.getPrioritizeSustainability();
    }

    private double minScore(OptimizationOptions options) {
        if (options == null || options.getMinScore() == null || !Double.isFinite(options.getMinScore())) {
            return 0.0;
        }
        return options.getMinScore();
    }

    private double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
