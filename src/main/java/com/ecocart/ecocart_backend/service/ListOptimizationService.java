package com.ecocart.ecocart_backend.service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.ecocart.ecocart_backend.config.ListOptimizationProperties;
import com.ecocart.ecocart_backend.dto.ItemDecision;
import com.ecocart.ecocart_backend.dto.ListOptimizationResult;
import com.ecocart.ecocart_backend.dto.ListSummary;
import com.ecocart.ecocart_backend.dto.OptimizationResult;
import com.ecocart.ecocart_backend.dto.SubstitutionCriteria;
import com.ecocart.ecocart_backend.model.Product;
import com.ecocart.ecocart_backend.model.ScoredProduct;
import com.ecocart.ecocart_backend.model.SubstituteCandidate;

/**
 * Improves a whole shopping list by swapping items for better-scoring substitutes while respecting the budget.
 *
 * <p>Substitute searches run in parallel on the {@code substitutionSearchExecutor}; the keep-or-swap decisions
 * are made afterwards on the calling thread, in list order, against a running cost.</p>
 */
@Service
public class ListOptimizationService {

    private static final Logger log = LoggerFactory.getLogger(ListOptimizationService.class);
    static final String STRATEGY = "smart_swap";
    static final String EMPTY_LIST_MESSAGE = "No products in the list to optimize";
    private static final double EPSILON = 1e-9;

    private final SustainabilityScoringService scoringService;
    private final SmartSubstitutionService substitutionService;
    private final KnapsackOptimizerService optimizerService;
    private final ListOptimizationProperties properties;
    private final ExecutorService substitutionSearchExecutor;

    public ListOptimizationService(
            SustainabilityScoringService scoringService,
            SmartSubstitutionService substitutionService,
            KnapsackOptimizerService optimizerService,
            ListOptimizationProperties properties,
            @Qualifier("substitutionSearchExecutor") ExecutorService substitutionSearchExecutor
    ) {
        this.scoringService = scoringService;
        this.substitutionService = substitutionService;
        this.optimizerService = optimizerService;
        this.properties = properties;
        this.substitutionSearchExecutor = substitutionSearchExecutor;
    }

    public ListOptimizationResult optimizeList(List<Product> items, double maxBudget, List<Product> candidatePool) {
        return optimizeList(items, maxBudget, candidatePool, null);
    }

    public ListOptimizationResult optimizeList(
            List<Product> items,
            double maxBudget,
            List<Product> candidatePool,
            SubstitutionCriteria criteria
    ) {
        optimizerService.validateBudget(maxBudget);
        List<ScoredProduct> scoredItems = scoringService.scoreAll(withoutNulls(items));
        ListOptimizationResult result = new ListOptimizationResult();

        if (scoredItems.isEmpty()) {
            OptimizationResult optimized = optimizerService.summarize(List.of(), List.of(), maxBudget);
            optimized.setStrategy(KnapsackOptimizerService.NO_STRATEGY);
            optimized.setMessage(EMPTY_LIST_MESSAGE);
            result.setOriginal(summarize(List.of()));
            result.setOptimized(optimized);
            return result;
        }

        long startTime = System.currentTimeMillis();
        List<ScoredProduct> scoredPool = scoringService.scoreAll(withoutNulls(candidatePool));
        SubstitutionCriteria activeCriteria = criteria == null ? defaultCriteria() : criteria;
        List<List<SubstituteCandidate>> substitutes = searchAll(scoredItems, scoredPool, activeCriteria);

        double runningCost = scoredItems.stream().mapToDouble(item -> item.product().lineCost()).sum();
        List<ItemDecision> decisions = new ArrayList<>();
        List<ScoredProduct> chosen = new ArrayList<>();
        for (int i = 0; i < scoredItems.size(); i++) {
            ScoredProduct item = scoredItems.get(i);
            ItemDecision decision = decide(item, substitutes.get(i), runningCost, maxBudget);
            if (decision.isSwapped()) {
                runningCost += decision.getCostDifference();
            }
            decisions.add(decision);
            chosen.add(decision.getChosen());
        }

        OptimizationResult optimized = optimizerService.summarize(scoredItems, chosen, maxBudget);
        optimized.setTotalScore(averageScore(chosen));
        optimized.setStrategy(STRATEGY);
        long swaps = decisions.stream().filter(ItemDecision::isSwapped).count();
        optimized.setMessage(String.format("Optimized list with %d smart substitutions", swaps));

        result.setOriginal(summarize(scoredItems));
        result.setOptimized(optimized);
        result.setDecisions(decisions);
        log.info("List optimization finished: items={}, poolSize={}, swaps={}, totalCost={}, budget={}, elapsedMs={}",
                scoredItems.size(), scoredPool.size(), swaps, optimized.getTotalCost(), maxBudget,
                System.currentTimeMillis() - startTime);
        return result;
    }

    private List<List<SubstituteCandidate>> searchAll(
            List<ScoredProduct> items,
            List<ScoredProduct> pool,
            SubstitutionCriteria criteria
    ) {
        List<CompletableFuture<List<SubstituteCandidate>>> futures = items.stream()
                .map(item -> CompletableFuture
                        .supplyAsync(() -> substitutionService.findSubstitutes(item, pool, criteria),
                                substitutionSearchExecutor)
                        .exceptionally(ex -> {
                            log.warn("Substitute search failed for '{}': {}",
                                    safe(item.product().name()), ex.getMessage());
                            return List.of();
                        }))
                .toList();
        return futures.stream()
                .map(CompletableFuture::join)
                .toList();
    }

    private ItemDecision decide(ScoredProduct item, List<SubstituteCandidate> substitutes, double runningCost,
                                double maxBudget) {
        SubstituteCandidate best = bestSubstitute(item, substitutes);
        if (best == null) {
            log.debug("Keeping '{}': no substitutes", safe(item.product().name()));
            return new ItemDecision(item, item, ItemDecision.Reason.NO_SUBSTITUTES, 0.0, 0.0);
        }
        if (isSameProduct(item.product(), best.product())) {
            log.debug("Keeping '{}': substitute is the same product", safe(item.product().name()));
            return new ItemDecision(item, item, ItemDecision.Reason.SAME_PRODUCT, 0.0, 0.0);
        }

        int quantity = item.product().quantityOrDefault();
        double costDifference = (best.product().priceOrZero() - item.product().priceOrZero()) * quantity;
        double scoreImprovement = best.total() - item.totalOrZero();
        ScoredProduct replacement = best.candidate().withQuantity(quantity);

        if (scoreImprovement <= 0) {
            log.debug("Keeping '{}': substitute does not improve score", safe(item.product().name()));
            return new ItemDecision(item, item, ItemDecision.Reason.NO_SCORE_IMPROVEMENT, scoreImprovement,
                    costDifference);
        }
        if (costDifference <= 0) {
            log.debug("Swapping '{}' for '{}' (cheaper and better)",
                    safe(item.product().name()), safe(best.product().name()));
            return new ItemDecision(item, replacement, ItemDecision.Reason.SWAPPED_CHEAPER, scoreImprovement,
                    costDifference);
        }
        if (runningCost + costDifference <= maxBudget + EPSILON) {
            log.debug("Swapping '{}' for '{}' (better score, within budget)",
                    safe(item.product().name()), safe(best.product().name()));
            return new ItemDecision(item, replacement, ItemDecision.Reason.SWAPPED_WITHIN_BUDGET, scoreImprovement,
                    costDifference);
        }
        log.debug("Keeping '{}': substitute would exceed budget", safe(item.product().name()));
        return new ItemDecision(item, item, ItemDecision.Reason.EXCEEDS_BUDGET, scoreImprovement, costDifference);
    }

    // Higher total wins; totals within the tie margin go to the cheaper substitute.
    private SubstituteCandidate bestSubstitute(ScoredProduct item, List<SubstituteCandidate> substitutes) {
        double floor = item.totalOrZero() - properties.getSwapTolerance();
        SubstituteCandidate best = null;
        for (SubstituteCandidate substitute : substitutes) {
            if (substitute.total() + EPSILON < floor) {
                continue;
            }
            if (best == null) {
                best = substitute;
                continue;
            }
            double difference = substitute.total() - best.total();
            if (Math.abs(difference) > properties.getScoreTieMargin()) {
                if (difference > 0) {
                    best = substitute;
                }
            } else if (substitute.product().priceOrZero() < best.product().priceOrZero()) {
                best = substitute;
            }
        }
        return best;
    }

    private boolean isSameProduct(Product original, Product candidate) {
        if (original.id() != null && original.id().equals(candidate.id())) {
            return true;
        }
        if (original.barcode() != null && original.barcode().equals(candidate.barcode())) {
            return true;
        }
        String name = original.normalizedName();
        return !name.isBlank() && name.equals(candidate.normalizedName());
    }

    private ListSummary summarize(List<ScoredProduct> items) {
        double totalCost = 0.0;
        double totalCarbon = 0.0;
        for (ScoredProduct item : items) {
            totalCost += item.product().lineCost();
            totalCarbon += item.product().carbonOrZero() * item.product().quantityOrDefault();
        }
        return new ListSummary(items, round2(totalCost), round2(totalCarbon), averageScore(items));
    }

    private double averageScore(List<ScoredProduct> items) {
        double weightedScore = 0.0;
        int units = 0;
        for (ScoredProduct item : items) {
            int quantity = item.product().quantityOrDefault();
            weightedScore += item.totalOrZero() * quantity;
            units += quantity;
        }
        return units == 0 ? 0.0 : round2(weightedScore / units);
    }

    private SubstitutionCriteria defaultCriteria() {
        SubstitutionCriteria criteria = new SubstitutionCriteria();
        criteria.setMinScoreImprovement(properties.getMinScoreImprovement());
        return criteria;
    }

    private List<Product> withoutNulls(List<Product> products) {
        if (products == null) {
            return List.of();
        }
        return products.stream()
                .filter(product -> product != null)
                .toList();
    }

    private double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
