package com.ecocart.ecocart_backend.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.ecocart.ecocart_backend.config.SubstitutionProperties;
import com.ecocart.ecocart_backend.dto.DietaryRestrictions;
import com.ecocart.ecocart_backend.dto.SubstituteWeights;
import com.ecocart.ecocart_backend.dto.SubstitutionCriteria;
import com.ecocart.ecocart_backend.model.BestSubstitute;
import com.ecocart.ecocart_backend.model.Product;
import com.ecocart.ecocart_backend.model.RecommendationType;
import com.ecocart.ecocart_backend.model.ScoreBreakdown;
import com.ecocart.ecocart_backend.model.ScoreDimension;
import com.ecocart.ecocart_backend.model.ScoredProduct;
import com.ecocart.ecocart_backend.model.SubstituteCandidate;
import com.ecocart.ecocart_backend.model.SubstitutionSuggestion;

/**
 * Finds better-scoring alternatives for a product within a candidate pool.
 *
 * <p>Each candidate goes through identity exclusion, category relevance, the incompatibility veto, an
 * adaptive score threshold, the price ceiling and the dietary filters, in that order. Survivors are then
 * ranked into at most one best option per score dimension plus balanced backfill.</p>
 */
@Service
public class SmartSubstitutionService {

    private static final Logger log = LoggerFactory.getLogger(SmartSubstitutionService.class);
    private static final double EPSILON = 1e-9;
    private static final double RANKING_POOL_MARGIN = 0.05;
    private static final int MIN_RANKING_POOL = 3;
    private static final double MAX_EXPECTED_SCORE_IMPROVEMENT = 0.5;
    private static final int TOP_REJECTION_REASONS = 5;

    private final CategoryMatcher categoryMatcher;
    private final CategoryRuleBook ruleBook;
    private final SubstitutionProperties substitutionProperties;

    public SmartSubstitutionService(
            CategoryMatcher categoryMatcher,
            CategoryRuleBook ruleBook,
            SubstitutionProperties substitutionProperties
    ) {
        this.categoryMatcher = categoryMatcher;
        this.ruleBook = ruleBook;
        this.substitutionProperties = substitutionProperties;
    }

    public List<SubstituteCandidate> findSubstitutes(ScoredProduct product, List<ScoredProduct> pool) {
        return findSubstitutes(product, pool, null);
    }

    public List<SubstituteCandidate> findSubstitutes(
            ScoredProduct product,
            List<ScoredProduct> pool,
            SubstitutionCriteria criteria
    ) {
        if (product == null || product.product() == null || pool == null || pool.isEmpty()) {
            return List.of();
        }
        ResolvedCriteria resolved = resolve(criteria);
        if (resolved.maxResults() <= 0) {
            return List.of();
        }

        double originalTotal = product.totalOrZero();
        log.debug("Finding substitutes for '{}': score={}, price={}, poolSize={}",
                safe(product.product().name()), originalTotal, product.product().priceOrZero(), pool.size());

        Map<Rejection, Integer> rejections = new EnumMap<>(Rejection.class);
        List<SubstituteCandidate> survivors = new ArrayList<>();
        for (ScoredProduct candidate : pool) {
            if (candidate == null || candidate.product() == null) {
                continue;
            }
            CategoryMatcher.CategoryMatch match = categoryMatcher.match(product.product(), candidate.product());
            Rejection rejection = evaluate(product, candidate, match, resolved);
            if (rejection != null) {
                rejections.merge(rejection, 1, Integer::sum);
                continue;
            }
            survivors.add(toCandidate(product, candidate, match.categoryBonus()));
        }

        log.debug("Filtered {} valid candidates from {} for '{}'",
                survivors.size(), pool.size(), safe(product.product().name()));
        if (survivors.isEmpty() && !rejections.isEmpty()) {
            log.info("All candidates rejected for '{}'. Top rejection reasons: {}",
                    safe(product.product().name()), topReasons(rejections));
        }

        return rank(product, survivors, resolved.maxResults());
    }

    public Optional<BestSubstitute> findBestSubstitute(ScoredProduct product, List<ScoredProduct> pool) {
        return findBestSubstitute(product, pool, SubstituteWeights.DEFAULT);
    }

    public Optional<BestSubstitute> findBestSubstitute(
            ScoredProduct product,
            List<ScoredProduct> pool,
            SubstituteWeights weights
    ) {
        if (product == null || product.product() == null) {
            return Optional.empty();
        }
        SubstituteWeights activeWeights = weights == null ? SubstituteWeights.DEFAULT : weights;

        SubstitutionCriteria criteria = new SubstitutionCriteria();
        criteria.setMinScoreImprovement(substitutionProperties.getBest().getMinScoreImprovement());
        criteria.setSameCategory(false);
        criteria.setMaxResults(substitutionProperties.getBest().getMaxResults());

        BestSubstitute best = null;
        for (SubstituteCandidate substitute : findSubstitutes(product, pool, criteria)) {
            double composite = compositeScore(product, substitute, activeWeights);
            if (best == null || composite > best.compositeScore()) {
                best = new BestSubstitute(substitute, composite);
            }
        }
        return Optional.ofNullable(best);
    }

    public List<SubstitutionSuggestion> suggestSubstitutesForList(
            List<ScoredProduct> products,
            List<ScoredProduct> pool,
            SubstitutionCriteria criteria
    ) {
        if (products == null || products.isEmpty()) {
            return List.of();
        }
        return products.stream()
                .map(product -> new SubstitutionSuggestion(product, findSubstitutes(product, pool, criteria)))
                .toList();
    }

    private Rejection evaluate(
            ScoredProduct product,
            ScoredProduct candidate,
            CategoryMatcher.CategoryMatch match,
            ResolvedCriteria criteria
    ) {
        Product original = product.product();
        Product alternative = candidate.product();

        if (isSameProduct(original, alternative)) {
            return Rejection.SAME_PRODUCT;
        }
        if (criteria.sameCategory() && !match.isRelevant()) {
            return Rejection.NO_CATEGORY_MATCH;
        }
        if (match.incompatible()) {
            return Rejection.INCOMPATIBLE_CATEGORIES;
        }
        if (!meetsScoreThreshold(product.totalOrZero(), candidate.totalOrZero() + match.categoryBonus(),
                match, criteria)) {
            return Rejection.SCORE_TOO_LOW;
        }
        if (exceedsPriceCeiling(original, alternative, criteria.maxPriceIncrease())) {
            return Rejection.PRICE_TOO_HIGH;
        }

        String labels = lower(alternative.metadata().joinedLabels());
        String ingredients = lower(alternative.metadata().ingredientsText());
        if (criteria.vegan()
                && !containsAny(labels, ruleBook.getVeganLabels())
                && containsAny(ingredients, ruleBook.getAnimalIngredients())) {
            return Rejection.NOT_VEGAN;
        }
        if (criteria.glutenFree()
                && !containsAny(labels, ruleBook.getGlutenFreeLabels())
                && containsAny(ingredients, ruleBook.getGlutenIngredients())) {
            return Rejection.HAS_GLUTEN;
        }
        return null;
    }

    private boolean isSameProduct(Product original, Product candidate) {
        if (original.id() != null && original.id().equals(candidate.id())) {
            return true;
        }
        if (original.barcode() != null && original.barcode().equals(candidate.barcode())) {
            return true;
        }
        String originalName = original.normalizedName();
        return !originalName.isBlank() && originalName.equals(candidate.normalizedName());
    }

    private boolean meetsScoreThreshold(
            double originalTotal,
            double adjustedScore,
            CategoryMatcher.CategoryMatch match,
            ResolvedCriteria criteria
    ) {
        SubstitutionProperties.Tolerances tolerances = substitutionProperties.getTolerances();
        return switch (match.strength()) {
            case STRONG -> adjustedScore + EPSILON >= originalTotal - tolerances.getSharedCategory();
            case WEAK -> adjustedScore + EPSILON >= originalTotal - tolerances.getSimilarCategory();
            case NONE -> adjustedScore + EPSILON >= originalTotal + criteria.minScoreImprovement();
        };
    }

    private boolean exceedsPriceCeiling(Product original, Product candidate, double maxPriceIncrease) {
        if (!original.hasPrice()) {
            return false;
        }
        String originalCurrency = original.currency();
        String candidateCurrency = candidate.currency();
        if (originalCurrency != null && candidateCurrency != null
                && !originalCurrency.equalsIgnoreCase(candidateCurrency)) {
            log.warn("Currency mismatch: product={} ({}), candidate={} ({}). Price ceiling skipped.",
                    safe(original.name()), originalCurrency, safe(candidate.name()), candidateCurrency);
            return false;
        }
        return candidate.priceOrZero() > original.price() * (1.0 + maxPriceIncrease) + EPSILON;
    }

    private SubstituteCandidate toCandidate(ScoredProduct product, ScoredProduct candidate, double categoryBonus) {
        ScoreBreakdown originalBreakdown = product.breakdownOrZero();
        ScoreBreakdown candidateBreakdown = candidate.breakdownOrZero();
        return new SubstituteCandidate(
                candidate,
                candidateBreakdown.economic() - originalBreakdown.economic(),
                candidateBreakdown.environmental() - originalBreakdown.environmental(),
                candidateBreakdown.social() - originalBreakdown.social(),
                candidate.product().priceOrZero() - product.product().priceOrZero(),
                categoryBonus,
                null
        );
    }

    private List<SubstituteCandidate> rank(ScoredProduct product, List<SubstituteCandidate> survivors, int maxResults) {
        if (survivors.isEmpty()) {
            return List.of();
        }
        if (survivors.size() == 1) {
            SubstituteCandidate single = survivors.get(0);
            return List.of(single.labelled(RecommendationType.forDimension(strongestDimension(single))));
        }

        double originalTotal = product.totalOrZero();
        List<SubstituteCandidate> nearOriginal = survivors.stream()
                .filter(candidate -> candidate.total() + EPSILON >= originalTotal - RANKING_POOL_MARGIN)
                .toList();
        List<SubstituteCandidate> rankingPool = nearOriginal.size() >= MIN_RANKING_POOL ? nearOriginal : survivors;

        Map<String, SubstituteCandidate> result = new LinkedHashMap<>();
        for (ScoreDimension dimension : ScoreDimension.values()) {
            SubstituteCandidate best = bestFor(dimension, product, rankingPool);
            result.putIfAbsent(best.product().identityKey(),
                    best.labelled(RecommendationType.forDimension(dimension)));
        }

        if (result.size() < maxResults) {
            double floor = originalTotal - substitutionProperties.getTolerances().getBalanced();
            List<SubstituteCandidate> balanced = survivors.stream()
                    .filter(candidate -> !result.containsKey(candidate.product().identityKey()))
                    .filter(candidate -> candidate.total() + EPSILON >= floor)
                    .sorted(Comparator
                            .comparing((SubstituteCandidate candidate) -> candidate.total() >= originalTotal ? 0 : 1)
                            .thenComparing(SubstituteCandidate::total, Comparator.reverseOrder()))
                    .toList();
            for (SubstituteCandidate candidate : balanced) {
                if (result.size() >= maxResults) {
                    break;
                }
                result.putIfAbsent(candidate.product().identityKey(), candidate.labelled(RecommendationType.BALANCED));
            }
        }

        return result.values().stream()
                .limit(maxResults)
                .toList();
    }

    // Pairwise scan: the ordering below is not transitive once the tie margin applies, so it is not sorted on.
    private SubstituteCandidate bestFor(ScoreDimension dimension, ScoredProduct product, List<SubstituteCandidate> pool) {
        SubstituteCandidate best = pool.get(0);
        for (int i = 1; i < pool.size(); i++) {
            SubstituteCandidate challenger = pool.get(i);
            if (compareForDimension(dimension, product, challenger, best) < 0) {
                best = challenger;
            }
        }
        return best;
    }

    private int compareForDimension(ScoreDimension dimension, ScoredProduct product,
                                    SubstituteCandidate a, SubstituteCandidate b) {
        double originalTotal = product.totalOrZero();
        boolean aImprovesTotal = a.total() >= originalTotal;
        boolean bImprovesTotal = b.total() >= originalTotal;
        if (aImprovesTotal != bImprovesTotal) {
            return aImprovesTotal ? -1 : 1;
        }

        double originalValue = product.breakdownOrZero().valueOf(dimension);
        double aValue = a.candidate().breakdownOrZero().valueOf(dimension);
        double bValue = b.candidate().breakdownOrZero().valueOf(dimension);
        boolean aImproves = improves(dimension, aValue, originalValue, a);
        boolean bImproves = improves(dimension, bValue, originalValue, b);
        if (aImproves != bImproves) {
            return aImproves ? -1 : 1;
        }
        if (Math.abs(aValue - bValue) < substitutionProperties.getTolerances().getDimensionTieMargin()) {
            return Double.compare(a.priceDifference(), b.priceDifference());
        }
        return Double.compare(bValue, aValue);
    }

    private boolean improves(ScoreDimension dimension, double value, double originalValue, SubstituteCandidate candidate) {
        if (value >= originalValue) {
            return true;
        }
        return dimension == ScoreDimension.ECONOMIC && candidate.priceDifference() < 0;
    }

    private ScoreDimension strongestDimension(SubstituteCandidate candidate) {
        ScoreBreakdown breakdown = candidate.candidate().breakdownOrZero();
        if (breakdown.economic() >= breakdown.environmental() && breakdown.economic() >= breakdown.social()) {
            return ScoreDimension.ECONOMIC;
        }
        if (breakdown.environmental() >= breakdown.social()) {
            return ScoreDimension.ENVIRONMENTAL;
        }
        return ScoreDimension.SOCIAL;
    }

    private double compositeScore(ScoredProduct product, SubstituteCandidate substitute, SubstituteWeights weights) {
        Product original = product.product();
        Product candidate = substitute.product();

        double scoreImprovement = substitute.total() - product.totalOrZero();
        double normalizedScore = Math.min(scoreImprovement / MAX_EXPECTED_SCORE_IMPROVEMENT, 1.0);

        double priceRatio = original.priceOrZero() > 0 ? candidate.priceOrZero() / original.priceOrZero() : 1.0;
        double normalizedPrice = priceRatio <= 0 ? 1.0 : 1.0 / priceRatio;

        double originalCarbon = original.carbonOrZero();
        double carbonImprovement = (originalCarbon - candidate.carbonOrZero()) / Math.max(originalCarbon, 1.0);
        double normalizedCarbon = Math.max(0.0, Math.min(1.0, carbonImprovement + 0.5));

        return normalizedScore * weights.score()
                + normalizedPrice * weights.price()
                + normalizedCarbon * weights.carbon();
    }

    private ResolvedCriteria resolve(SubstitutionCriteria criteria) {
        SubstitutionCriteria source = criteria == null ? new SubstitutionCriteria() : criteria;
        DietaryRestrictions dietary = source.getDietaryRestrictions();
        return new ResolvedCriteria(
                source.getMinScoreImprovement() == null
                        ? substitutionProperties.getMinScoreImprovement()
                        : source.getMinScoreImprovement(),
                source.getSameCategory() == null
                        ? substitutionProperties.isSameCategory()
                        : source.getSameCategory(),
                source.getMaxResults() == null
                        ? substitutionProperties.getMaxResults()
                        : source.getMaxResults(),
                source.getMaxPriceIncrease() == null
                        ? substitutionProperties.getMaxPriceIncrease()
                        : source.getMaxPriceIncrease(),
                dietary != null && dietary.isVegan(),
                dietary != null && dietary.isGlutenFree()
        );
    }

    private String topReasons(Map<Rejection, Integer> rejections) {
        return rejections.entrySet().stream()
                .sorted(Map.Entry.<Rejection, Integer>comparingByValue().reversed())
                .limit(TOP_REJECTION_REASONS)
                .map(entry -> entry.getKey().name().toLowerCase(Locale.ROOT) + ": " + entry.getValue())
                .collect(Collectors.joining(", "));
    }

    private boolean containsAny(String value, List<String> markers) {
        if (value == null || value.isBlank()) {
            return false;
        }
        for (String marker : markers) {
            if (value.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }

    private enum Rejection {
        SAME_PRODUCT,
        NO_CATEGORY_MATCH,
        INCOMPATIBLE_CATEGORIES,
        SCORE_TOO_LOW,
        PRICE_TOO_HIGH,
        NOT_VEGAN,
        HAS_GLUTEN
    }

    private record ResolvedCriteria(
            double minScoreImprovement,
            boolean sameCategory,
            int maxResults,
            double maxPriceIncrease,
            boolean vegan,
            boolean glutenFree
    ) {
    }
}
