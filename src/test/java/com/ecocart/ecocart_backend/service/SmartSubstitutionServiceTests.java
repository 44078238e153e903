package com.ecocart.ecocart_backend.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import com.ecocart.ecocart_backend.dto.DietaryRestrictions;
import com.ecocart.ecocart_backend.dto.SubstitutionCriteria;
import com.ecocart.ecocart_backend.model.BestSubstitute;
import com.ecocart.ecocart_backend.model.Product;
import com.ecocart.ecocart_backend.model.ProductMetadata;
import com.ecocart.ecocart_backend.model.RecommendationType;
import com.ecocart.ecocart_backend.model.ScoreBreakdown;
import com.ecocart.ecocart_backend.model.ScoreWeights;
import com.ecocart.ecocart_backend.model.ScoredProduct;
import com.ecocart.ecocart_backend.model.SubstituteCandidate;
import com.ecocart.ecocart_backend.model.SubstitutionSuggestion;
import com.ecocart.ecocart_backend.model.SustainabilityScore;

@SpringBootTest
class SmartSubstitutionServiceTests {

    @Autowired
    private SmartSubstitutionService substitutionService;

    @Test
    void improvementIsRequiredWithoutSharedCategories() {
        ScoredProduct original = scored(product("orig", "Original", null, 10.0), 0.5);
        List<ScoredProduct> pool = List.of(
                scored(product("c1", "Alternative one", null, 12.0), 0.7),
                scored(product("c2", "Alternative two", null, 15.0), 0.8),
                scored(product("c3", "Alternative three", null, 8.0), 0.4)
        );

        List<SubstituteCandidate> substitutes = substitutionService.findSubstitutes(original, pool,
                criteria(0.1, false, 1.0));

        assertThat(substitutes).extracting(candidate -> candidate.product().id())
                .containsExactlyInAnyOrder("c1", "c2");
        assertThat(substitutes).allMatch(candidate -> candidate.adjustedScore() >= original.totalOrZero() - 0.05);
    }

    @Test
    void sameProductIsNeverSuggested() {
        Product originalProduct = new Product("orig", "8410000000001", "Leche Entera", "Leches", 1.0, "EUR",
                null, null, null, 1, null);
        ScoredProduct original = scored(originalProduct, 0.5);
        List<ScoredProduct> pool = List.of(
                scored(new Product("orig", null, "Other name", "Leches", 1.0, "EUR", null, null, null, 1, null), 0.9),
                scored(new Product("x1", "8410000000001", "Other", "Leches", 1.0, "EUR", null, null, null, 1, null), 0.9),
                scored(new Product("x2", null, "  leche entera ", "Leches", 1.0, "EUR", null, null, null, 1, null), 0.9),
                scored(new Product("x3", null, "Leche Semi", "Leches", 1.0, "EUR", null, null, null, 1, null), 0.9)
        );

        List<SubstituteCandidate> substitutes = substitutionService.findSubstitutes(original, pool);

        assertThat(substitutes).extracting(candidate -> candidate.product().id()).containsExactly("x3");
    }

    @Test
    void priceCeilingRejectsExpensiveCandidates() {
        ScoredProduct original = scored(product("orig", "Original", null, 10.0), 0.5);
        List<ScoredProduct> pool = List.of(
                scored(product("fits", "At the ceiling", null, 12.0), 0.9),
                scored(product("pricey", "Above the ceiling", null, 12.5), 0.9)
        );

        List<SubstituteCandidate> substitutes = substitutionService.findSubstitutes(original, pool,
                criteria(null, false, null));

        assertThat(substitutes).extracting(candidate -> candidate.product().id()).containsExactly("fits");
        assertThat(substitutes.get(0).priceDifference()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void currencyMismatchSkipsPriceCeiling() {
        ScoredProduct original = scored(product("orig", "Original", null, 10.0), 0.5);
        Product foreign = new Product("usd", null, "Imported", null, 30.0, "USD", null, null, null, 1, null);

        List<SubstituteCandidate> substitutes = substitutionService.findSubstitutes(original,
                List.of(scored(foreign, 0.9)), criteria(null, false, null));

        assertThat(substitutes).extracting(candidate -> candidate.product().id()).containsExactly("usd");
    }

    @Test
    void milkIsNotReplacedByButter() {
        ScoredProduct milk = scored(product("milk", "Leche semidesnatada Granja", "Leche semidesnatada", 1.0), 0.5);
        List<ScoredProduct> pool = List.of(
                scored(product("butter", "Mantequilla sin sal", "Mantequilla", 0.9), 0.9),
                scored(product("milk-2", "Leche entera Valle", "Leche entera", 1.0), 0.6)
        );

        List<SubstituteCandidate> substitutes = substitutionService.findSubstitutes(milk, pool,
                criteria(null, false, null));

        assertThat(substitutes).extracting(candidate -> candidate.product().id()).containsExactly("milk-2");
    }

    @Test
    void milkIsNotReplacedByMilkFats() {
        ScoredProduct milk = scored(product("milk", "Leche semidesnatada Granja",
                "Lácteos, Leches, Leche semidesnatada", 1.0), 0.5);
        List<ScoredProduct> pool = List.of(
                scored(product("butter", "Mantequilla tradicional", "Lácteos, Grasas de la leche, Mantequillas", 1.0),
                        0.9),
                scored(product("milk-2", "Leche entera Valle", "Lácteos, Leches, Leche entera", 1.0), 0.6)
        );

        assertThat(substitutionService.findSubstitutes(milk, pool.subList(0, 1))).isEmpty();
        assertThat(substitutionService.findSubstitutes(milk, pool))
                .extracting(candidate -> candidate.product().id())
                .containsExactly("milk-2");
    }

    @Test
    void unrelatedCategoryIsRejectedWhenSameCategoryRequired() {
        ScoredProduct biscuits = scored(product("b", "Galletas María", "Galletas", 2.0), 0.5);
        ScoredProduct detergent = scored(product("d", "Detergente líquido", "Detergentes", 2.0), 0.95);

        assertThat(substitutionService.findSubstitutes(biscuits, List.of(detergent))).isEmpty();
        assertThat(substitutionService.findSubstitutes(biscuits, List.of(detergent), criteria(null, false, null)))
                .hasSize(1);
    }

    @Test
    void sharedCategoryToleratesSmallRegression() {
        ScoredProduct original = scored(product("o", "Yogur natural", "Yogures", 1.0), 0.60);
        List<ScoredProduct> pool = List.of(
                scored(product("close", "Yogur griego", "Yogures", 1.0), 0.57),
                scored(product("far", "Yogur desnatado", "Yogures", 1.0), 0.30)
        );

        List<SubstituteCandidate> substitutes = substitutionService.findSubstitutes(original, pool);

        assertThat(substitutes).extracting(candidate -> candidate.product().id()).containsExactly("close");
    }

    @Test
    void similarCategoryToleratesSmallerRegression() {
        ScoredProduct original = scored(product("o", "Tableta negra", "Chocolates", 2.0), 0.60);
        List<ScoredProduct> pool = List.of(
                scored(product("close", "Barritas de cacao", "Chocolatinas", 2.0), 0.58),
                scored(product("far", "Bombones surtidos", "Chocolatinas", 2.0), 0.56),
                scored(product("other", "Galletas María", "Galletas", 2.0), 0.58)
        );

        List<SubstituteCandidate> substitutes = substitutionService.findSubstitutes(original, pool,
                criteria(null, false, null));

        assertThat(substitutes).extracting(candidate -> candidate.product().id()).containsExactly("close");
    }

    @Test
    void emptyPoolOrNoSurvivorsGivesEmptyResult() {
        ScoredProduct original = scored(product("o", "Original", null, 1.0), 0.9);

        assertThat(substitutionService.findSubstitutes(original, List.of())).isEmpty();
        assertThat(substitutionService.findSubstitutes(original, null)).isEmpty();
        assertThat(substitutionService.findSubstitutes(original,
                List.of(scored(product("w", "Worse", null, 1.0), 0.2)), criteria(null, false, null))).isEmpty();
    }

    @Test
    void singleSurvivorIsLabelledWithItsStrongestDimension() {
        ScoredProduct original = scored(product("o", "Original", null, 2.0), 0.5);
        ScoredProduct candidate = new ScoredProduct(product("c", "Greener", null, 2.0),
                new SustainabilityScore(0.8, new ScoreBreakdown(0.3, 0.9, 0.5), ScoreWeights.DEFAULT));

        List<SubstituteCandidate> substitutes = substitutionService.findSubstitutes(original, List.of(candidate),
                criteria(null, false, null));

        assertThat(substitutes).hasSize(1);
        assertThat(substitutes.get(0).recommendationType()).isEqualTo(RecommendationType.ENVIRONMENTAL);
        assertThat(substitutes.get(0).recommendationLabel()).isEqualTo("Best environmental option");
    }

    @Test
    void rankingCoversEachDimensionWithoutDuplicates() {
        ScoredProduct original = new ScoredProduct(product("o", "Original", null, 5.0),
                new SustainabilityScore(0.5, new ScoreBreakdown(0.5, 0.5, 0.5), ScoreWeights.DEFAULT));
        List<ScoredProduct> pool = List.of(
                withBreakdown("eco", 4.0, 0.7, 0.9, 0.5, 0.5),
                withBreakdown("env", 5.0, 0.7, 0.5, 0.95, 0.5),
                withBreakdown("soc", 5.5, 0.7, 0.5, 0.5, 0.95),
                withBreakdown("bal", 5.0, 0.65, 0.6, 0.6, 0.6),
                withBreakdown("eco", 4.0, 0.7, 0.9, 0.5, 0.5)
        );

        List<SubstituteCandidate> substitutes = substitutionService.findSubstitutes(original, pool,
                criteria(0.1, false, null));

        assertThat(substitutes).extracting(candidate -> candidate.product().id())
                .containsExactly("eco", "env", "soc", "bal");
        assertThat(substitutes).extracting(SubstituteCandidate::recommendationType)
                .containsExactly(RecommendationType.ECONOMIC, RecommendationType.ENVIRONMENTAL,
                        RecommendationType.SOCIAL, RecommendationType.BALANCED);
    }

    @Test
    void dimensionTieGoesToCheaperCandidateAndBackfillStopsAtFloor() {
        ScoredProduct original = yogurt("o", 5.0, 0.6, 0.5, 0.5, 0.5);
        List<ScoredProduct> pool = List.of(
                yogurt("a", 5.0, 0.7, 0.80, 0.9, 0.7),
                yogurt("b", 4.0, 0.7, 0.78, 0.6, 0.5),
                yogurt("c", 5.0, 0.59, 0.5, 0.5, 0.5),
                yogurt("d", 5.0, 0.57, 0.5, 0.5, 0.5)
        );

        List<SubstituteCandidate> substitutes = substitutionService.findSubstitutes(original, pool);

        assertThat(substitutes).extracting(candidate -> candidate.product().id())
                .containsExactly("b", "a", "c");
        assertThat(substitutes).extracting(SubstituteCandidate::recommendationType)
                .containsExactly(RecommendationType.ECONOMIC, RecommendationType.ENVIRONMENTAL,
                        RecommendationType.BALANCED);
    }

    @Test
    void clearDimensionLeadBeatsCheaperCandidate() {
        ScoredProduct original = yogurt("o", 5.0, 0.6, 0.5, 0.5, 0.5);
        List<ScoredProduct> pool = List.of(
                yogurt("a", 5.0, 0.7, 0.90, 0.9, 0.7),
                yogurt("b", 4.0, 0.7, 0.78, 0.6, 0.5),
                yogurt("c", 5.0, 0.59, 0.5, 0.5, 0.5)
        );

        List<SubstituteCandidate> substitutes = substitutionService.findSubstitutes(original, pool);

        assertThat(substitutes).extracting(candidate -> candidate.product().id())
                .containsExactly("a", "b", "c");
        assertThat(substitutes).extracting(SubstituteCandidate::recommendationType)
                .containsExactly(RecommendationType.ECONOMIC, RecommendationType.BALANCED,
                        RecommendationType.BALANCED);
    }

    @Test
    void resultsAreCappedAtMaxResults() {
        ScoredProduct original = scored(product("o", "Original", null, 5.0), 0.5);
        List<ScoredProduct> pool = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            pool.add(withBreakdown("c" + i, 5.0, 0.7 + i * 0.01, 0.5 + i * 0.03, 0.8 - i * 0.03, 0.6));
        }
        SubstitutionCriteria criteria = criteria(0.1, false, null);
        criteria.setMaxResults(2);

        assertThat(substitutionService.findSubstitutes(original, pool, criteria)).hasSize(2);
        assertThat(substitutionService.findSubstitutes(original, pool, criteria(0.1, false, null))).hasSize(5);
    }

    @Test
    void dietaryRestrictionsFilterCandidates() {
        ScoredProduct original = scored(product("o", "Galletas", null, 2.0), 0.5);
        List<ScoredProduct> pool = List.of(
                scored(withIngredients("dairy", "Galletas de mantequilla", List.of(), "harina de trigo, leche"), 0.8),
                scored(withIngredients("vegan", "Galletas veganas", List.of("en:vegan"), "harina de trigo, leche de avena"), 0.8),
                scored(withIngredients("gf", "Galletas de arroz", List.of("en:gluten-free"), "arroz, leche"), 0.8)
        );

        SubstitutionCriteria vegan = criteria(null, false, null);
        vegan.setDietaryRestrictions(new DietaryRestrictions(true, false));
        SubstitutionCriteria glutenFree = criteria(null, false, null);
        glutenFree.setDietaryRestrictions(new DietaryRestrictions(false, true));

        assertThat(substitutionService.findSubstitutes(original, pool, vegan))
                .extracting(candidate -> candidate.product().id())
                .containsExactlyInAnyOrder("vegan");
        assertThat(substitutionService.findSubstitutes(original, pool, glutenFree))
                .extracting(candidate -> candidate.product().id())
                .containsExactlyInAnyOrder("gf");
    }

    @Test
    void bestSubstituteBalancesScorePriceAndCarbon() {
        ScoredProduct original = scored(new Product("o", null, "Original", null, 10.0, "EUR", 2.0,
                null, null, 1, null), 0.5);
        List<ScoredProduct> pool = List.of(
                scored(new Product("a", null, "Cheaper", null, 8.0, "EUR", 1.0, null, null, 1, null), 0.7),
                scored(new Product("b", null, "Dearer", null, 12.0, "EUR", 3.0, null, null, 1, null), 0.75)
        );

        Optional<BestSubstitute> best = substitutionService.findBestSubstitute(original, pool);

        assertThat(best).isPresent();
        assertThat(best.get().substitute().product().id()).isEqualTo("a");
        assertThat(best.get().compositeScore()).isCloseTo(0.775, within(1e-9));
        assertThat(substitutionService.findBestSubstitute(original, List.of())).isEmpty();
    }

    @Test
    void suggestionsFollowListOrder() {
        ScoredProduct first = scored(product("p1", "Primero", null, 3.0), 0.4);
        ScoredProduct second = scored(product("p2", "Segundo", null, 3.0), 0.95);
        List<ScoredProduct> pool = List.of(scored(product("alt", "Alternativa", null, 3.0), 0.8));

        List<SubstitutionSuggestion> suggestions = substitutionService.suggestSubstitutesForList(
                List.of(first, second), pool, criteria(null, false, null));

        assertThat(suggestions).extracting(suggestion -> suggestion.original().product().id())
                .containsExactly("p1", "p2");
        assertThat(suggestions.get(0).substitutes()).hasSize(1);
        assertThat(suggestions.get(1).substitutes()).isEmpty();
    }

    private SubstitutionCriteria criteria(Double minScoreImprovement, Boolean sameCategory, Double maxPriceIncrease) {
        SubstitutionCriteria criteria = new SubstitutionCriteria();
        criteria.setMinScoreImprovement(minScoreImprovement);
        criteria.setSameCategory(sameCategory);
        criteria.setMaxPriceIncrease(maxPriceIncrease);
        return criteria;
    }

    private Product product(String id, String name, String category, Double price) {
        return new Product(id, null, name, category, price, "EUR", null, null, null, 1, null);
    }

    private Product withIngredients(String id, String name, List<String> labels, String ingredients) {
        return new Product(id, null, name, null, 2.0, "EUR", null, null, null, 1,
                new ProductMetadata(null, null, labels, ingredients, List.of(), List.of()));
    }

    private ScoredProduct scored(Product product, double total) {
        return new ScoredProduct(product,
                new SustainabilityScore(total, new ScoreBreakdown(total, total, total), ScoreWeights.DEFAULT));
    }

    private ScoredProduct yogurt(String id, double price, double total,
                                 double economic, double environmental, double social) {
        return new ScoredProduct(product(id, "Yogur " + id, "Yogures", price),
                new SustainabilityScore(total, new ScoreBreakdown(economic, environmental, social),
                        ScoreWeights.DEFAULT));
    }

    private ScoredProduct withBreakdown(String id, double price, double total,
                                        double economic, double environmental, double social) {
        return new ScoredProduct(product(id, "Candidate " + id, null, price),
                new SustainabilityScore(total, new ScoreBreakdown(economic, environmental, social),
                        ScoreWeights.DEFAULT));
    }
}
