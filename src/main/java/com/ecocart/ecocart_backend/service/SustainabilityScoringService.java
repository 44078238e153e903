package com.ecocart.ecocart_backend.service;

import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.ecocart.ecocart_backend.config.ScoringProperties;
import com.ecocart.ecocart_backend.model.Grade;
import com.ecocart.ecocart_backend.model.Product;
import com.ecocart.ecocart_backend.model.ProductMetadata;
import com.ecocart.ecocart_backend.model.ScoreBreakdown;
import com.ecocart.ecocart_backend.model.ScoreWeights;
import com.ecocart.ecocart_backend.model.ScoredProduct;
import com.ecocart.ecocart_backend.model.SustainabilityScore;

/**
 * Computes the economic, environmental and social sub-scores of a product and their weighted composite.
 * Missing fields fall back to neutral values; this service never throws for incomplete records.
 */
@Service
public class SustainabilityScoringService {

    private static final Logger log = LoggerFactory.getLogger(SustainabilityScoringService.class);

    private static final String[] SUSTAINABLE_PACKAGING_MARKERS = {"recyclable", "reciclable", "biodegradable"};
    private static final String IMPORT_MARKER = "import";
    private static final String[] FAIR_TRADE_MARKERS = {"fair trade", "fair-trade", "fairtrade", "comercio justo"};
    private static final String[] ORGANIC_MARKERS = {"organic", "bio", "orgánico", "ecológico"};
    private static final String[] RAINFOREST_MARKERS = {"rainforest"};

    private final ScoringProperties scoringProperties;

    public SustainabilityScoringService(ScoringProperties scoringProperties) {
        this.scoringProperties = scoringProperties;
    }

    public ScoreWeights defaultWeights() {
        return scoringProperties.getWeights().toScoreWeights();
    }

    public SustainabilityScore score(Product product) {
        return score(product, null);
    }

    public SustainabilityScore score(Product product, ScoreWeights weights) {
        ScoreWeights activeWeights = weights == null ? defaultWeights() : weights;
        if (product == null) {
            double neutral = scoringProperties.getNeutralScore();
            return composite(neutral, neutral, neutral, activeWeights);
        }
        double economic = economicScore(product);
        double environmental = environmentalScore(product);
        double social = socialScore(product);
        SustainabilityScore score = composite(economic, environmental, social, activeWeights);
        log.debug("Scored product='{}' version={} total={} economic={} environmental={} social={}",
                safe(product.name()), scoringProperties.getVersion(), score.total(),
                score.breakdown().economic(), score.breakdown().environmental(), score.breakdown().social());
        return score;
    }

    public List<ScoredProduct> scoreAll(List<Product> products) {
        return scoreAll(products, null);
    }

    public List<ScoredProduct> scoreAll(List<Product> products, ScoreWeights weights) {
        if (products == null || products.isEmpty()) {
            return List.of();
        }
        return products.stream()
                .map(product -> new ScoredProduct(product, score(product, weights)))
                .toList();
    }

    private SustainabilityScore composite(double economic, double environmental, double social, ScoreWeights weights) {
        double total = economic * weights.economic()
                + environmental * weights.environmental()
                + social * weights.social();
        return new SustainabilityScore(
                round2(total),
                new ScoreBreakdown(round2(economic), round2(environmental), round2(social)),
                weights
        );
    }

    private double economicScore(Product product) {
        if (!product.hasPrice()) {
            return scoringProperties.getNeutralScore();
        }
        double normalizedPrice = Math.min(product.price() / scoringProperties.getPriceCeiling(), 1.0);
        double score = 1.0 - normalizedPrice;
        Grade nutrition = product.nutritionGrade();
        if (nutrition != null && nutrition.isGoodNutrition()) {
            score += scoringProperties.getBonuses().getNutrition();
        }
        return clamp(score);
    }

    private double environmentalScore(Product product) {
        ScoringProperties.Bonuses bonuses = scoringProperties.getBonuses();
        ProductMetadata metadata = product.metadata();

        double score = product.ecoScore() == null
                ? scoringProperties.getNeutralScore()
                : product.ecoScore().getEnvironmentalBase();

        if (product.hasCarbonFootprint()) {
            double carbonScore = Math.max(0.0, 1.0 - product.carbonFootprint() / scoringProperties.getCarbonCeilingKg());
            double blend = scoringProperties.getCarbonBlendWeight();
            score = score * (1.0 - blend) + carbonScore * blend;
        }

        if (containsAny(lower(metadata.packaging()), SUSTAINABLE_PACKAGING_MARKERS)) {
            score += bonuses.getSustainablePackaging();
        }

        if (metadata.hasOrigins() && !lower(metadata.origins()).contains(IMPORT_MARKER)) {
            score += bonuses.getLocalOrigin();
        }

        return clamp(score);
    }

    private double socialScore(Product product) {
        ScoringProperties.Bonuses bonuses = scoringProperties.getBonuses();
        ProductMetadata metadata = product.metadata();
        String labelText = lower(metadata.joinedLabels());

        double score = scoringProperties.getNeutralScore();
        if (containsAny(labelText, FAIR_TRADE_MARKERS)) {
            score += bonuses.getFairTrade();
        }
        if (containsAny(labelText, ORGANIC_MARKERS)) {
            score += bonuses.getOrganic();
        }
        if (containsAny(labelText, RAINFOREST_MARKERS)) {
            score += bonuses.getRainforestAlliance();
        }
        if (metadata.hasOrigins()) {
            score += bonuses.getTraceableOrigin();
        }
        if (metadata.additives().size() > bonuses.getAdditiveLimit()) {
            score -= bonuses.getAdditivePenalty();
        }
        return clamp(score);
    }

    private boolean containsAny(String value, String... markers) {
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

    private double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
