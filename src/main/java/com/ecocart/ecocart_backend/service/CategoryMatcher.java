package com.ecocart.ecocart_backend.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.ecocart.ecocart_backend.model.Product;

/**
 * Compares the categories and names of two products.
 *
 * <p>Categories come from the comma-separated {@code category} field plus the catalog
 * {@code categories_tags} with their language prefix removed. Two categories overlap when either one
 * contains the other.</p>
 */
@Component
public class CategoryMatcher {

    private static final Pattern LANGUAGE_PREFIX = Pattern.compile("^[a-z]{2}:");
    private static final Pattern KEYWORD_SEPARATOR = Pattern.compile("[\\s,-]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int PREFIX_LENGTH = 4;
    private static final double BONUS_PER_SHARED_CATEGORY = 0.05;
    private static final double MAX_SHARED_CATEGORY_BONUS = 0.15;
    private static final double MOST_SPECIFIC_BONUS = 0.10;

    private final CategoryRuleBook ruleBook;

    public CategoryMatcher(CategoryRuleBook ruleBook) {
        this.ruleBook = ruleBook;
    }

    public CategoryMatch match(Product product, Product candidate) {
        List<String> productCategories = extractCategories(product);
        List<String> candidateCategories = extractCategories(candidate);
        List<String> productSignificant = significant(productCategories);
        List<String> candidateSignificant = significant(candidateCategories);
        List<String> productKeywords = keywords(productCategories);
        List<String> candidateKeywords = keywords(candidateCategories);

        boolean basicMatch = anyOverlap(longerThan(productCategories, 2), longerThan(candidateCategories, 2));
        boolean keywordMatch = anyOverlap(productKeywords, candidateKeywords);
        boolean significantMatch = anyOverlap(productSignificant, candidateSignificant);
        boolean nameMatch = sharesNameWord(product, candidate);

        boolean sharedCategories = significantMatch
                || anyOverlap(productCategories, candidateCategories)
                || keywordMatch;
        boolean similarCategories = sharesPrefix(productCategories, candidateCategories);

        return new CategoryMatch(
                basicMatch,
                keywordMatch,
                significantMatch,
                nameMatch,
                sharedCategories,
                similarCategories,
                isIncompatible(productSignificant, candidateSignificant),
                categoryBonus(productSignificant, candidateSignificant)
        );
    }

    public List<String> extractCategories(Product product) {
        Set<String> categories = new LinkedHashSet<>();
        if (product == null) {
            return List.of();
        }
        if (product.category() != null) {
            for (String part : product.category().split(",")) {
                addCategory(categories, part);
            }
        }
        for (String tag : product.metadata().categoriesTags()) {
            if (tag == null) {
                continue;
            }
            addCategory(categories, LANGUAGE_PREFIX.matcher(tag.trim().toLowerCase(Locale.ROOT)).replaceFirst(""));
        }
        return List.copyOf(categories);
    }

    private void addCategory(Set<String> categories, String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (!value.isBlank()) {
            categories.add(value);
        }
    }

    private List<String> significant(List<String> categories) {
        return categories.stream()
                .filter(category -> category.length() > 3)
                .filter(category -> !ruleBook.isGeneric(category))
                .toList();
    }

    private List<String> longerThan(List<String> categories, int length) {
        return categories.stream()
                .filter(category -> category.length() > length)
                .toList();
    }

    private List<String> keywords(List<String> categories) {
        Set<String> keywords = new LinkedHashSet<>();
        for (String category : categories) {
            for (String word : KEYWORD_SEPARATOR.split(category)) {
                if (word.length() > 3) {
                    keywords.add(word);
                }
            }
        }
        return List.copyOf(keywords);
    }

    private boolean sharesNameWord(Product product, Product candidate) {
        List<String> productWords = nameWords(product);
        List<String> candidateWords = nameWords(candidate);
        for (String word : productWords) {
            if (candidateWords.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private List<String> nameWords(Product product) {
        if (product == null || product.name() == null) {
            return List.of();
        }
        List<String> words = new ArrayList<>();
        for (String word : WHITESPACE.split(product.name().toLowerCase(Locale.ROOT).trim())) {
            if (word.length() > 3) {
                words.add(word);
            }
        }
        return words;
    }

    private boolean sharesPrefix(List<String> productCategories, List<String> candidateCategories) {
        for (String category : productCategories) {
            for (String candidateCategory : candidateCategories) {
                if (candidateCategory.contains(prefix(category)) || category.contains(prefix(candidateCategory))) {
                    return true;
                }
            }
        }
        return false;
    }

    private String prefix(String category) {
        return category.length() <= PREFIX_LENGTH ? category : category.substring(0, PREFIX_LENGTH);
    }

    // A product in group g may not be replaced by a candidate carrying any category g rejects.
    private boolean isIncompatible(List<String> productSignificant, List<String> candidateSignificant) {
        for (CategoryRuleBook.IncompatibleGroup group : ruleBook.getIncompatibleGroups()) {
            if (productSignificant.stream().anyMatch(group::matches)
                    && candidateSignificant.stream().anyMatch(group::conflictsWith)) {
                return true;
            }
        }
        return false;
    }

    private double categoryBonus(List<String> productSignificant, List<String> candidateSignificant) {
        if (productSignificant.isEmpty() || candidateSignificant.isEmpty()) {
            return 0.0;
        }
        long sharedCount = productSignificant.stream()
                .filter(category -> overlapsAny(category, candidateSignificant))
                .count();
        if (sharedCount == 0) {
            return 0.0;
        }
        double bonus = Math.min(MAX_SHARED_CATEGORY_BONUS, sharedCount * BONUS_PER_SHARED_CATEGORY);
        String productMostSpecific = productSignificant.get(productSignificant.size() - 1);
        String candidateMostSpecific = candidateSignificant.get(candidateSignificant.size() - 1);
        if (overlaps(productMostSpecific, candidateMostSpecific)) {
            bonus += MOST_SPECIFIC_BONUS;
        }
        return bonus;
    }

    private boolean anyOverlap(List<String> left, List<String> right) {
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        for (String value : left) {
            if (overlapsAny(value, right)) {
                return true;
            }
        }
        return false;
    }

    private boolean overlapsAny(String value, List<String> others) {
        for (String other : others) {
            if (overlaps(value, other)) {
                return true;
            }
        }
        return false;
    }

    private boolean overlaps(String left, String right) {
        return left.contains(right) || right.contains(left);
    }

    /**
     * Outcome of comparing a product with a candidate substitute.
     *
     * @param sharedCategories significant, raw or keyword overlap; grants the widest score tolerance
     * @param similarCategories some category of one side contains the first four characters of a category of the other
     * @param categoryBonus 0.05 per shared significant category up to 0.15, plus 0.10 when the most specific ones overlap
     */
    public record CategoryMatch(
            boolean basicMatch,
            boolean keywordMatch,
            boolean significantMatch,
            boolean nameMatch,
            boolean sharedCategories,
            boolean similarCategories,
            boolean incompatible,
            double categoryBonus
    ) {

        public boolean isRelevant() {
            return basicMatch || keywordMatch || significantMatch || nameMatch;
        }

        public Strength strength() {
            if (sharedCategories) {
                return Strength.STRONG;
            }
            return similarCategories ? Strength.WEAK : Strength.NONE;
        }
    }

    public enum Strength {
        STRONG,
        WEAK,
        NONE
    }
}
