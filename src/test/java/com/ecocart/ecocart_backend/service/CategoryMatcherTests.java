package com.ecocart.ecocart_backend.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.DefaultResourceLoader;

import com.ecocart.ecocart_backend.config.SubstitutionProperties;
import com.ecocart.ecocart_backend.model.Product;
import com.ecocart.ecocart_backend.model.ProductMetadata;

@SpringBootTest
class CategoryMatcherTests {

    @Autowired
    private CategoryMatcher categoryMatcher;

    @Autowired
    private CategoryRuleBook ruleBook;

    @Test
    void categoriesComeFromFieldAndTagsWithoutLanguagePrefix() {
        Product milk = product("Leche entera", "Lácteos, Leches", List.of("en:milks", "es:leches"));

        assertThat(categoryMatcher.extractCategories(milk)).containsExactly("lácteos", "leches", "milks");
    }

    @Test
    void milkIsIncompatibleWithButter() {
        Product milk = product("Leche semidesnatada Granja", "Leche semidesnatada", List.of());
        Product butter = product("Mantequilla sin sal", "Mantequilla", List.of());

        CategoryMatcher.CategoryMatch match = categoryMatcher.match(milk, butter);

        assertThat(match.incompatible()).isTrue();
    }

    @Test
    void milkIsCompatibleWithAnotherMilk() {
        Product semiSkimmed = product("Leche semidesnatada Granja", "Leche semidesnatada", List.of());
        Product whole = product("Leche entera Valle", "Leche entera", List.of());

        CategoryMatcher.CategoryMatch match = categoryMatcher.match(semiSkimmed, whole);

        assertThat(match.incompatible()).isFalse();
        assertThat(match.keywordMatch()).isTrue();
        assertThat(match.strength()).isEqualTo(CategoryMatcher.Strength.STRONG);
        assertThat(match.isRelevant()).isTrue();
    }

    @Test
    void sharedSpecificCategoriesEarnBonus() {
        Product first = product("Leche Pascual", "Lácteos, Leches", List.of());
        Product second = product("Bebida Puleva", "Lácteos, Leches", List.of());

        CategoryMatcher.CategoryMatch match = categoryMatcher.match(first, second);

        assertThat(match.significantMatch()).isTrue();
        assertThat(match.categoryBonus()).isCloseTo(0.20, within(1e-9));
    }

    @Test
    void genericCategoriesDoNotCountAsSignificant() {
        Product first = product("Galletas María", "Alimentos", List.of());
        Product second = product("Zumo naranja", "Alimentos, Bebidas", List.of());

        CategoryMatcher.CategoryMatch match = categoryMatcher.match(first, second);

        assertThat(match.basicMatch()).isTrue();
        assertThat(match.significantMatch()).isFalse();
        assertThat(match.categoryBonus()).isEqualTo(0.0);
    }

    @Test
    void unrelatedProductsHaveNoRelevance() {
        Product biscuits = product("Galletas María", "Galletas", List.of());
        Product detergent = product("Detergente líquido", "Detergentes", List.of());

        CategoryMatcher.CategoryMatch match = categoryMatcher.match(biscuits, detergent);

        assertThat(match.isRelevant()).isFalse();
        assertThat(match.strength()).isEqualTo(CategoryMatcher.Strength.NONE);
    }

    @Test
    void sharedNameWordIsRelevantWithoutCategories() {
        Product first = product("Leche Pascual", null, List.of());
        Product second = product("Leche Puleva", null, List.of());

        CategoryMatcher.CategoryMatch match = categoryMatcher.match(first, second);

        assertThat(match.nameMatch()).isTrue();
        assertThat(match.isRelevant()).isTrue();
        assertThat(match.strength()).isEqualTo(CategoryMatcher.Strength.NONE);
    }

    @Test
    void commonPrefixGivesWeakMatch() {
        Product first = product("Tableta negra", "Chocolates", List.of());
        Product second = product("Barritas", "Chocolatinas", List.of());

        CategoryMatcher.CategoryMatch match = categoryMatcher.match(first, second);

        assertThat(match.sharedCategories()).isFalse();
        assertThat(match.similarCategories()).isTrue();
        assertThat(match.strength()).isEqualTo(CategoryMatcher.Strength.WEAK);
    }

    @Test
    void ruleBookLoadsBundledRules() {
        assertThat(ruleBook.getVersion()).isEqualTo("ecocart-category-rules-v1");
        assertThat(ruleBook.getIncompatibleGroups()).extracting(CategoryRuleBook.IncompatibleGroup::id)
                .containsExactly("milk", "cream", "cheese", "butter");
        assertThat(ruleBook.isGeneric("alimentos de origen vegetal")).isTrue();
        assertThat(ruleBook.isGeneric("leches")).isFalse();
    }

    @Test
    void missingRuleBookFallsBackToEmptyRules() {
        SubstitutionProperties properties = new SubstitutionProperties();
        properties.setRulesResource("classpath:substitution/does-not-exist.json");

        CategoryRuleBook fallback = new CategoryRuleBook(properties, new DefaultResourceLoader());

        assertThat(fallback.getVersion()).isEqualTo("fallback");
        assertThat(fallback.getGenericCategories()).isEmpty();
        assertThat(fallback.getIncompatibleGroups()).isEmpty();
        assertThat(fallback.getAnimalIngredients()).isEmpty();
    }

    private Product product(String name, String category, List<String> categoryTags) {
        return new Product(name, null, name, category, 1.0, "EUR", null, null, null, 1,
                new ProductMetadata(null, null, List.of(), null, List.of(), categoryTags));
    }
}
