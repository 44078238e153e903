package com.ecocart.ecocart_backend.service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import com.ecocart.ecocart_backend.config.SubstitutionProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Category and dietary vocabulary used by the substitution matcher, loaded once from a classpath JSON resource.
 * A missing or malformed resource yields an empty rule book: no generic categories, no incompatibility vetoes
 * and no dietary keywords.
 */
@Component
public class CategoryRuleBook {

    private static final Logger log = LoggerFactory.getLogger(CategoryRuleBook.class);

    private final String version;
    private final List<String> genericCategories;
    private final List<IncompatibleGroup> incompatibleGroups;
    private final List<String> veganLabels;
    private final List<String> animalIngredients;
    private final List<String> glutenFreeLabels;
    private final List<String> glutenIngredients;

    public CategoryRuleBook(SubstitutionProperties substitutionProperties, ResourceLoader resourceLoader) {
        ObjectMapper objectMapper = new ObjectMapper();
        String location = substitutionProperties.getRulesResource();
        JsonNode root = loadRules(objectMapper, resourceLoader, location);

        String loadedVersion = safeText(root.path("version"));
        this.version = loadedVersion.isBlank() ? "fallback" : loadedVersion;
        this.genericCategories = textList(root.path("genericCategories"));

        List<IncompatibleGroup> groups = new ArrayList<>();
        JsonNode groupsNode = root.path("incompatibleGroups");
        if (groupsNode.isArray()) {
            for (JsonNode groupNode : groupsNode) {
                String id = safeText(groupNode.path("id"));
                List<String> terms = textList(groupNode.path("terms"));
                if (id.isBlank() || terms.isEmpty()) {
                    continue;
                }
                groups.add(new IncompatibleGroup(id, terms, textList(groupNode.path("incompatibleWith"))));
            }
        }
        this.incompatibleGroups = List.copyOf(groups);

        JsonNode dietary = root.path("dietary");
        this.veganLabels = textList(dietary.path("veganLabels"));
        this.animalIngredients = textList(dietary.path("animalIngredients"));
        this.glutenFreeLabels = textList(dietary.path("glutenFreeLabels"));
        this.glutenIngredients = textList(dietary.path("glutenIngredients"));

        log.info("Category rules loaded: version={}, genericCategories={}, incompatibleGroups={}",
                version, genericCategories.size(), incompatibleGroups.size());
    }

    public String getVersion() {
        return version;
    }

    public List<String> getGenericCategories() {
        return genericCategories;
    }

    public List<IncompatibleGroup> getIncompatibleGroups() {
        return incompatibleGroups;
    }

    public List<String> getVeganLabels() {
        return veganLabels;
    }

    public List<String> getAnimalIngredients() {
        return animalIngredients;
    }

    public List<String> getGlutenFreeLabels() {
        return glutenFreeLabels;
    }

    public List<String> getGlutenIngredients() {
        return glutenIngredients;
    }

    /**
     * True when {@code category} contains one of the generic stoplist entries.
     */
    public boolean isGeneric(String category) {
        for (String generic : genericCategories) {
            if (category.contains(generic)) {
                return true;
            }
        }
        return false;
    }

    private JsonNode loadRules(ObjectMapper objectMapper, ResourceLoader resourceLoader, String location) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream inputStream = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(inputStream);
            if (root == null || root.isMissingNode() || !root.isObject()) {
                throw new IllegalStateException("Category rules resource is not a valid JSON object.");
            }
            return root;
        } catch (IOException | RuntimeException ex) {
            log.error("Failed to load category rules resource {}: {}", location, ex.getMessage());
            return objectMapper.createObjectNode();
        }
    }

    private List<String> textList(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            String value = safeText(item).toLowerCase(Locale.ROOT);
            if (!value.isBlank()) {
                values.add(value);
            }
        }
        return List.copyOf(values);
    }

    private String safeText(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return "";
        }
        return node.asText("").trim();
    }

    /**
     * A family of categories (for example milks) that must not be replaced by a product from one of the
     * {@code incompatibleWith} families.
     */
    public record IncompatibleGroup(String id, List<String> terms, List<String> incompatibleWith) {

        public IncompatibleGroup {
            terms = List.copyOf(terms);
            incompatibleWith = List.copyOf(incompatibleWith);
        }

        public boolean matches(String category) {
            return containsTerm(category, terms);
        }

        public boolean conflictsWith(String category) {
            return containsTerm(category, incompatibleWith);
        }

        // Terms only match at the start of a word so "semidesnatada" is not read as "nata".
        private static boolean containsTerm(String category, List<String> candidates) {
            for (String term : candidates) {
                int index = category.indexOf(term);
                while (index >= 0) {
                    if (index == 0 || !Character.isLetterOrDigit(category.charAt(index - 1))) {
                        return true;
                    }
                    index = category.indexOf(term, index + 1);
                }
            }
            return false;
        }
    }
}
