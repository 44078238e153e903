package com.ecocart.ecocart_backend.model;

import java.util.List;

public record ProductMetadata(
        String packaging,
        String origins,
        List<String> labelsTags,
        String ingredientsText,
        List<String> additives,
        List<String> categoriesTags
) {

    private static final ProductMetadata EMPTY = new ProductMetadata(null, null, null, null, null, null);

    public ProductMetadata {
        labelsTags = labelsTags == null ? List.of() : List.copyOf(labelsTags);
        additives = additives == null ? List.of() : List.copyOf(additives);
        categoriesTags = categoriesTags == null ? List.of() : List.copyOf(categoriesTags);
    }

    public static ProductMetadata empty() {
        return EMPTY;
    }

    public boolean hasOrigins() {
        return origins != null && !origins.isBlank();
    }

    public String joinedLabels() {
        return String.join(" ", labelsTags);
    }
}
