package com.ecocart.ecocart_backend.model;

public enum RecommendationType {
    ECONOMIC("Best economic option"),
    ENVIRONMENTAL("Best environmental option"),
    SOCIAL("Best social option"),
    BALANCED("Best balanced option");

    private final String label;

    RecommendationType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static RecommendationType forDimension(ScoreDimension dimension) {
        return switch (dimension) {
            case ECONOMIC -> ECONOMIC;
            case ENVIRONMENTAL -> ENVIRONMENTAL;
            case SOCIAL -> SOCIAL;
        };
    }
}
