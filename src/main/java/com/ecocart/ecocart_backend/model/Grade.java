package com.ecocart.ecocart_backend.model;

import java.util.Locale;

public enum Grade {
    A(1.0),
    B(0.8),
    C(0.6),
    D(0.4),
    E(0.2);

    private final double environmentalBase;

    Grade(double environmentalBase) {
        this.environmentalBase = environmentalBase;
    }

    public double getEnvironmentalBase() {
        return environmentalBase;
    }

    public boolean isGoodNutrition() {
        return this == A || this == B;
    }

    /**
     * Parses "a", " B ", "en:c" style grade text. Anything that is not a single A-E letter maps to null.
     */
    public static Grade fromCode(String code) {
        if (code == null) {
            return null;
        }
        String value = code.trim().toUpperCase(Locale.ROOT);
        int colon = value.lastIndexOf(':');
        if (colon >= 0) {
            value = value.substring(colon + 1).trim();
        }
        if (value.length() != 1) {
            return null;
        }
        for (Grade grade : values()) {
            if (grade.name().equals(value)) {
                return grade;
            }
        }
        return null;
    }
}
