package com.ecocart.ecocart_backend.model;

public record ScoreBreakdown(double economic, double environmental, double social) {

    public static final ScoreBreakdown ZERO = new ScoreBreakdown(0.0, 0.0, 0.0);

    public double valueOf(ScoreDimension dimension) {
        return switch (dimension) {
            case ECONOMIC -> economic;
            case ENVIRONMENTAL -> environmental;
            case SOCIAL -> social;
        };
    }
}
