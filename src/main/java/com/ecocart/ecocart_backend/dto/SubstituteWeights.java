package com.ecocart.ecocart_backend.dto;

public record SubstituteWeights(double score, double price, double carbon) {

    public static final SubstituteWeights DEFAULT = new SubstituteWeights(0.5, 0.3, 0.2);
}
