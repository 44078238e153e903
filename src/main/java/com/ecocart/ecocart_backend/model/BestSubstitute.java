package com.ecocart.ecocart_backend.model;

public record BestSubstitute(SubstituteCandidate substitute, double compositeScore) {
}
