package com.ecocart.ecocart_backend.model;

import java.util.List;

public record SubstitutionSuggestion(ScoredProduct original, List<SubstituteCandidate> substitutes) {

    public SubstitutionSuggestion {
        substitutes = substitutes == null ? List.of() : List.copyOf(substitutes);
    }
}
