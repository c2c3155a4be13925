package com.fieldgrouping.domain.grouping.model;

import java.util.List;

/**
 * Similarity evidence. Flat fallbacks carry it too, with a similarity of 0.
 */
public record SemanticEvidence(
        Double semanticSimilarityScore,
        String detectionMethod,
        List<String> notes
) implements GroupMetadata {

    public static final String FALLBACK_METHOD = "Fallback - no pattern detected";

    public SemanticEvidence {
        if (semanticSimilarityScore == null) {
            throw new IllegalArgumentException("semanticSimilarityScore is required");
        }
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public static SemanticEvidence fallback() {
        return new SemanticEvidence(0.0, FALLBACK_METHOD, List.of());
    }

    @Override
    public EvidenceKind kind() {
        return EvidenceKind.SEMANTIC;
    }

    @Override
    public SemanticEvidence withNotes(List<String> notes) {
        return new SemanticEvidence(semanticSimilarityScore, detectionMethod, notes);
    }
}
