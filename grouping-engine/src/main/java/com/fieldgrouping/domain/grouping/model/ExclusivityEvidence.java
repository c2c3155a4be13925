package com.fieldgrouping.domain.grouping.model;

import java.util.List;

/**
 * @param mutualExclusivityScore composite one-of-N score in [0, 1]
 * @param numericConfidenceScore ranking score for ties, in [0, 1]
 */
public record ExclusivityEvidence(
        Double mutualExclusivityScore,
        Double numericConfidenceScore,
        String detectionMethod,
        List<String> notes
) implements GroupMetadata {

    public ExclusivityEvidence {
        if (mutualExclusivityScore == null) {
            throw new IllegalArgumentException("mutualExclusivityScore is required");
        }
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    @Override
    public EvidenceKind kind() {
        return EvidenceKind.EXCLUSIVITY;
    }

    @Override
    public ExclusivityEvidence withNotes(List<String> notes) {
        return new ExclusivityEvidence(mutualExclusivityScore, numericConfidenceScore, detectionMethod, notes);
    }
}
