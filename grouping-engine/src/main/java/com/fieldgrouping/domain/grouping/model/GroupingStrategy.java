package com.fieldgrouping.domain.grouping.model;

import java.util.List;

/**
 * The engine's output unit: how a set of fields should be grouped and rendered.
 * <p>
 * Construction rejects a confidence that does not match the evidence kind of {@code metadata}.
 */
public record GroupingStrategy(
        ConfidenceLevel confidence,
        GroupType groupType,
        String groupTitle,
        List<Field> members,
        GroupMetadata metadata
) {

    public GroupingStrategy {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("a strategy needs at least one member");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("metadata is required");
        }
        if (confidence != metadata.kind().confidence()) {
            throw new IllegalArgumentException("confidence " + confidence + " does not match "
                    + metadata.kind() + " evidence");
        }
        if (!allowedFor(metadata.kind(), groupType)) {
            throw new IllegalArgumentException(groupType + " cannot carry " + metadata.kind() + " evidence");
        }
        members = List.copyOf(members);
        groupTitle = groupTitle == null ? "" : groupTitle;
    }

    private static boolean allowedFor(EvidenceKind kind, GroupType groupType) {
        return switch (kind) {
            case CATEGORY_COMBO -> groupType == GroupType.DIMENSIONAL_GRID
                    || groupType == GroupType.RADIO_GROUP
                    || groupType == GroupType.CHECKBOX_GROUP;
            case DIMENSIONAL -> groupType == GroupType.DIMENSIONAL_GRID;
            case EXCLUSIVITY -> groupType == GroupType.RADIO_GROUP || groupType == GroupType.CHECKBOX_GROUP;
            case SEMANTIC -> groupType == GroupType.SEMANTIC_CLUSTER || groupType == GroupType.FLAT_LIST;
        };
    }

    public static GroupingStrategy flat(Field field, List<String> notes) {
        return new GroupingStrategy(ConfidenceLevel.LOW, GroupType.FLAT_LIST, field.name(), List.of(field),
                SemanticEvidence.fallback().withNotes(notes));
    }

    /**
     * True if the members should be drawn inside a visual group.
     */
    public boolean shouldRenderAsGroup() {
        return switch (groupType) {
            case FLAT_LIST -> false;
            case RADIO_GROUP, CHECKBOX_GROUP, DIMENSIONAL_GRID, SEMANTIC_CLUSTER -> members.size() >= 2;
        };
    }

    /**
     * True if this grouping comes from server metadata.
     */
    public boolean isDefinitive() {
        return confidence == ConfidenceLevel.HIGH;
    }

    public String detectionDescription() {
        return switch (metadata.kind()) {
            case CATEGORY_COMBO -> "Grouped by server category combination";
            case DIMENSIONAL -> "Detected " + metadata.dimensionalPattern().dimensions().size() + "-dimensional pattern";
            case EXCLUSIVITY -> {
                int percent = (int) Math.round(metadata.mutualExclusivityScore() * 100);
                yield groupType == GroupType.RADIO_GROUP
                        ? "Detected mutually exclusive options (" + percent + "% confidence)"
                        : "Detected related options (" + percent + "% confidence)";
            }
            case SEMANTIC -> groupType == GroupType.FLAT_LIST
                    ? "Default grouping"
                    : "Grouped by semantic similarity";
        };
    }
}
