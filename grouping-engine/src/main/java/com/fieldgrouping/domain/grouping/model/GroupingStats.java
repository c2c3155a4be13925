package com.fieldgrouping.domain.grouping.model;

import java.util.List;

public record GroupingStats(
        int strategyCount,
        int fieldCount,
        int highCount,
        int mediumCount,
        int lowCount,
        int dimensionalGridCount,
        int radioGroupCount,
        int checkboxGroupCount,
        int semanticClusterCount,
        int flatListCount,
        int degradedFieldCount
) {
    public static GroupingStats from(List<GroupingStrategy> strategies) {
        int fields = 0, high = 0, medium = 0, low = 0;
        int grids = 0, radios = 0, checkboxes = 0, clusters = 0, flats = 0, degraded = 0;

        for (GroupingStrategy s : strategies) {
            fields += s.members().size();
            switch (s.confidence()) {
                case HIGH -> high++;
                case MEDIUM -> medium++;
                case LOW -> low++;
            }
            switch (s.groupType()) {
                case DIMENSIONAL_GRID -> grids++;
                case RADIO_GROUP -> radios++;
                case CHECKBOX_GROUP -> checkboxes++;
                case SEMANTIC_CLUSTER -> clusters++;
                case FLAT_LIST -> flats++;
            }
            if (!s.metadata().notes().isEmpty()) {
                degraded += s.members().size();
            }
        }

        return new GroupingStats(strategies.size(), fields, high, medium, low,
                grids, radios, checkboxes, clusters, flats, degraded);
    }
}
