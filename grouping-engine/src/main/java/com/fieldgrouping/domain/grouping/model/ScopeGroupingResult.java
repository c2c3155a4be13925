package com.fieldgrouping.domain.grouping.model;

import java.util.List;

/**
 * Grouping of one scope (form section).
 */
public record ScopeGroupingResult(String scopeId, List<GroupingStrategy> strategies, GroupingStats stats) {

    public ScopeGroupingResult {
        strategies = List.copyOf(strategies);
    }

    public static ScopeGroupingResult of(String scopeId, List<GroupingStrategy> strategies) {
        return new ScopeGroupingResult(scopeId, strategies, GroupingStats.from(strategies));
    }
}
