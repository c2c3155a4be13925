package com.fieldgrouping.domain.grouping.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Grouping of a whole form, keyed by scope id in first-seen order.
 *
 * @param scopes          completed scopes
 * @param cancelledScopes scopes dropped because the computation was cancelled
 */
public record FormGroupingResult(Map<String, ScopeGroupingResult> scopes, List<String> cancelledScopes) {

    public FormGroupingResult {
        scopes = Collections.unmodifiableMap(new LinkedHashMap<>(scopes));
        cancelledScopes = List.copyOf(cancelledScopes);
    }

    public boolean isCancelled() {
        return !cancelledScopes.isEmpty();
    }

    public List<GroupingStrategy> strategiesFor(String scopeId) {
        ScopeGroupingResult result = scopes.get(scopeId);
        return result != null ? result.strategies() : List.of();
    }
}
