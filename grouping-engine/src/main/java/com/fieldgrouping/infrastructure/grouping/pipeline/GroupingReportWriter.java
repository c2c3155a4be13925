package com.fieldgrouping.infrastructure.grouping.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldgrouping.domain.grouping.model.Dimension;
import com.fieldgrouping.domain.grouping.model.Field;
import com.fieldgrouping.domain.grouping.model.FormGroupingResult;
import com.fieldgrouping.domain.grouping.model.GroupMetadata;
import com.fieldgrouping.domain.grouping.model.GroupingStrategy;
import com.fieldgrouping.domain.grouping.model.InferredCategoryCombo;
import com.fieldgrouping.domain.grouping.model.ScopeGroupingResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes grouping results as JSON with a fixed key order, for debug logs and output comparison.
 */
@Component
@RequiredArgsConstructor
public class GroupingReportWriter {

    private final ObjectMapper objectMapper;

    public String write(FormGroupingResult result) {
        Map<String, Object> root = new LinkedHashMap<>();
        List<Object> scopes = new ArrayList<>();
        result.scopes().values().forEach(scope -> scopes.add(scopeTree(scope)));
        root.put("scopes", scopes);
        root.put("cancelledScopes", result.cancelledScopes());
        return toJson(root);
    }

    public String write(ScopeGroupingResult scope) {
        return toJson(scopeTree(scope));
    }

    public String write(List<GroupingStrategy> strategies) {
        return toJson(strategies.stream().map(GroupingReportWriter::strategyTree).toList());
    }

    private static Map<String, Object> scopeTree(ScopeGroupingResult scope) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("scopeId", scope.scopeId());
        node.put("strategies", scope.strategies().stream().map(GroupingReportWriter::strategyTree).toList());
        return node;
    }

    private static Map<String, Object> strategyTree(GroupingStrategy strategy) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("confidence", strategy.confidence().name());
        node.put("groupType", strategy.groupType().name());
        node.put("groupTitle", strategy.groupTitle());
        node.put("members", strategy.members().stream().map(GroupingReportWriter::memberTree).toList());
        node.put("metadata", metadataTree(strategy.metadata()));
        return node;
    }

    private static Map<String, Object> memberTree(Field field) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("id", field.id());
        node.put("name", field.name());
        node.put("categoryOptionCombo", field.categoryOptionCombo());
        return node;
    }

    private static Map<String, Object> metadataTree(GroupMetadata metadata) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("kind", metadata.kind().name());
        node.put("detectionMethod", metadata.detectionMethod());
        node.put("categoryComboUid", metadata.categoryComboUid());
        node.put("mutualExclusivityScore", metadata.mutualExclusivityScore());
        node.put("numericConfidenceScore", metadata.numericConfidenceScore());
        node.put("semanticSimilarityScore", metadata.semanticSimilarityScore());
        if (metadata.dimensionalPattern() != null) {
            Map<String, Object> pattern = new LinkedHashMap<>();
            pattern.put("baseName", metadata.dimensionalPattern().baseName());
            List<Object> dimensions = new ArrayList<>();
            for (Dimension dimension : metadata.dimensionalPattern().dimensions()) {
                Map<String, Object> d = new LinkedHashMap<>();
                d.put("name", dimension.name());
                d.put("order", dimension.order());
                d.put("values", List.copyOf(dimension.values()));
                dimensions.add(d);
            }
            pattern.put("dimensions", dimensions);
            node.put("dimensionalPattern", pattern);
        }
        InferredCategoryCombo combo = metadata.inferredCategoryCombo();
        if (combo != null) {
            Map<String, Object> c = new LinkedHashMap<>();
            c.put("name", combo.name());
            c.put("totalExpectedCombinations", combo.totalExpectedCombinations());
            c.put("actualCombinations", combo.actualCombinations());
            c.put("completenessRatio", combo.completenessRatio());
            c.put("isConditional", combo.isConditional());
            c.put("conditionalRules", combo.conditionalRules());
            node.put("inferredCategoryCombo", c);
        }
        node.put("notes", metadata.notes());
        return node;
    }

    private String toJson(Object tree) {
        try {
            return objectMapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write grouping report", e);
        }
    }
}
