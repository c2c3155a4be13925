package com.fieldgrouping.infrastructure.grouping.dimensional;

import com.fieldgrouping.domain.grouping.model.Dimension;
import com.fieldgrouping.domain.grouping.model.DimensionalEvidence;
import com.fieldgrouping.domain.grouping.model.DimensionalPattern;
import com.fieldgrouping.domain.grouping.model.GroupType;
import com.fieldgrouping.domain.grouping.model.InferredCategory;
import com.fieldgrouping.domain.grouping.model.InferredCategoryCombo;
import com.fieldgrouping.domain.grouping.model.SeparatorDetection;
import com.fieldgrouping.infrastructure.grouping.Resolution;
import com.fieldgrouping.infrastructure.grouping.ScopedField;
import com.fieldgrouping.infrastructure.grouping.tokenize.PatternTokenizer;
import com.fieldgrouping.infrastructure.grouping.tokenize.Separator;
import com.fieldgrouping.infrastructure.grouping.tokenize.SeparatorDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Finds multi-axis naming patterns such as {@code "Pupils Fed - P1 - Male"}.
 * <p>
 * Fields are tokenized with the scope's dominant separator first, then with the remaining separators in
 * priority order. Within one separator, fields are clustered by their first token. A token position is an
 * axis when it takes at least 2 and at most {@code max-axis-values} distinct values and repeats across the
 * cluster. Clusters with fewer than {@code min-axes} axes are left for the next stage.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DimensionalPatternExtractor {

    public static final String DETECTION_METHOD = "Dimensional Pattern Recognition";

    private final PatternTokenizer tokenizer;
    private final SeparatorDetector separatorDetector;
    private final DimensionNamer dimensionNamer;
    private final ConditionalRuleDetector conditionalRuleDetector;

    @Value("${grouping.dimensional.min-axes:2}")
    private int minAxes;

    @Value("${grouping.dimensional.max-axis-values:20}")
    private int maxAxisValues;

    private record Tokenized(ScopedField field, List<String> tokens) {
    }

    public List<Resolution> extract(List<ScopedField> fields) {
        List<Resolution> resolutions = new ArrayList<>();
        if (fields.size() < 2) {
            return resolutions;
        }

        List<ScopedField> remaining = new ArrayList<>(fields);
        for (Separator separator : separatorOrder(fields)) {
            List<Tokenized> candidates = new ArrayList<>();
            for (ScopedField field : remaining) {
                List<String> tokens = tokenizer.tokenize(field.name(), separator);
                if (tokens.size() >= 2) {
                    candidates.add(new Tokenized(field, tokens));
                }
            }
            if (candidates.size() < 2) {
                continue;
            }

            double consistency = separatorDetector.consistency(
                    candidates.stream().map(t -> t.field().name()).toList(), separator);
            if (!separatorDetector.accepts(consistency)) {
                log.debug("[DimensionalExtractor] '{}' too inconsistent ({}) over {} labels",
                        separator.literal(), String.format("%.2f", consistency), candidates.size());
                continue;
            }

            Map<String, List<Tokenized>> byBase = new LinkedHashMap<>();
            for (Tokenized t : candidates) {
                byBase.computeIfAbsent(t.tokens().get(0), k -> new ArrayList<>()).add(t);
            }

            for (List<Tokenized> cluster : byBase.values()) {
                if (cluster.size() < 2) {
                    continue;
                }
                analyze(cluster, separator).ifPresent(resolution -> {
                    resolutions.add(resolution);
                    remaining.removeAll(resolution.members());
                });
            }
        }
        return resolutions;
    }

    private List<Separator> separatorOrder(List<ScopedField> fields) {
        SeparatorDetection detection = separatorDetector.detect(fields.stream().map(ScopedField::name).toList());
        Separator dominant = separatorDetector.separatorFor(detection);

        List<Separator> order = new ArrayList<>();
        if (dominant != null) {
            order.add(dominant);
        }
        for (Separator separator : Separator.values()) {
            if (separator != dominant) {
                order.add(separator);
            }
        }
        return order;
    }

    private Optional<Resolution> analyze(List<Tokenized> cluster, Separator separator) {
        int maxLength = cluster.stream().mapToInt(t -> t.tokens().size()).max().orElse(0);

        List<Integer> axisPositions = new ArrayList<>();
        List<Set<String>> axisValues = new ArrayList<>();
        for (int position = 1; position < maxLength; position++) {
            Set<String> values = new LinkedHashSet<>();
            int present = 0;
            for (Tokenized t : cluster) {
                if (position < t.tokens().size()) {
                    values.add(t.tokens().get(position));
                    present++;
                }
            }
            if (values.size() >= 2 && values.size() <= maxAxisValues && values.size() < present) {
                axisPositions.add(position);
                axisValues.add(values);
            }
        }

        if (axisPositions.size() < minAxes) {
            return Optional.empty();
        }

        List<String> first = cluster.get(0).tokens();
        String baseName = String.join(separator.joiner(), first.subList(0, axisPositions.get(0)));

        List<Dimension> dimensions = new ArrayList<>();
        Set<String> taken = new HashSet<>();
        for (int i = 0; i < axisPositions.size(); i++) {
            String name = dimensionNamer.name(axisValues.get(i), axisPositions.get(i), taken);
            taken.add(name);
            dimensions.add(new Dimension(name, axisValues.get(i), axisPositions.get(i)));
        }
        DimensionalPattern pattern = new DimensionalPattern(baseName, dimensions);

        List<List<String>> rows = new ArrayList<>();
        for (Tokenized t : cluster) {
            List<String> row = new ArrayList<>();
            for (int position : axisPositions) {
                row.add(position < t.tokens().size() ? t.tokens().get(position) : null);
            }
            rows.add(row);
        }

        OptionalInt expected = InferredCategoryCombo.combinationCount(axisValues.stream().map(Set::size).toList());
        if (expected.isEmpty()) {
            log.debug("[DimensionalExtractor] base='{}' has too many combinations across {} axes, not a grid",
                    baseName, axisValues.size());
            return Optional.empty();
        }
        int total = expected.getAsInt();
        int actual = Math.min(new LinkedHashSet<>(rows).size(), total);

        List<InferredCategory> categories = dimensions.stream()
                .map(d -> new InferredCategory(d.name(), List.copyOf(d.values()), d.values().size(),
                        "Token position " + d.order()))
                .toList();
        List<String> fieldIds = cluster.stream().map(t -> t.field().field().id()).distinct().toList();
        InferredCategoryCombo combo = InferredCategoryCombo.of(
                        String.join(" × ", dimensions.stream().map(Dimension::name).toList()),
                        categories, total, actual, fieldIds)
                .withConditionalRules(conditionalRuleDetector.detect(pattern, rows));

        List<ScopedField> members = cluster.stream().map(Tokenized::field).toList();
        log.debug("[DimensionalExtractor] base='{}' axes={} members={} completeness={}",
                baseName, dimensions.size(), members.size(), String.format("%.2f", combo.completenessRatio()));

        return Optional.of(new Resolution(members, GroupType.DIMENSIONAL_GRID, baseName,
                new DimensionalEvidence(pattern, combo,
                        DETECTION_METHOD + " ('" + separator.literal() + "' separator)", List.of())));
    }

}
