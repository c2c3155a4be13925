package com.fieldgrouping.infrastructure.grouping.dimensional;

import com.fieldgrouping.domain.grouping.model.Dimension;
import com.fieldgrouping.domain.grouping.model.DimensionalPattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Finds dimension values that replace another dimension instead of combining with it.
 * <p>
 * Each observation row holds, per dimension (in pattern order), the value a field takes,
 * or {@code null} when the field's label has no token at that dimension's position.
 */
@Slf4j
@Component
public class ConditionalRuleDetector {

    public List<String> detect(DimensionalPattern pattern, List<List<String>> rows) {
        List<Dimension> dimensions = pattern.dimensions();
        List<String> rules = new ArrayList<>();

        for (int d = 0; d < dimensions.size(); d++) {
            Dimension dimension = dimensions.get(d);
            for (String value : dimension.values()) {
                for (int e = 0; e < dimensions.size(); e++) {
                    if (e == d) {
                        continue;
                    }
                    Set<String> coOccurring = coOccurrence(rows, d, value, e);
                    if (coOccurring.isEmpty()) {
                        rules.add("If " + value + ", dimension " + dimensions.get(e).name() + " is omitted");
                    }
                }
            }
        }

        if (!rules.isEmpty()) {
            log.debug("[ConditionalRuleDetector] base={} rules={}", pattern.baseName(), rules);
        }
        return rules;
    }

    private static Set<String> coOccurrence(List<List<String>> rows, int d, String value, int e) {
        Set<String> result = new LinkedHashSet<>();
        for (List<String> row : rows) {
            if (Objects.equals(row.get(d), value) && row.get(e) != null) {
                result.add(row.get(e));
            }
        }
        return result;
    }
}
