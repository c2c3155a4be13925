package com.fieldgrouping.infrastructure.grouping.dimensional;

import com.fieldgrouping.domain.grouping.model.Field;
import com.fieldgrouping.domain.grouping.model.ImpliedCategory;
import com.fieldgrouping.domain.grouping.model.ImpliedCategoryCombination;
import com.fieldgrouping.domain.grouping.model.ImpliedCategoryMapping;
import com.fieldgrouping.infrastructure.grouping.tokenize.PatternTokenizer;
import com.fieldgrouping.infrastructure.grouping.tokenize.Separator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Infers a section-wide category structure from labels such as {@code "ANC - First Visit - Weight"},
 * where every level but the last is a category and the last token is the field's own name.
 * Used for nested rendering of sections that carry no server category combo.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImpliedCategoryInferenceService {

    private static final double MIN_CONFIDENCE = 0.6;
    private static final double MIN_STRUCTURED_RATIO = 0.7;
    private static final double MIN_DEPTH_CONSISTENCY = 0.8;
    private static final int MAX_LEVEL_OPTIONS = 20;

    private static final List<Separator> SEPARATORS = List.of(
            Separator.HYPHEN, Separator.PIPE, Separator.UNDERSCORE, Separator.COLON);

    private final PatternTokenizer tokenizer;
    private final DimensionNamer dimensionNamer;

    /**
     * First separator, in priority order, whose structure clears the confidence floor.
     */
    public Optional<ImpliedCategoryCombination> inferCategoryStructure(List<Field> fields, String sectionName) {
        if (fields.isEmpty()) {
            return Optional.empty();
        }

        for (Separator separator : SEPARATORS) {
            Optional<ImpliedCategoryCombination> result = tryInfer(fields, separator, sectionName);
            if (result.isPresent() && result.get().confidence() >= MIN_CONFIDENCE) {
                log.info("[ImpliedCategories] section='{}' separator='{}' levels={} confidence={}",
                        sectionName, separator.literal(), result.get().categories().size(),
                        String.format("%.2f", result.get().confidence()));
                return result;
            }
        }

        log.debug("[ImpliedCategories] section='{}' has no implied structure", sectionName);
        return Optional.empty();
    }

    private Optional<ImpliedCategoryCombination> tryInfer(List<Field> fields, Separator separator,
                                                         String sectionName) {
        List<List<String>> parsed = new ArrayList<>();
        for (Field field : fields) {
            List<String> tokens = tokenizer.tokenize(field.name(), separator);
            if (tokens.size() >= 2) {
                parsed.add(tokens);
            }
        }

        double structuredRatio = (double) parsed.size() / fields.size();
        if (structuredRatio < MIN_STRUCTURED_RATIO) {
            return Optional.empty();
        }

        Map<Integer, Integer> depthCounts = new LinkedHashMap<>();
        for (List<String> tokens : parsed) {
            depthCounts.merge(tokens.size(), 1, Integer::sum);
        }
        int modalDepth = 0;
        int modalCount = 0;
        for (Map.Entry<Integer, Integer> entry : depthCounts.entrySet()) {
            if (entry.getValue() > modalCount) {
                modalDepth = entry.getKey();
                modalCount = entry.getValue();
            }
        }

        double depthConsistency = (double) modalCount / parsed.size();
        if (depthConsistency < MIN_DEPTH_CONSISTENCY) {
            log.debug("[ImpliedCategories] section='{}' separator='{}' depth consistency {}",
                    sectionName, separator.literal(), String.format("%.2f", depthConsistency));
            return Optional.empty();
        }

        final int depth = modalDepth;
        List<List<String>> atDepth = parsed.stream().filter(t -> t.size() == depth).toList();

        List<ImpliedCategory> categories = new ArrayList<>();
        Set<String> taken = new HashSet<>();
        for (int level = 0; level < depth - 1; level++) {
            Set<String> options = new LinkedHashSet<>();
            for (List<String> tokens : atDepth) {
                options.add(tokens.get(level));
            }
            if (options.size() > MAX_LEVEL_OPTIONS || options.size() == atDepth.size()) {
                continue;
            }
            String name = dimensionNamer.name(options, level + 1, taken);
            taken.add(name);
            categories.add(new ImpliedCategory(name, List.copyOf(options), level, separator.literal()));
        }

        if (categories.isEmpty()) {
            return Optional.empty();
        }

        double confidence = structuredRatio * 0.5
                + depthConsistency * 0.3
                + Math.min(categories.size() / 3.0, 1.0) * 0.2;

        return Optional.of(new ImpliedCategoryCombination(categories, confidence, separator.pattern(),
                fields.size(), parsed.size()));
    }

    /**
     * Per-field category option at every level, skipping fields that do not split.
     */
    public List<ImpliedCategoryMapping> createMappings(List<Field> fields, ImpliedCategoryCombination combination) {
        if (combination.categories().isEmpty()) {
            return List.of();
        }
        Separator separator = separatorFor(combination.categories().get(0).separator());

        List<ImpliedCategoryMapping> mappings = new ArrayList<>();
        for (Field field : fields) {
            List<String> tokens = tokenizer.tokenize(field.name(), separator);
            if (tokens.size() < 2) {
                continue;
            }
            Map<Integer, String> options = new LinkedHashMap<>();
            for (ImpliedCategory category : combination.categories()) {
                if (category.level() < tokens.size() - 1) {
                    options.put(category.level(), tokens.get(category.level()));
                }
            }
            mappings.add(new ImpliedCategoryMapping(field.id(), field.name(), options,
                    tokens.get(tokens.size() - 1)));
        }
        return mappings;
    }

    /**
     * Mappings keyed by their option tuple (one entry per level, empty when missing), in first-seen order.
     */
    public Map<List<String>, List<ImpliedCategoryMapping>> groupByImpliedCategories(
            List<ImpliedCategoryMapping> mappings, ImpliedCategoryCombination combination) {
        Map<List<String>, List<ImpliedCategoryMapping>> grouped = new LinkedHashMap<>();
        for (ImpliedCategoryMapping mapping : mappings) {
            List<String> key = combination.categories().stream()
                    .map(c -> mapping.categoryOptionsByLevel().getOrDefault(c.level(), ""))
                    .toList();
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(mapping);
        }
        return grouped;
    }

    private static Separator separatorFor(String literal) {
        for (Separator separator : SEPARATORS) {
            if (separator.literal().equals(literal)) {
                return separator;
            }
        }
        throw new IllegalArgumentException("unknown separator: " + literal);
    }
}
