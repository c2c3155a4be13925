package com.fieldgrouping.domain.grouping.model;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Closed value domain of a field, or of an inferred group.
 */
public record OptionSet(String id, String name, List<Option> options) {

    private static final Set<String> BOOLEAN_CODES = Set.of("yes", "no", "true", "false", "1", "0");

    public OptionSet {
        options = options == null ? List.of() : List.copyOf(options);
    }

    /**
     * True for exactly two options whose codes read as yes/no, true/false or 1/0.
     */
    public boolean isYesNo() {
        return options.size() == 2 && options.stream()
                .allMatch(o -> o.code() != null && BOOLEAN_CODES.contains(o.code().toLowerCase(Locale.ROOT)));
    }

    public List<Option> sortedOptions() {
        return options.stream()
                .sorted(Comparator.comparingInt(Option::sortOrder))
                .toList();
    }

    public Optional<Option> findByCode(String code) {
        return options.stream()
                .filter(o -> o.code().equals(code))
                .findFirst();
    }

    public Optional<String> displayNameForCode(String code) {
        return findByCode(code).map(Option::label);
    }
}
