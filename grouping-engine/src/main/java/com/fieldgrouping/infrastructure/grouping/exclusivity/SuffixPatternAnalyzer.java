package com.fieldgrouping.infrastructure.grouping.exclusivity;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores how much a set of options reads like one-of-N alternatives, in [0, 1].
 */
@Component
public class SuffixPatternAnalyzer {

    static final List<Set<String>> TAXONOMIES = List.of(
            Set.of("public", "private", "government", "ngo", "faith-based", "community"),
            Set.of("urban", "rural", "peri urban", "peri-urban", "remote"),
            Set.of("licensed", "not licensed", "unlicensed", "registered", "unregistered"),
            Set.of("day", "boarding", "mixed", "residential"),
            Set.of("boys only", "girls only", "mixed", "male", "female", "coeducational"),
            Set.of("permanent", "temporary", "semi-permanent"),
            Set.of("active", "inactive", "closed", "suspended"),
            Set.of("primary", "secondary", "tertiary", "preschool", "elementary")
    );

    private static final List<String> ATTRIBUTE_WORDS =
            List.of("available", "functioning", "damaged", "working", "broken", "has", "does", "is");

    private static final Pattern NUMBER = Pattern.compile("\\b(\\d{1,9})\\b");
    private static final Pattern LETTER = Pattern.compile("\\b([A-Z])\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public double analyze(List<String> options) {
        if (options.isEmpty()) {
            return 0.0;
        }
        List<String> lower = options.stream().map(o -> o.toLowerCase(Locale.ROOT)).toList();
        double score = 0.0;

        boolean anyNegated = lower.stream().anyMatch(SuffixPatternAnalyzer::isNegated);
        boolean anyPlain = lower.stream().anyMatch(o -> !isNegated(o));
        if (anyNegated && anyPlain) {
            score += 0.4;
        }

        long properNouns = options.stream()
                .filter(o -> !o.isEmpty() && Character.isUpperCase(o.charAt(0)))
                .filter(o -> {
                    String l = o.toLowerCase(Locale.ROOT);
                    return !l.contains(" is ") && !l.contains(" has ") && !l.contains(" does ");
                })
                .count();
        if (properNouns >= options.size() * 0.7) {
            score += 0.3;
        }

        if (lower.stream().anyMatch(o -> containsAnyWord(o, ATTRIBUTE_WORDS))) {
            score -= 0.3;
        }

        boolean allShort = options.stream().allMatch(o -> WHITESPACE.split(o.strip()).length <= 2);
        if (allShort && options.size() >= 3) {
            score += 0.2;
        }

        if (matchesTaxonomy(lower)) {
            score += 0.3;
        }

        if (isNumericEnumeration(options)) {
            score += 0.4;
        }

        if (lower.stream().anyMatch(o -> o.contains(" and ") || o.contains(" or ") || o.contains(","))) {
            score -= 0.2;
        }

        if (isLetterEnumeration(options)) {
            score += 0.3;
        }

        return Math.max(0.0, Math.min(1.0, score));
    }

    static boolean matchesTaxonomy(List<String> lowerOptions) {
        return TAXONOMIES.stream().anyMatch(taxonomy ->
                lowerOptions.stream().anyMatch(o -> taxonomy.stream().anyMatch(o::contains)));
    }

    /**
     * True if at least 60% of options carry distinct (or consecutive) numbers, e.g. "Type 1", "Type 2".
     */
    public boolean isNumericEnumeration(List<String> options) {
        List<Integer> numbers = new ArrayList<>();
        for (String option : options) {
            Matcher m = NUMBER.matcher(option);
            if (m.find()) {
                numbers.add(Integer.parseInt(m.group(1)));
            }
        }
        return isEnumeration(numbers, options.size());
    }

    /**
     * True if at least 60% of options carry distinct single capital letters, e.g. "Option A", "Option B".
     */
    public boolean isLetterEnumeration(List<String> options) {
        List<Integer> letters = new ArrayList<>();
        for (String option : options) {
            Matcher m = LETTER.matcher(option);
            if (m.find()) {
                letters.add((int) m.group(1).charAt(0));
            }
        }
        return isEnumeration(letters, options.size());
    }

    private static boolean isEnumeration(List<Integer> parts, int optionCount) {
        if (parts.size() < 2 || parts.size() < optionCount * 0.6) {
            return false;
        }
        List<Integer> sorted = parts.stream().sorted().toList();
        boolean sequential = true;
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i) != sorted.get(i - 1) + 1) {
                sequential = false;
                break;
            }
        }
        boolean unique = new HashSet<>(parts).size() == parts.size();
        return sequential || unique;
    }

    private static boolean isNegated(String lowerOption) {
        return lowerOption.contains("not ") || lowerOption.startsWith("no ");
    }

    private static boolean containsAnyWord(String lowerOption, List<String> words) {
        Set<String> tokens = new HashSet<>(Arrays.asList(WHITESPACE.split(lowerOption.strip())));
        return words.stream().anyMatch(tokens::contains);
    }
}
