package com.fieldgrouping.domain.grouping.model;

import java.util.List;
import java.util.OptionalInt;

/**
 * Derived analogue of a server category combo.
 * <p>
 * {@code completenessRatio} is {@code actualCombinations / totalExpectedCombinations} and always lies in (0, 1].
 * Conditional structures legitimately stay below 1.
 */
public record InferredCategoryCombo(
        String name,
        List<InferredCategory> categories,
        int totalExpectedCombinations,
        int actualCombinations,
        double completenessRatio,
        boolean isConditional,
        List<String> conditionalRules,
        List<String> appliedToDataElements
) {

    public InferredCategoryCombo {
        if (totalExpectedCombinations < 1 || actualCombinations < 1
                || actualCombinations > totalExpectedCombinations) {
            throw new IllegalArgumentException("combinations out of range: actual=" + actualCombinations
                    + ", total=" + totalExpectedCombinations);
        }
        categories = List.copyOf(categories);
        conditionalRules = List.copyOf(conditionalRules);
        appliedToDataElements = List.copyOf(appliedToDataElements);
    }

    public static InferredCategoryCombo of(String name,
                                           List<InferredCategory> categories,
                                           int totalExpectedCombinations,
                                           int actualCombinations,
                                           List<String> appliedToDataElements) {
        return new InferredCategoryCombo(name, categories, totalExpectedCombinations, actualCombinations,
                (double) actualCombinations / totalExpectedCombinations,
                false, List.of(), appliedToDataElements);
    }

    /**
     * Product of the category sizes, empty when it does not fit an int.
     */
    public static OptionalInt combinationCount(List<Integer> categorySizes) {
        long total = 1;
        for (int size : categorySizes) {
            total *= size;
            if (total > Integer.MAX_VALUE) {
                return OptionalInt.empty();
            }
        }
        return OptionalInt.of((int) total);
    }

    public InferredCategoryCombo withConditionalRules(List<String> rules) {
        if (rules.isEmpty()) {
            return this;
        }
        return new InferredCategoryCombo(name, categories, totalExpectedCombinations, actualCombinations,
                completenessRatio, true, rules, appliedToDataElements);
    }
}
