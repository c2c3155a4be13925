package com.fieldgrouping.domain.grouping.model;

import java.util.regex.Pattern;

/**
 * A client-side check expressed as plain data: a closed kind plus its parameters.
 *
 * @param kind    which check to apply
 * @param pattern regex for {@link Kind#PATTERN} (nullable otherwise)
 * @param bound   numeric bound for {@link Kind#MIN_VALUE} / {@link Kind#MAX_VALUE} (nullable otherwise)
 * @param message message shown when the check fails
 */
public record FieldValidation(Kind kind, String pattern, Double bound, String message) {

    public enum Kind {
        REQUIRED,
        MIN_VALUE,
        MAX_VALUE,
        PATTERN
    }

    public FieldValidation {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (kind == Kind.PATTERN && (pattern == null || pattern.isEmpty())) {
            throw new IllegalArgumentException("PATTERN validation requires a pattern");
        }
        if ((kind == Kind.MIN_VALUE || kind == Kind.MAX_VALUE) && bound == null) {
            throw new IllegalArgumentException(kind + " validation requires a bound");
        }
    }

    public static FieldValidation required(String message) {
        return new FieldValidation(Kind.REQUIRED, null, null, message);
    }

    public static FieldValidation minValue(double bound, String message) {
        return new FieldValidation(Kind.MIN_VALUE, null, bound, message);
    }

    public static FieldValidation maxValue(double bound, String message) {
        return new FieldValidation(Kind.MAX_VALUE, null, bound, message);
    }

    public static FieldValidation pattern(String regex, String message) {
        return new FieldValidation(Kind.PATTERN, regex, null, message);
    }

    /**
     * Blank values only fail {@link Kind#REQUIRED}; the other kinds skip them.
     * Non-numeric input fails the numeric bounds.
     */
    public boolean test(String value) {
        boolean blank = value == null || value.isBlank();
        return switch (kind) {
            case REQUIRED -> !blank;
            case PATTERN -> blank || Pattern.compile(pattern).matcher(value.trim()).matches();
            case MIN_VALUE -> blank || parse(value) != null && parse(value) >= bound;
            case MAX_VALUE -> blank || parse(value) != null && parse(value) <= bound;
        };
    }

    private static Double parse(String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
