package com.fieldgrouping.domain.grouping.model;

import java.util.List;

/**
 * Value type of a data-capture field, as declared by the server.
 */
public enum DataEntryType {
    TEXT,
    NUMBER,
    DATE,
    YES_NO,
    YES_ONLY,
    MULTIPLE_CHOICE,
    COORDINATES,
    PERCENTAGE,
    INTEGER,
    POSITIVE_INTEGER,
    NEGATIVE_INTEGER,
    POSITIVE_NUMBER,
    NEGATIVE_NUMBER,
    PHONE_NUMBER;

    public boolean isBooleanLike() {
        return this == YES_NO || this == YES_ONLY;
    }

    /**
     * Default client-side checks for a value of this type.
     */
    public List<FieldValidation> defaultValidations() {
        return switch (this) {
            case NUMBER -> List.of(
                    FieldValidation.pattern("^-?\\d*\\.?\\d*$", "Please enter a valid number"));
            case INTEGER -> List.of(
                    FieldValidation.pattern("^-?\\d+$", "Please enter a valid integer"));
            case POSITIVE_INTEGER -> List.of(
                    FieldValidation.pattern("^\\d+$", "Please enter a positive integer"));
            case NEGATIVE_INTEGER -> List.of(
                    FieldValidation.pattern("^-\\d+$", "Please enter a negative integer"));
            case POSITIVE_NUMBER -> List.of(
                    FieldValidation.pattern("^\\d*\\.?\\d*$", "Please enter a positive number"));
            case NEGATIVE_NUMBER -> List.of(
                    FieldValidation.pattern("^-\\d*\\.?\\d*$", "Please enter a negative number"));
            case PERCENTAGE -> List.of(
                    FieldValidation.pattern("^\\d*\\.?\\d*$", "Please enter a valid percentage"),
                    FieldValidation.maxValue(100.0, "Percentage cannot exceed 100%"));
            case DATE -> List.of(
                    FieldValidation.pattern("^\\d{4}-\\d{2}-\\d{2}$", "Use date format YYYY-MM-DD"));
            case PHONE_NUMBER -> List.of(
                    FieldValidation.pattern("^\\+?[0-9]{6,15}$", "Please enter a valid phone number"));
            case TEXT, YES_NO, YES_ONLY, MULTIPLE_CHOICE, COORDINATES -> List.of();
        };
    }
}
