package com.fieldgrouping.infrastructure.grouping.cache;

import com.fieldgrouping.domain.grouping.model.Field;
import com.fieldgrouping.domain.grouping.model.Option;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Builds deterministic SHA-256 cache keys from a scope's field list.
 * Field order is part of the key since it shapes the grouping output.
 * Every component is length-prefixed.
 */
@Component
public class GroupingCacheKeyBuilder {

    /**
     * @param scopeId scope the fields belong to
     * @param fields  fields in input order
     * @return hex-encoded SHA-256 hash
     */
    public String buildKey(String scopeId, List<Field> fields) {
        StringBuilder raw = new StringBuilder();
        append(raw, scopeId);
        raw.append(fields.size()).append(';');
        for (Field field : fields) {
            describe(raw, field);
        }
        return sha256(raw.toString());
    }

    private static void describe(StringBuilder raw, Field field) {
        append(raw, field.id());
        append(raw, field.name());
        append(raw, field.sectionName());
        append(raw, field.categoryOptionCombo());
        append(raw, field.dataEntryType().name());
        append(raw, field.explicitCategoryComboId());
        if (field.optionSet() == null) {
            raw.append("-;");
            return;
        }
        append(raw, field.optionSet().id());
        raw.append(field.optionSet().options().size()).append(';');
        for (Option option : field.optionSet().options()) {
            append(raw, option.code());
        }
    }

    /**
     * Writes {@code length:value;}, or {@code -;} for null.
     */
    private static void append(StringBuilder raw, String value) {
        if (value == null) {
            raw.append("-;");
        } else {
            raw.append(value.length()).append(':').append(value).append(';');
        }
    }

    private String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
