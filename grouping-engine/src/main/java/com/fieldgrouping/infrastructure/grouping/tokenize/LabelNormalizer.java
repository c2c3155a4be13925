package com.fieldgrouping.infrastructure.grouping.tokenize;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Normalizes field labels before tokenizing:
 * - Unicode NFC normalization
 * - Invisible/control character removal
 * - Whitespace normalization (any run, including line breaks, becomes one space; trim)
 */
@Component
public class LabelNormalizer {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Control characters except common whitespace (\n, \r, \t)
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    private static final Pattern WHITESPACE_RUN = Pattern.compile("[\\s\\u00A0]+");

    /**
     * Normalize a label. {@code null} becomes the empty string.
     */
    public String normalize(String label) {
        if (label == null || label.isEmpty()) {
            return "";
        }

        String result = Normalizer.normalize(label, Normalizer.Form.NFC);
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");
        result = CONTROL_CHARS.matcher(result).replaceAll("");
        result = WHITESPACE_RUN.matcher(result).replaceAll(" ");

        return result.strip();
    }
}
