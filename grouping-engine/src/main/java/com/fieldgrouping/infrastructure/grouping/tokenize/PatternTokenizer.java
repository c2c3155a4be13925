package com.fieldgrouping.infrastructure.grouping.tokenize;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits labels into ordered tokens, either on a structural separator or into case-folded words.
 */
@Component
@RequiredArgsConstructor
public class PatternTokenizer {

    private static final Pattern PARENTHETICAL = Pattern.compile("^(.*?)\\s*\\(([^)]+)\\)\\s*$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "of", "and", "or", "in", "on", "at", "for", "to",
            "with", "by", "from", "per", "is", "are"
    );

    private final LabelNormalizer normalizer;

    /**
     * Structural tokens of a label for one separator, trimmed, empty tokens dropped.
     * A label without the separator yields a single token.
     */
    public List<String> tokenize(String label, Separator separator) {
        String normalized = normalizer.normalize(label);
        if (normalized.isEmpty()) {
            return List.of();
        }

        if (separator == Separator.PARENTHETICAL) {
            return tokenizeParenthetical(normalized);
        }

        List<String> tokens = new ArrayList<>();
        for (String part : normalized.split(Pattern.quote(separator.literal()), -1)) {
            String token = part.strip();
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private List<String> tokenizeParenthetical(String normalized) {
        Matcher m = PARENTHETICAL.matcher(normalized);
        if (!m.matches() || m.group(1).isBlank()) {
            return List.of(normalized);
        }
        List<String> tokens = new ArrayList<>();
        tokens.add(m.group(1).strip());
        for (String part : WHITESPACE.split(m.group(2).strip())) {
            if (!part.isEmpty()) {
                tokens.add(part);
            }
        }
        return tokens;
    }

    /**
     * Case-folded words of a label with stop words removed, in label order.
     */
    public List<String> words(String label) {
        String normalized = normalizer.normalize(label).toLowerCase(Locale.ROOT);
        List<String> words = new ArrayList<>();
        for (String part : NON_WORD.split(normalized)) {
            if (!part.isEmpty() && !STOP_WORDS.contains(part)) {
                words.add(part);
            }
        }
        return words;
    }

    public Set<String> wordSet(String label) {
        return new LinkedHashSet<>(words(label));
    }

    /**
     * Whitespace-separated words of a label, case preserved, nothing removed.
     */
    public List<String> rawWords(String label) {
        String normalized = normalizer.normalize(label);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return List.of(WHITESPACE.split(normalized));
    }
}
