package com.fieldgrouping.infrastructure.grouping.exclusivity;

import com.fieldgrouping.domain.grouping.model.OptionSet;
import com.fieldgrouping.infrastructure.grouping.ScopedField;
import com.fieldgrouping.infrastructure.grouping.tokenize.LabelSimilarity;
import com.fieldgrouping.infrastructure.grouping.tokenize.LabelNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Forms exclusivity candidates, one pass at a time:
 * <ol>
 *   <li>fields sharing one YES/NO option set</li>
 *   <li>subject before the last delimiter, or before a parenthetical suffix</li>
 *   <li>longest multi-word prefix shared with another label</li>
 *   <li>shared first word, accepted only with a supporting option shape</li>
 * </ol>
 * Each pass returns clusters of at least 2 fields keyed by subject, in first-seen order.
 */
@Component
@RequiredArgsConstructor
public class ExclusivityCandidateFinder {

    public static final String OPTION_SET_PASS = "option set";
    public static final String DELIMITER_PASS = "delimiter";
    public static final String WORD_SEQUENCE_PASS = "word sequence";
    public static final String SINGLE_WORD_PASS = "single word";

    static final List<String> DELIMITERS = List.of(" - ", ": ", " – ", " — ", " | ", " / ");

    private static final Pattern PARENTHETICAL = Pattern.compile("^(.+?)\\s*\\(([^)]+)\\)\\s*$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MIN_SUBJECT_LENGTH = 3;

    private static final Set<String> GENERIC_WORDS = Set.of(
            "school", "student", "teacher", "class", "grade", "total", "number", "count",
            "data", "information", "report", "record", "entry", "item", "field"
    );

    private final LabelNormalizer normalizer;
    private final SuffixPatternAnalyzer suffixAnalyzer;

    public List<ExclusivityCandidate> byOptionSet(List<ScopedField> fields) {
        Map<String, List<ScopedField>> byOptionSetId = new LinkedHashMap<>();
        for (ScopedField field : fields) {
            OptionSet optionSet = field.field().optionSet();
            if (optionSet != null && optionSet.id() != null && optionSet.isYesNo()) {
                byOptionSetId.computeIfAbsent(optionSet.id(), k -> new ArrayList<>()).add(field);
            }
        }

        List<ExclusivityCandidate> candidates = new ArrayList<>();
        for (List<ScopedField> members : byOptionSetId.values()) {
            if (members.size() < 2) {
                continue;
            }
            List<String> labels = members.stream().map(f -> normalizer.normalize(f.name())).toList();
            String subject = LabelSimilarity.commonConcept(labels);
            List<String> options = labels.stream()
                    .map(label -> {
                        String option = optionOf(subject, label);
                        return option.isEmpty() ? label : option;
                    })
                    .toList();
            candidates.add(new ExclusivityCandidate(subject, members, options, OPTION_SET_PASS));
        }
        return candidates;
    }

    public List<ExclusivityCandidate> byDelimiter(List<ScopedField> fields) {
        Map<String, List<ScopedField>> bySubject = new LinkedHashMap<>();
        for (ScopedField field : fields) {
            String label = normalizer.normalize(field.name());
            String subject = delimiterSubject(label);
            if (subject == null) {
                subject = parentheticalSubject(label);
            }
            if (subject != null) {
                bySubject.computeIfAbsent(subject, k -> new ArrayList<>()).add(field);
            }
        }
        return toCandidates(bySubject, DELIMITER_PASS);
    }

    public List<ExclusivityCandidate> byWordSequence(List<ScopedField> fields) {
        Map<String, Integer> prefixCounts = new HashMap<>();
        for (ScopedField field : fields) {
            List<String> words = words(field);
            for (int length = 2; length < words.size(); length++) {
                prefixCounts.merge(String.join(" ", words.subList(0, length)), 1, Integer::sum);
            }
        }

        Map<String, List<ScopedField>> bySubject = new LinkedHashMap<>();
        for (ScopedField field : fields) {
            List<String> words = words(field);
            for (int length = words.size() - 1; length >= 2; length--) {
                String prefix = String.join(" ", words.subList(0, length));
                if (prefixCounts.getOrDefault(prefix, 0) >= 2) {
                    bySubject.computeIfAbsent(prefix, k -> new ArrayList<>()).add(field);
                    break;
                }
            }
        }
        return toCandidates(bySubject, WORD_SEQUENCE_PASS);
    }

    public List<ExclusivityCandidate> bySingleWord(List<ScopedField> fields) {
        Map<String, List<ScopedField>> bySubject = new LinkedHashMap<>();
        for (ScopedField field : fields) {
            List<String> words = words(field);
            if (words.size() >= 2 && words.get(0).length() >= MIN_SUBJECT_LENGTH) {
                bySubject.computeIfAbsent(words.get(0), k -> new ArrayList<>()).add(field);
            }
        }
        return toCandidates(bySubject, SINGLE_WORD_PASS).stream()
                .filter(this::isCoherentSingleWordGroup)
                .toList();
    }

    boolean isCoherentSingleWordGroup(ExclusivityCandidate candidate) {
        List<String> options = candidate.options();
        List<String> lower = options.stream().map(o -> o.toLowerCase(Locale.ROOT)).toList();

        long taxonomyMatches = lower.stream()
                .filter(o -> SuffixPatternAnalyzer.TAXONOMIES.stream().anyMatch(t -> t.stream().anyMatch(o::contains)))
                .count();
        if (taxonomyMatches >= options.size() * 0.5) {
            return true;
        }

        double averageLength = options.stream().mapToInt(String::length).average().orElse(0);
        boolean distinct = options.stream().distinct().count() == options.size();
        int maxWords = options.stream().mapToInt(o -> WHITESPACE.split(o).length).max().orElse(0);
        if (averageLength <= 25 && distinct && maxWords <= 3) {
            return true;
        }

        if (GENERIC_WORDS.contains(candidate.subject().toLowerCase(Locale.ROOT))) {
            return false;
        }
        return suffixAnalyzer.isNumericEnumeration(options) || suffixAnalyzer.isLetterEnumeration(options);
    }

    private List<ExclusivityCandidate> toCandidates(Map<String, List<ScopedField>> bySubject, String pass) {
        List<ExclusivityCandidate> candidates = new ArrayList<>();
        for (Map.Entry<String, List<ScopedField>> entry : bySubject.entrySet()) {
            if (entry.getValue().size() < 2) {
                continue;
            }
            List<String> options = entry.getValue().stream()
                    .map(f -> optionOf(entry.getKey(), normalizer.normalize(f.name())))
                    .toList();
            candidates.add(new ExclusivityCandidate(entry.getKey(), entry.getValue(), options, pass));
        }
        return candidates;
    }

    private static String delimiterSubject(String label) {
        for (String delimiter : DELIMITERS) {
            int index = label.lastIndexOf(delimiter);
            if (index > 0) {
                String subject = label.substring(0, index).strip();
                if (subject.length() >= MIN_SUBJECT_LENGTH) {
                    return subject;
                }
            }
        }
        return null;
    }

    private static String parentheticalSubject(String label) {
        Matcher m = PARENTHETICAL.matcher(label);
        if (m.matches()) {
            String subject = m.group(1).strip();
            if (subject.length() >= MIN_SUBJECT_LENGTH) {
                return subject;
            }
        }
        return null;
    }

    public static String optionOf(String subject, String label) {
        String option = label.startsWith(subject) ? label.substring(subject.length()) : label;
        option = option.strip();
        int start = 0;
        while (start < option.length() && "-:|/–—(".indexOf(option.charAt(start)) >= 0) {
            start++;
        }
        option = option.substring(start).strip();
        if (option.endsWith(")")) {
            option = option.substring(0, option.length() - 1).strip();
        }
        return option;
    }

    private List<String> words(ScopedField field) {
        String label = normalizer.normalize(field.name());
        return label.isEmpty() ? List.of() : List.of(WHITESPACE.split(label));
    }
}
