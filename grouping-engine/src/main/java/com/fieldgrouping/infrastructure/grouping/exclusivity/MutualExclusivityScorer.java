package com.fieldgrouping.infrastructure.grouping.exclusivity;

import com.fieldgrouping.domain.grouping.model.DataEntryType;
import com.fieldgrouping.domain.grouping.model.ExclusivityEvidence;
import com.fieldgrouping.domain.grouping.model.Field;
import com.fieldgrouping.domain.grouping.model.GroupType;
import com.fieldgrouping.infrastructure.grouping.Resolution;
import com.fieldgrouping.infrastructure.grouping.ScopedField;
import com.fieldgrouping.infrastructure.grouping.tokenize.LabelSimilarity;
import com.fieldgrouping.infrastructure.grouping.tokenize.PatternTokenizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Estimates whether an un-patterned cluster is a one-of-N choice.
 * <p>
 * Composite score in [0, 1]:
 * 0.25 naming-prefix overlap + 0.35 value-type homogeneity + 0.20 small cardinality + 0.20 option wording.
 * At or above the radio threshold the cluster is a radio group, at or above the checkbox threshold a
 * checkbox group, below that it is left for the semantic stage.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MutualExclusivityScorer {

    public static final String DETECTION_METHOD = "Mutual Exclusivity";

    private static final double PREFIX_WEIGHT = 0.25;
    private static final double TYPE_WEIGHT = 0.35;
    private static final double CARDINALITY_WEIGHT = 0.20;
    private static final double SUFFIX_WEIGHT = 0.20;

    private static final int MAX_OPTION_WORDS = 5;
    private static final double MAX_AVERAGE_OPTION_LENGTH = 30.0;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ExclusivityCandidateFinder candidateFinder;
    private final SuffixPatternAnalyzer suffixAnalyzer;
    private final PatternTokenizer tokenizer;

    @Value("${grouping.exclusivity.radio-threshold:0.7}")
    private double radioThreshold;

    @Value("${grouping.exclusivity.checkbox-threshold:0.4}")
    private double checkboxThreshold;

    /**
     * Breakdown of one cluster's score.
     */
    public record ExclusivityScore(double prefix, double typeHomogeneity, double cardinality,
                                   double suffixPattern, double total) {
    }

    public List<Resolution> resolve(List<ScopedField> fields) {
        List<Resolution> resolutions = new ArrayList<>();
        List<ScopedField> remaining = new ArrayList<>(fields);

        List<Function<List<ScopedField>, List<ExclusivityCandidate>>> passes = List.of(
                candidateFinder::byOptionSet,
                candidateFinder::byDelimiter,
                candidateFinder::byWordSequence,
                candidateFinder::bySingleWord
        );

        for (Function<List<ScopedField>, List<ExclusivityCandidate>> pass : passes) {
            if (remaining.size() < 2) {
                break;
            }
            for (ExclusivityCandidate candidate : pass.apply(List.copyOf(remaining))) {
                if (!remaining.containsAll(candidate.members()) || optionsTooLong(candidate.options())) {
                    continue;
                }

                ExclusivityScore score = score(candidate);
                log.debug("[ExclusivityScorer] subject='{}' pass={} prefix={} type={} cardinality={} suffix={} total={}",
                        candidate.subject(), candidate.pass(), fmt(score.prefix()), fmt(score.typeHomogeneity()),
                        fmt(score.cardinality()), fmt(score.suffixPattern()), fmt(score.total()));

                if (score.total() < checkboxThreshold) {
                    continue;
                }

                GroupType groupType = score.total() >= radioThreshold ? GroupType.RADIO_GROUP : GroupType.CHECKBOX_GROUP;
                resolutions.add(new Resolution(candidate.members(), groupType, candidate.subject(),
                        new ExclusivityEvidence(score.total(), score.total(),
                                DETECTION_METHOD + " (" + candidate.pass() + ")", List.of())));
                remaining.removeAll(candidate.members());
            }
        }
        return resolutions;
    }

    public ExclusivityScore score(ExclusivityCandidate candidate) {
        double prefix = prefixSignal(candidate);
        double type = typeSignal(candidate.members());
        double cardinality = cardinalitySignal(candidate.members().size());
        double suffix = suffixAnalyzer.analyze(candidate.options());

        double total = PREFIX_WEIGHT * prefix + TYPE_WEIGHT * type
                + CARDINALITY_WEIGHT * cardinality + SUFFIX_WEIGHT * suffix;
        return new ExclusivityScore(prefix, type, cardinality, suffix, Math.max(0.0, Math.min(1.0, total)));
    }

    private double prefixSignal(ExclusivityCandidate candidate) {
        List<String> options = candidate.options();
        boolean distinct = new HashSet<>(options).size() == options.size();
        if (!distinct || options.stream().anyMatch(String::isBlank)) {
            return 0.0;
        }
        Set<String> subjectWords = tokenizer.wordSet(candidate.subject());
        return candidate.members().stream()
                .mapToDouble(m -> LabelSimilarity.jaccard(subjectWords, tokenizer.wordSet(m.name())))
                .average()
                .orElse(0.0);
    }

    static double typeSignal(List<ScopedField> members) {
        Map<DataEntryType, Integer> counts = new EnumMap<>(DataEntryType.class);
        for (ScopedField member : members) {
            counts.merge(effectiveType(member.field()), 1, Integer::sum);
        }
        DataEntryType modal = null;
        int modalCount = 0;
        for (Map.Entry<DataEntryType, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > modalCount) {
                modal = entry.getKey();
                modalCount = entry.getValue();
            }
        }
        double homogeneity = (double) modalCount / members.size();
        return homogeneity * affinity(modal);
    }

    /**
     * A field answered through a YES/NO option set counts as YES_NO whatever its declared type.
     */
    private static DataEntryType effectiveType(Field field) {
        return field.optionSet() != null && field.optionSet().isYesNo() ? DataEntryType.YES_NO : field.dataEntryType();
    }

    private static double affinity(DataEntryType type) {
        return switch (type) {
            case YES_NO, YES_ONLY -> 1.0;
            case MULTIPLE_CHOICE -> 0.75;
            case TEXT -> 0.25;
            case NUMBER, DATE, COORDINATES, PERCENTAGE, INTEGER, POSITIVE_INTEGER, NEGATIVE_INTEGER,
                 POSITIVE_NUMBER, NEGATIVE_NUMBER, PHONE_NUMBER -> 0.0;
        };
    }

    static double cardinalitySignal(int size) {
        if (size >= 2 && size <= 4) {
            return 1.0;
        }
        if (size >= 5 && size <= 8) {
            return 0.5;
        }
        return 0.0;
    }

    private static boolean optionsTooLong(List<String> options) {
        int longest = options.stream()
                .mapToInt(o -> o.isBlank() ? 0 : WHITESPACE.split(o.strip()).length)
                .max().orElse(0);
        double average = options.stream().mapToInt(String::length).average().orElse(0);
        return longest > MAX_OPTION_WORDS || average > MAX_AVERAGE_OPTION_LENGTH;
    }

    private static String fmt(double value) {
        return String.format("%.2f", value);
    }
}
