package com.fieldgrouping.infrastructure.grouping.tokenize;

import com.fieldgrouping.domain.grouping.model.SeparatorDetection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

/**
 * Picks the dominant separator of a label set.
 * <p>
 * For each candidate the consistency ratio is the share of all labels that split into the modal token
 * count (of at least 2 tokens). The highest ratio at or above the acceptance threshold wins; ties go to
 * the earlier separator in {@link Separator} order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SeparatorDetector {

    private final PatternTokenizer tokenizer;

    @Value("${grouping.separator.acceptance-threshold:0.6}")
    private double acceptanceThreshold;

    public SeparatorDetection detect(Collection<String> labels) {
        if (labels == null || labels.isEmpty()) {
            return SeparatorDetection.flat();
        }

        Separator best = null;
        double bestRatio = 0.0;
        for (Separator separator : Separator.values()) {
            double ratio = consistency(labels, separator);
            if (ratio > bestRatio) {
                best = separator;
                bestRatio = ratio;
            }
        }

        if (best == null || bestRatio < acceptanceThreshold) {
            log.debug("[SeparatorDetector] No separator clears {} over {} labels (best={})",
                    acceptanceThreshold, labels.size(), String.format("%.2f", bestRatio));
            return SeparatorDetection.flat();
        }

        return new SeparatorDetection(best.literal(), best.pattern(), bestRatio);
    }

    /**
     * Share of labels splitting into the modal token count for this separator; 0 if none split.
     */
    public double consistency(Collection<String> labels, Separator separator) {
        if (labels == null || labels.isEmpty()) {
            return 0.0;
        }

        // token count -> frequency, ascending count so smaller counts win frequency ties
        Map<Integer, Integer> counts = new TreeMap<>();
        for (String label : labels) {
            int size = tokenizer.tokenize(label, separator).size();
            if (size >= 2) {
                counts.merge(size, 1, Integer::sum);
            }
        }

        int modalFrequency = 0;
        for (int frequency : counts.values()) {
            modalFrequency = Math.max(modalFrequency, frequency);
        }
        return (double) modalFrequency / labels.size();
    }

    public boolean accepts(double ratio) {
        return ratio >= acceptanceThreshold;
    }

    public Separator separatorFor(SeparatorDetection detection) {
        if (detection.isFlat()) {
            return null;
        }
        for (Separator separator : Separator.values()) {
            if (separator.literal().equals(detection.separator())) {
                return separator;
            }
        }
        return null;
    }
}
