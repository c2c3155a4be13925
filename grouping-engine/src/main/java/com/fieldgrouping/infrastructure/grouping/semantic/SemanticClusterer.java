package com.fieldgrouping.infrastructure.grouping.semantic;

import com.fieldgrouping.domain.grouping.model.GroupType;
import com.fieldgrouping.domain.grouping.model.SemanticEvidence;
import com.fieldgrouping.infrastructure.grouping.Resolution;
import com.fieldgrouping.infrastructure.grouping.ScopedField;
import com.fieldgrouping.infrastructure.grouping.tokenize.LabelSimilarity;
import com.fieldgrouping.infrastructure.grouping.tokenize.PatternTokenizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Greedy word-overlap clustering for fields no structural stage claimed.
 * <p>
 * The first unassigned field seeds a cluster; later fields join while their Jaccard similarity to the
 * cluster centroid (words present in at least half of the members) exceeds the threshold and the cluster
 * is below its size cap. Only clusters of 2 or more fields are returned.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SemanticClusterer {

    public static final String DETECTION_METHOD = "Semantic Similarity";

    private final PatternTokenizer tokenizer;

    @Value("${grouping.semantic.similarity-threshold:0.5}")
    private double similarityThreshold;

    @Value("${grouping.semantic.max-cluster-size:8}")
    private int maxClusterSize;

    public List<Resolution> cluster(List<ScopedField> fields) {
        Map<ScopedField, Set<String>> words = new LinkedHashMap<>();
        for (ScopedField field : fields) {
            words.put(field, tokenizer.wordSet(field.name()));
        }

        List<ScopedField> unassigned = new ArrayList<>(fields);
        List<Resolution> resolutions = new ArrayList<>();

        while (!unassigned.isEmpty()) {
            ScopedField seed = unassigned.remove(0);
            List<ScopedField> members = new ArrayList<>();
            members.add(seed);
            Set<String> centroid = new LinkedHashSet<>(words.get(seed));

            for (ScopedField candidate : List.copyOf(unassigned)) {
                if (members.size() >= maxClusterSize) {
                    break;
                }
                if (LabelSimilarity.jaccard(words.get(candidate), centroid) > similarityThreshold) {
                    members.add(candidate);
                    unassigned.remove(candidate);
                    centroid = centroid(members, words);
                }
            }

            if (members.size() >= 2) {
                double similarity = meanPairwiseSimilarity(members, words);
                String title = LabelSimilarity.commonConcept(members.stream().map(ScopedField::name).toList());
                log.debug("[SemanticClusterer] '{}' members={} similarity={}",
                        title, members.size(), String.format("%.2f", similarity));
                resolutions.add(new Resolution(members, GroupType.SEMANTIC_CLUSTER, title,
                        new SemanticEvidence(similarity, DETECTION_METHOD, List.of())));
            }
        }
        return resolutions;
    }

    private static Set<String> centroid(List<ScopedField> members, Map<ScopedField, Set<String>> words) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ScopedField member : members) {
            for (String word : words.get(member)) {
                counts.merge(word, 1, Integer::sum);
            }
        }
        Set<String> centroid = new LinkedHashSet<>();
        counts.forEach((word, count) -> {
            if (count * 2 >= members.size()) {
                centroid.add(word);
            }
        });
        return centroid;
    }

    static double meanPairwiseSimilarity(List<ScopedField> members, Map<ScopedField, Set<String>> words) {
        double sum = 0.0;
        int pairs = 0;
        for (int i = 0; i < members.size(); i++) {
            for (int j = i + 1; j < members.size(); j++) {
                sum += LabelSimilarity.jaccard(words.get(members.get(i)), words.get(members.get(j)));
                pairs++;
            }
        }
        return pairs == 0 ? 0.0 : sum / pairs;
    }
}
