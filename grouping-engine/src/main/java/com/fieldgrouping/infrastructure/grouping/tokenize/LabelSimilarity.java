package com.fieldgrouping.infrastructure.grouping.tokenize;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Label comparison helpers shared by the exclusivity and semantic stages.
 */
public final class LabelSimilarity {

    private static final String FALLBACK_CONCEPT = "Related Fields";

    private LabelSimilarity() {
    }

    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    public static String longestCommonPrefix(List<String> strings) {
        if (strings.isEmpty()) {
            return "";
        }
        String prefix = strings.get(0);
        for (int k = 1; k < strings.size(); k++) {
            String s = strings.get(k);
            int i = 0;
            while (i < prefix.length() && i < s.length() && prefix.charAt(i) == s.charAt(i)) {
                i++;
            }
            prefix = prefix.substring(0, i);
        }
        return prefix;
    }

    /**
     * Shared leading concept of several labels, e.g. "School Type" for "School Type - Public" and
     * "School Type - Private". Falls back to "Related Fields" when fewer than 3 characters are shared.
     */
    public static String commonConcept(List<String> labels) {
        if (labels.isEmpty()) {
            return "";
        }
        if (labels.size() == 1) {
            return labels.get(0);
        }
        String concept = stripTrailingDelimiters(toWordBoundary(longestCommonPrefix(labels), labels).strip());
        return concept.length() >= 3 ? concept : FALLBACK_CONCEPT;
    }

    /**
     * Cuts a prefix back to its last word boundary when it ends inside a word of some label.
     */
    static String toWordBoundary(String prefix, List<String> labels) {
        if (prefix.isEmpty() || !Character.isLetterOrDigit(prefix.charAt(prefix.length() - 1))) {
            return prefix;
        }
        boolean insideWord = labels.stream().anyMatch(l ->
                l.length() > prefix.length() && Character.isLetterOrDigit(l.charAt(prefix.length())));
        if (!insideWord) {
            return prefix;
        }
        int end = prefix.length();
        while (end > 0 && Character.isLetterOrDigit(prefix.charAt(end - 1))) {
            end--;
        }
        return prefix.substring(0, end);
    }

    static String stripTrailingDelimiters(String text) {
        int end = text.length();
        while (end > 0 && "-:|/_ (".indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        return text.substring(0, end);
    }
}
