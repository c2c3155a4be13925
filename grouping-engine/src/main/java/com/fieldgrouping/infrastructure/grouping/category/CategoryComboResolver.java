package com.fieldgrouping.infrastructure.grouping.category;

import com.fieldgrouping.domain.grouping.model.CategoryComboEvidence;
import com.fieldgrouping.domain.grouping.model.CategoryOptionComboRef;
import com.fieldgrouping.domain.grouping.model.CategoryOptionRef;
import com.fieldgrouping.domain.grouping.model.CategoryStructure;
import com.fieldgrouping.domain.grouping.model.GroupType;
import com.fieldgrouping.domain.grouping.model.InferredCategory;
import com.fieldgrouping.domain.grouping.model.InferredCategoryCombo;
import com.fieldgrouping.domain.grouping.service.CategoryMetadataSource;
import com.fieldgrouping.infrastructure.grouping.Resolution;
import com.fieldgrouping.infrastructure.grouping.ScopedField;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds definitive groups from server category combos.
 * <p>
 * Fields sharing a data element id and a category combo id form one cluster; its metadata is fetched
 * once. A fetch failure never propagates: the cluster's fields get a note and stay for later stages.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CategoryComboResolver {

    public static final String DETECTION_METHOD = "Server Category Combo";

    private static final int MAX_RADIO_OPTIONS = 4;

    private final CategoryMetadataFetcher fetcher;

    private record ClusterKey(String fieldId, String categoryComboId) {
    }

    public CategoryComboOutcome resolve(List<ScopedField> fields, CategoryMetadataSource source) {
        Map<ClusterKey, List<ScopedField>> clusters = new LinkedHashMap<>();
        for (ScopedField scoped : fields) {
            if (scoped.field().hasExplicitCategoryCombo()) {
                clusters.computeIfAbsent(
                        new ClusterKey(scoped.field().id(), scoped.field().explicitCategoryComboId()),
                        k -> new ArrayList<>()).add(scoped);
            }
        }

        List<Resolution> resolutions = new ArrayList<>();
        Map<Integer, List<String>> failureNotes = new HashMap<>();

        for (Map.Entry<ClusterKey, List<ScopedField>> entry : clusters.entrySet()) {
            String comboId = entry.getKey().categoryComboId();
            List<ScopedField> members = entry.getValue();

            List<CategoryStructure> structure;
            try {
                structure = fetcher.fetchStructure(source, comboId);
            } catch (MetadataUnavailableException e) {
                log.warn("[CategoryComboResolver] Category combo {} unavailable for field {}: {}",
                        comboId, entry.getKey().fieldId(), e.getMessage());
                String note = "Category combo metadata unavailable: " + e.getMessage();
                for (ScopedField member : members) {
                    failureNotes.computeIfAbsent(member.position(), k -> new ArrayList<>()).add(note);
                }
                continue;
            }

            Optional<String> malformed = malformation(structure);
            if (malformed.isPresent()) {
                log.warn("[CategoryComboResolver] Category combo {} for field {} is malformed: {}",
                        comboId, entry.getKey().fieldId(), malformed.get());
                String note = "Category combo metadata unavailable: " + malformed.get();
                for (ScopedField member : members) {
                    failureNotes.computeIfAbsent(member.position(), k -> new ArrayList<>()).add(note);
                }
                continue;
            }

            if (!isUsable(structure)) {
                log.debug("[CategoryComboResolver] Category combo {} has no usable categories", comboId);
                continue;
            }

            resolutions.add(buildResolution(comboId, members, structure, source));
        }

        return new CategoryComboOutcome(resolutions, failureNotes);
    }

    /**
     * Reason the collaborator's answer cannot be used as-is, if any.
     */
    static Optional<String> malformation(List<CategoryStructure> structure) {
        if (structure == null) {
            return Optional.empty();
        }
        for (CategoryStructure category : structure) {
            if (category == null) {
                return Optional.of("null category");
            }
            if (category.options().stream().anyMatch(o -> o.displayName() == null)) {
                return Optional.of("option without display name in category '" + category.categoryName() + "'");
            }
        }
        if (InferredCategoryCombo.combinationCount(
                structure.stream().map(c -> c.options().size()).toList()).isEmpty()) {
            return Optional.of("too many option combinations across " + structure.size() + " categories");
        }
        return Optional.empty();
    }

    private static boolean isUsable(List<CategoryStructure> structure) {
        return structure != null && !structure.isEmpty()
                && structure.stream().allMatch(c -> !c.options().isEmpty());
    }

    private Resolution buildResolution(String comboId, List<ScopedField> members,
                                       List<CategoryStructure> structure, CategoryMetadataSource source) {
        List<InferredCategory> categories = new ArrayList<>();
        for (CategoryStructure category : structure) {
            List<String> options = category.options().stream().map(CategoryOptionRef::displayName).toList();
            categories.add(new InferredCategory(category.categoryName(), options, options.size(), DETECTION_METHOD));
        }
        int total = InferredCategoryCombo.combinationCount(
                structure.stream().map(c -> c.options().size()).toList()).orElseThrow();

        List<String> notes = new ArrayList<>();
        int actual = total;
        try {
            List<CategoryOptionComboRef> combos = fetcher.fetchOptionCombos(source, comboId);
            if (!combos.isEmpty()) {
                actual = Math.max(1, Math.min(combos.size(), total));
            }
        } catch (MetadataUnavailableException e) {
            log.warn("[CategoryComboResolver] Option combos of {} unavailable: {}", comboId, e.getMessage());
            notes.add("Category option combos unavailable: " + e.getMessage());
        }

        List<String> fieldIds = members.stream().map(m -> m.field().id()).distinct().toList();
        String comboName = String.join(" × ", structure.stream().map(CategoryStructure::categoryName).toList());
        InferredCategoryCombo combo = InferredCategoryCombo.of(comboName, categories, total, actual, fieldIds);

        GroupType groupType = groupTypeFor(structure);
        log.debug("[CategoryComboResolver] combo={} categories={} type={} members={}",
                comboId, structure.size(), groupType, members.size());

        return new Resolution(members, groupType, members.get(0).name(),
                new CategoryComboEvidence(comboId, structure, combo, DETECTION_METHOD, notes));
    }

    static GroupType groupTypeFor(List<CategoryStructure> structure) {
        if (structure.size() >= 2) {
            return GroupType.DIMENSIONAL_GRID;
        }
        List<CategoryOptionRef> options = structure.get(0).options();
        boolean hasIcons = options.stream().anyMatch(o -> o.icon() != null);
        return options.size() <= MAX_RADIO_OPTIONS && !hasIcons ? GroupType.RADIO_GROUP : GroupType.CHECKBOX_GROUP;
    }
}
