package com.fieldgrouping.infrastructure.grouping.pipeline;

import com.fieldgrouping.domain.grouping.model.Field;
import com.fieldgrouping.domain.grouping.model.GroupMetadata;
import com.fieldgrouping.domain.grouping.model.GroupingStrategy;
import com.fieldgrouping.domain.grouping.service.CancellationToken;
import com.fieldgrouping.domain.grouping.service.CategoryMetadataSource;
import com.fieldgrouping.infrastructure.grouping.Resolution;
import com.fieldgrouping.infrastructure.grouping.ScopedField;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one scope's grouping run.
 * Each stage sees only {@code remaining}; claimed fields leave it for good.
 */
@Data
public class GroupingContext {

    // --- Input ---
    private String scopeId;
    private List<Field> fields;
    private CategoryMetadataSource metadataSource;
    private CancellationToken cancellation;

    // --- Working set ---
    private GroupingStage stage;
    private List<ScopedField> remaining = new ArrayList<>();
    private Map<Integer, List<String>> failureNotes = new HashMap<>();

    // --- Output ---
    private List<GroupingStrategy> strategies = new ArrayList<>();
    private List<Integer> claimedPositions = new ArrayList<>();

    public static GroupingContext of(String scopeId, List<Field> fields,
                                     CategoryMetadataSource metadataSource, CancellationToken cancellation) {
        GroupingContext ctx = new GroupingContext();
        ctx.setScopeId(scopeId);
        ctx.setFields(List.copyOf(fields));
        ctx.setMetadataSource(metadataSource != null ? metadataSource : CategoryMetadataSource.none());
        ctx.setCancellation(cancellation != null ? cancellation : CancellationToken.none());
        for (int i = 0; i < fields.size(); i++) {
            ctx.getRemaining().add(new ScopedField(i, fields.get(i)));
        }
        return ctx;
    }

    public void addFailureNotes(Map<Integer, List<String>> notes) {
        notes.forEach((position, list) ->
                failureNotes.computeIfAbsent(position, k -> new ArrayList<>()).addAll(list));
    }

    /**
     * Turn a resolution into a strategy, carrying earlier failure notes of its members.
     */
    public void claim(Resolution resolution) {
        GroupMetadata metadata = resolution.metadata();
        List<String> notes = notesFor(resolution.members(), metadata.notes());
        if (!notes.equals(metadata.notes())) {
            metadata = metadata.withNotes(notes);
        }

        List<Field> members = resolution.members().stream().map(ScopedField::field).toList();
        strategies.add(new GroupingStrategy(metadata.kind().confidence(), resolution.groupType(),
                resolution.title(), members, metadata));

        resolution.members().forEach(m -> claimedPositions.add(m.position()));
        remaining.removeAll(resolution.members());
    }

    public void claimFlat(ScopedField field) {
        strategies.add(GroupingStrategy.flat(field.field(), notesFor(List.of(field), List.of())));
        claimedPositions.add(field.position());
        remaining.remove(field);
    }

    private List<String> notesFor(List<ScopedField> members, List<String> own) {
        Set<String> notes = new LinkedHashSet<>(own);
        for (ScopedField member : members) {
            notes.addAll(failureNotes.getOrDefault(member.position(), List.of()));
        }
        return List.copyOf(notes);
    }
}
