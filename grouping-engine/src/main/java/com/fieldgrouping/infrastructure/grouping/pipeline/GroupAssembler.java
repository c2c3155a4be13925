package com.fieldgrouping.infrastructure.grouping.pipeline;

import com.fieldgrouping.domain.grouping.model.Field;
import com.fieldgrouping.domain.grouping.model.GroupingStrategy;
import com.fieldgrouping.domain.grouping.service.CancellationToken;
import com.fieldgrouping.domain.grouping.service.CategoryMetadataSource;
import com.fieldgrouping.domain.grouping.service.FieldGroupingService;
import com.fieldgrouping.infrastructure.grouping.Resolution;
import com.fieldgrouping.infrastructure.grouping.ScopedField;
import com.fieldgrouping.infrastructure.grouping.category.CategoryComboOutcome;
import com.fieldgrouping.infrastructure.grouping.category.CategoryComboResolver;
import com.fieldgrouping.infrastructure.grouping.dimensional.DimensionalPatternExtractor;
import com.fieldgrouping.infrastructure.grouping.exclusivity.MutualExclusivityScorer;
import com.fieldgrouping.infrastructure.grouping.semantic.SemanticClusterer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs one scope through the stages in fixed order:
 * <p>
 * category combo → dimensional → exclusivity → semantic → flat remainder
 * </p>
 * A field claimed by an earlier stage is never re-adjudicated by a later one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GroupAssembler implements FieldGroupingService {

    private final CategoryComboResolver categoryComboResolver;
    private final DimensionalPatternExtractor dimensionalExtractor;
    private final MutualExclusivityScorer exclusivityScorer;
    private final SemanticClusterer semanticClusterer;

    @Override
    public List<GroupingStrategy> group(String scopeId,
                                        List<Field> fields,
                                        CategoryMetadataSource metadataSource,
                                        CancellationToken cancellation) {
        if (fields == null || fields.isEmpty()) {
            log.debug("[GroupAssembler] scope={} is empty", scopeId);
            return List.of();
        }

        GroupingContext ctx = GroupingContext.of(scopeId, fields, metadataSource, cancellation);

        for (GroupingStage stage : GroupingStage.values()) {
            if (ctx.getRemaining().isEmpty()) {
                break;
            }
            if (ctx.getCancellation().isCancelled()) {
                throw new GroupingCancelledException(scopeId, stage);
            }
            ctx.setStage(stage);

            int before = ctx.getRemaining().size();
            runStage(ctx, stage);
            log.info("[GroupAssembler] scope={} stage={} claimed={} remaining={}",
                    scopeId, stage, before - ctx.getRemaining().size(), ctx.getRemaining().size());
        }

        verifyPartition(ctx);
        return List.copyOf(ctx.getStrategies());
    }

    private void runStage(GroupingContext ctx, GroupingStage stage) {
        List<ScopedField> remaining = List.copyOf(ctx.getRemaining());
        switch (stage) {
            case TRY_CATEGORY_COMBO -> {
                CategoryComboOutcome outcome = categoryComboResolver.resolve(remaining, ctx.getMetadataSource());
                ctx.addFailureNotes(outcome.failureNotes());
                claimAll(ctx, outcome.resolutions());
            }
            case TRY_DIMENSIONAL -> claimAll(ctx, dimensionalExtractor.extract(remaining));
            case TRY_EXCLUSIVITY -> claimAll(ctx, exclusivityScorer.resolve(remaining));
            case TRY_SEMANTIC -> claimAll(ctx, semanticClusterer.cluster(remaining));
            case EMIT_FLAT_REMAINDER -> remaining.forEach(ctx::claimFlat);
        }
    }

    private static void claimAll(GroupingContext ctx, List<Resolution> resolutions) {
        for (Resolution resolution : resolutions) {
            if (!ctx.getRemaining().containsAll(resolution.members())) {
                throw new IllegalStateException("stage " + ctx.getStage() + " claimed a field twice in scope "
                        + ctx.getScopeId());
            }
            ctx.claim(resolution);
        }
    }

    private static void verifyPartition(GroupingContext ctx) {
        List<Integer> claimed = ctx.getClaimedPositions();
        Set<Integer> distinct = new HashSet<>(claimed);
        if (claimed.size() != ctx.getFields().size() || distinct.size() != claimed.size()
                || !ctx.getRemaining().isEmpty()) {
            throw new IllegalStateException("partition violated in scope " + ctx.getScopeId()
                    + ": fields=" + ctx.getFields().size() + ", claimed=" + claimed.size()
                    + ", distinct=" + distinct.size());
        }
    }
}
