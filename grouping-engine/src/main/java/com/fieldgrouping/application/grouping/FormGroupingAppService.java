package com.fieldgrouping.application.grouping;

import com.fieldgrouping.domain.grouping.model.Field;
import com.fieldgrouping.domain.grouping.model.FormGroupingResult;
import com.fieldgrouping.domain.grouping.model.GroupingStrategy;
import com.fieldgrouping.domain.grouping.model.ImpliedCategoryCombination;
import com.fieldgrouping.domain.grouping.model.ScopeGroupingResult;
import com.fieldgrouping.domain.grouping.service.CancellationToken;
import com.fieldgrouping.domain.grouping.service.CategoryMetadataSource;
import com.fieldgrouping.domain.grouping.service.FieldGroupingService;
import com.fieldgrouping.infrastructure.grouping.cache.GroupingCacheKeyBuilder;
import com.fieldgrouping.infrastructure.grouping.cache.GroupingResultCache;
import com.fieldgrouping.infrastructure.grouping.dimensional.ImpliedCategoryInferenceService;
import com.fieldgrouping.infrastructure.grouping.pipeline.GroupingCancelledException;
import com.fieldgrouping.infrastructure.grouping.pipeline.GroupingReportWriter;
import com.fieldgrouping.infrastructure.grouping.pipeline.GroupingStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Groups a whole form: one scope per section, scopes processed in parallel, results keyed by scope id
 * in first-seen order. A cancelled scope is dropped whole.
 */
@Slf4j
@Service
public class FormGroupingAppService {

    private final FieldGroupingService groupingService;
    private final ImpliedCategoryInferenceService impliedCategoryService;
    private final GroupingCacheKeyBuilder cacheKeyBuilder;
    private final GroupingReportWriter reportWriter;
    private final Executor scopeExecutor;

    public FormGroupingAppService(FieldGroupingService groupingService,
                                  ImpliedCategoryInferenceService impliedCategoryService,
                                  GroupingCacheKeyBuilder cacheKeyBuilder,
                                  GroupingReportWriter reportWriter,
                                  @Qualifier("scopeGroupingExecutor") Executor scopeExecutor) {
        this.groupingService = groupingService;
        this.impliedCategoryService = impliedCategoryService;
        this.cacheKeyBuilder = cacheKeyBuilder;
        this.reportWriter = reportWriter;
        this.scopeExecutor = scopeExecutor;
    }

    public FormGroupingResult groupForm(List<Field> fields,
                                        CategoryMetadataSource metadataSource,
                                        CancellationToken cancellation) {
        CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();
        Map<String, List<Field>> scopes = partitionByScope(fields);

        Map<String, CompletableFuture<ScopeGroupingResult>> futures = new LinkedHashMap<>();
        scopes.forEach((scopeId, scopeFields) -> futures.put(scopeId, CompletableFuture.supplyAsync(
                () -> groupScope(scopeId, scopeFields, metadataSource, token), scopeExecutor)));

        Map<String, ScopeGroupingResult> results = new LinkedHashMap<>();
        List<String> cancelled = new ArrayList<>();
        futures.forEach((scopeId, future) -> {
            try {
                results.put(scopeId, future.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof GroupingCancelledException) {
                    log.warn("[FormGrouping] scope={} cancelled, partial result discarded", scopeId);
                    cancelled.add(scopeId);
                } else if (e.getCause() instanceof RuntimeException cause) {
                    throw cause;
                } else {
                    throw e;
                }
            }
        });

        FormGroupingResult result = new FormGroupingResult(results, cancelled);
        log.info("[FormGrouping] fields={} scopes={} grouped={} cancelled={} strategies={}",
                fields.size(), scopes.size(), results.size(), cancelled.size(),
                results.values().stream().mapToInt(s -> s.strategies().size()).sum());
        if (log.isDebugEnabled()) {
            log.debug("[FormGrouping] report={}", reportWriter.write(result));
        }
        return result;
    }

    /**
     * Group one scope, reusing a caller-owned cache keyed by the scope's field list.
     */
    public List<GroupingStrategy> groupScopeCached(String scopeId,
                                                   List<Field> fields,
                                                   CategoryMetadataSource metadataSource,
                                                   GroupingResultCache cache) {
        String key = cacheKeyBuilder.buildKey(scopeId, fields);
        return cache.getOrCompute(key,
                () -> groupingService.group(scopeId, fields, metadataSource, CancellationToken.none()));
    }

    /**
     * Section-wide implied category structure, for nested rendering of sections without server combos.
     */
    public Optional<ImpliedCategoryCombination> inferImpliedStructure(String sectionName, List<Field> fields) {
        return impliedCategoryService.inferCategoryStructure(fields, sectionName);
    }

    private ScopeGroupingResult groupScope(String scopeId,
                                           List<Field> fields,
                                           CategoryMetadataSource metadataSource,
                                           CancellationToken cancellation) {
        if (cancellation.isCancelled()) {
            throw new GroupingCancelledException(scopeId, GroupingStage.TRY_CATEGORY_COMBO);
        }
        return ScopeGroupingResult.of(scopeId, groupingService.group(scopeId, fields, metadataSource, cancellation));
    }

    static Map<String, List<Field>> partitionByScope(List<Field> fields) {
        Map<String, List<Field>> scopes = new LinkedHashMap<>();
        for (Field field : fields) {
            scopes.computeIfAbsent(field.sectionName(), k -> new ArrayList<>()).add(field);
        }
        return scopes;
    }
}
