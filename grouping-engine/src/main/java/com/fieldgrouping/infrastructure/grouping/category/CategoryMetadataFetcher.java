package com.fieldgrouping.infrastructure.grouping.category;

import com.fieldgrouping.domain.grouping.model.CategoryOptionComboRef;
import com.fieldgrouping.domain.grouping.model.CategoryStructure;
import com.fieldgrouping.domain.grouping.service.CategoryMetadataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Calls the metadata collaborator with a per-call timeout.
 * Every failure mode surfaces as {@link MetadataUnavailableException}.
 */
@Slf4j
@Component
public class CategoryMetadataFetcher {

    private final Executor executor;

    @Value("${grouping.category-combo.fetch-timeout-ms:2000}")
    private long fetchTimeoutMs;

    public CategoryMetadataFetcher(@Qualifier("metadataFetchExecutor") Executor executor) {
        this.executor = executor;
    }

    public List<CategoryStructure> fetchStructure(CategoryMetadataSource source, String categoryComboId) {
        return fetch("structure", categoryComboId, () -> source.getCategoryComboStructure(categoryComboId));
    }

    public List<CategoryOptionComboRef> fetchOptionCombos(CategoryMetadataSource source, String categoryComboId) {
        return fetch("option combos", categoryComboId, () -> source.getCategoryOptionCombos(categoryComboId));
    }

    private <T> List<T> fetch(String what, String categoryComboId, Supplier<List<T>> call) {
        CompletableFuture<List<T>> future = CompletableFuture.supplyAsync(call, executor);
        try {
            List<T> result = future.get(fetchTimeoutMs, TimeUnit.MILLISECONDS);
            return result != null ? result : List.of();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new MetadataUnavailableException(
                    "Timed out after " + fetchTimeoutMs + "ms fetching " + what + " of " + categoryComboId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new MetadataUnavailableException(
                    "Failed to fetch " + what + " of " + categoryComboId + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new MetadataUnavailableException(
                    "Interrupted fetching " + what + " of " + categoryComboId, e);
        }
    }
}
