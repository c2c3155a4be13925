package com.fieldgrouping.domain.grouping.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag, checked between scopes and between pipeline stages.
 */
public interface CancellationToken {

    boolean isCancelled();

    static CancellationToken none() {
        return () -> false;
    }

    static Source source() {
        return new Source();
    }

    /**
     * Token whose owner can cancel it.
     */
    final class Source implements CancellationToken {

        private final AtomicBoolean cancelled = new AtomicBoolean();

        private Source() {
        }

        public void cancel() {
            cancelled.set(true);
        }

        @Override
        public boolean isCancelled() {
            return cancelled.get();
        }
    }
}
