package com.fieldgrouping.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class GroupingExecutorConfig {

    @Value("${grouping.scopes.parallelism:4}")
    private int scopeParallelism;

    @Bean(destroyMethod = "shutdown")
    public ExecutorService scopeGroupingExecutor() {
        return Executors.newFixedThreadPool(Math.max(1, scopeParallelism), daemonThreads("grouping-scope-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService metadataFetchExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("grouping-metadata-"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
