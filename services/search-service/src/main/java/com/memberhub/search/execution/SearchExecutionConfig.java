package com.memberhub.search.execution;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
public class SearchExecutionConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService searchExecutor(@Value("${search.execution.pool-size:6}") int poolSize) {
        return Executors.newFixedThreadPool(Math.max(2, poolSize), new CustomizableThreadFactory("search-"));
    }

    // bounded: a slow log table sheds writes
    @Bean(destroyMethod = "shutdown")
    public ExecutorService queryLogExecutor(
        @Value("${search.execution.query-log-pool-size:2}") int poolSize,
        @Value("${search.execution.query-log-queue-capacity:1000}") int queueCapacity
    ) {
        int threads = Math.max(1, poolSize);
        return new ThreadPoolExecutor(
            threads,
            threads,
            0L,
            TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(Math.max(1, queueCapacity)),
            new CustomizableThreadFactory("query-log-"),
            new ThreadPoolExecutor.AbortPolicy()
        );
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService indexMaintenanceExecutor() {
        return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("ann-rebuild-"));
    }
}
