package com.o2o.analytics.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Executors of the engine.
 *
 * - syncExecutor: small fixed pool for segment rebuilds, snapshot refreshes and consistency passes
 * - queryExecutor: runs engine calls so the router can enforce a deadline
 */
@Slf4j
@Configuration
public class ThreadPoolConfig {

    private static final int CPU_CORES = Runtime.getRuntime().availableProcessors();

    private ThreadPoolTaskExecutor syncExecutor;
    private ThreadPoolTaskExecutor queryExecutor;

    @Bean("syncExecutor")
    public ThreadPoolTaskExecutor syncExecutor(EngineProperties properties) {
        int workers = properties.getSync().getWorkerThreads();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("sync-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        this.syncExecutor = executor;

        log.info("Sync executor ready: {} workers", workers);
        return executor;
    }

    @Bean("queryExecutor")
    public ThreadPoolTaskExecutor queryExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(CPU_CORES * 2);
        executor.setMaxPoolSize(CPU_CORES * 8);
        executor.setQueueCapacity(500);
        executor.setKeepAliveSeconds(60);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setThreadNamePrefix("query-");

        // saturated: reject, the router reports the engine unavailable
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        this.queryExecutor = executor;

        log.info("Query executor ready: core={}, max={}", CPU_CORES * 2, CPU_CORES * 8);
        return executor;
    }

    @PreDestroy
    public void destroy() {
        shutdown("sync", syncExecutor);
        shutdown("query", queryExecutor);
    }

    private void shutdown(String name, ThreadPoolTaskExecutor executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.getThreadPoolExecutor().awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("{} executor did not stop in time, forcing shutdown", name);
                executor.getThreadPoolExecutor().shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.getThreadPoolExecutor().shutdownNow();
        }
    }
}
