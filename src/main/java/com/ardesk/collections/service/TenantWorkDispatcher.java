package com.ardesk.collections.service;

import com.ardesk.collections.config.CollectionsProperties;
import com.ardesk.collections.exception.EngineTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Fans per-customer work out over the shared engine pool. Each tenant may only occupy a bounded
 * number of pool threads at once, so a large tenant cannot starve the others.
 */
@Slf4j
@Component
public class TenantWorkDispatcher {

    private final ThreadPoolTaskExecutor executor;
    private final int perTenantConcurrency;
    private final Duration requestTimeout;
    private final ConcurrentMap<String, Semaphore> permits = new ConcurrentHashMap<>();

    public TenantWorkDispatcher(@Qualifier("engineExecutor") ThreadPoolTaskExecutor executor,
            CollectionsProperties properties) {
        this.executor = executor;
        this.perTenantConcurrency = Math.max(1, properties.getEngine().getPerTenantConcurrency());
        this.requestTimeout = properties.getEngine().getRequestTimeout();
    }

    /**
     * Applies {@code task} to every item and returns the results in input order.
     *
     * @throws EngineTimeoutException when the whole batch does not finish within the request timeout;
     *                                unfinished tasks are cancelled
     */
    public <T, R> List<R> map(String tenantId, List<T> items, Function<T, R> task) {
        if (items.isEmpty()) {
            return List.of();
        }

        long deadline = System.nanoTime() + requestTimeout.toNanos();
        Semaphore tenantPermits = permits.computeIfAbsent(tenantId, t -> new Semaphore(perTenantConcurrency, true));
        List<CompletableFuture<R>> futures = new ArrayList<>(items.size());

        try {
            for (T item : items) {
                // Permits are taken on the calling thread so pool threads never block waiting for them
                if (!tenantPermits.tryAcquire(remaining(deadline), TimeUnit.NANOSECONDS)) {
                    throw timeout(tenantId, futures);
                }
                CompletableFuture<R> future;
                try {
                    future = CompletableFuture.supplyAsync(() -> task.apply(item), executor);
                } catch (RuntimeException e) {
                    tenantPermits.release();
                    throw e;
                }
                // Keep the task future itself; cancelling it stops a queued task from ever running
                future.whenComplete((result, error) -> tenantPermits.release());
                futures.add(future);
            }

            List<R> results = new ArrayList<>(futures.size());
            for (CompletableFuture<R> future : futures) {
                results.add(future.get(remaining(deadline), TimeUnit.NANOSECONDS));
            }
            return results;
        } catch (TimeoutException e) {
            throw timeout(tenantId, futures);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(futures);
            throw new EngineTimeoutException(tenantId, requestTimeout);
        } catch (ExecutionException e) {
            cancel(futures);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Engine task failed for tenant " + tenantId, cause);
        }
    }

    private static long remaining(long deadline) {
        return Math.max(0, deadline - System.nanoTime());
    }

    private EngineTimeoutException timeout(String tenantId, List<? extends CompletableFuture<?>> futures) {
        cancel(futures);
        log.warn("Tenant {}: computation exceeded {}; cancelled {} tasks", tenantId, requestTimeout, futures.size());
        return new EngineTimeoutException(tenantId, requestTimeout);
    }

    private static void cancel(List<? extends CompletableFuture<?>> futures) {
        futures.forEach(f -> f.cancel(true));
    }
}
