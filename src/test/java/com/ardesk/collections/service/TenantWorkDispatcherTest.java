package com.ardesk.collections.service;

import com.ardesk.collections.config.CollectionsProperties;
import com.ardesk.collections.exception.EngineTimeoutException;
import com.ardesk.collections.exception.TenantIsolationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class TenantWorkDispatcherTest {

    private ThreadPoolTaskExecutor executor;
    private CollectionsProperties properties;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(8);
        executor.setThreadNamePrefix("test-engine-");
        executor.initialize();

        properties = new CollectionsProperties();
        properties.getEngine().setPerTenantConcurrency(2);
        properties.getEngine().setRequestTimeout(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void map_ShouldKeepInputOrder() {
        TenantWorkDispatcher dispatcher = new TenantWorkDispatcher(executor, properties);
        List<Integer> input = IntStream.rangeClosed(1, 50).boxed().collect(Collectors.toList());

        List<Integer> output = dispatcher.map("acme", input, i -> i * 10);

        assertEquals(input.stream().map(i -> i * 10).collect(Collectors.toList()), output);
    }

    @Test
    void map_ShouldNotExceedPerTenantConcurrency() {
        TenantWorkDispatcher dispatcher = new TenantWorkDispatcher(executor, properties);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        dispatcher.map("acme", IntStream.range(0, 20).boxed().collect(Collectors.toList()), i -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            running.decrementAndGet();
            return i;
        });

        assertTrue(peak.get() <= 2, "peak was " + peak.get());
    }

    @Test
    void map_ShouldTimeOut_WhenWorkOutlivesRequest() {
        properties.getEngine().setRequestTimeout(Duration.ofMillis(100));
        TenantWorkDispatcher dispatcher = new TenantWorkDispatcher(executor, properties);

        assertThrows(EngineTimeoutException.class, () -> dispatcher.map("acme", List.of(1, 2, 3), i -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return i;
        }));
    }

    @Test
    void map_ShouldRethrowTaskFailure() {
        TenantWorkDispatcher dispatcher = new TenantWorkDispatcher(executor, properties);

        assertThrows(TenantIsolationException.class, () -> dispatcher.map("acme", List.of(1, 2), i -> {
            if (i == 2) {
                throw new TenantIsolationException("acme", "other", "invoice 2");
            }
            return i;
        }));
    }

    @Test
    void map_ShouldReturnEmpty_WhenNothingToDo() {
        TenantWorkDispatcher dispatcher = new TenantWorkDispatcher(executor, properties);

        assertTrue(dispatcher.map("acme", List.<Integer>of(), i -> i).isEmpty());
    }

    @Test
    void map_ShouldNotRunQueuedTasks_AfterTimeout() throws Exception {
        ThreadPoolTaskExecutor single = new ThreadPoolTaskExecutor();
        single.setCorePoolSize(1);
        single.setMaxPoolSize(1);
        single.initialize();
        properties.getEngine().setRequestTimeout(Duration.ofMillis(200));
        TenantWorkDispatcher dispatcher = new TenantWorkDispatcher(single, properties);
        AtomicInteger started = new AtomicInteger();

        assertThrows(EngineTimeoutException.class, () -> dispatcher.map("acme", List.of(1, 2), i -> {
            started.incrementAndGet();
            try {
                Thread.sleep(600);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return i;
        }));

        // Let the pool drain whatever is still queued
        single.getThreadPoolExecutor().shutdown();
        assertTrue(single.getThreadPoolExecutor().awaitTermination(5, TimeUnit.SECONDS));
        assertEquals(1, started.get());
    }
}
