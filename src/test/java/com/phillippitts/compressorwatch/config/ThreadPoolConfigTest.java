package com.phillippitts.compressorwatch.config;

import com.phillippitts.compressorwatch.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateExecutorFromDefaults() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).detectionExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(2);
        assertThat(executor.getMaxPoolSize()).isEqualTo(4);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("detect-pool-");
    }

    @Test
    void shouldPropagateThreadContextToWorker() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).detectionExecutor();
        ThreadContext.put("requestId", "req-42");
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> threadName = new AtomicReference<>();

        executor.execute(() -> {
            seen.set(ThreadContext.get("requestId"));
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("req-42");
        assertThat(threadName.get()).startsWith("detect-pool-");
    }

    @Test
    void decoratorRestoresWorkerContextAfterTask() {
        ThreadContext.put("requestId", "outer");
        Runnable decorated = ThreadPoolConfig.mdcPropagatingDecorator().decorate(() ->
                assertThat(ThreadContext.get("requestId")).isEqualTo("outer"));
        ThreadContext.clearAll();
        ThreadContext.put("worker", "w1");

        decorated.run();

        assertThat(ThreadContext.get("worker")).isEqualTo("w1");
        assertThat(ThreadContext.get("requestId")).isNull();
    }
}
