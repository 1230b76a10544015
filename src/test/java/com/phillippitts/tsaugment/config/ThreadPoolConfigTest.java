package com.phillippitts.tsaugment.config;

import com.phillippitts.tsaugment.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    @AfterEach
    void clearContext() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateExecutorWithDefaultConfiguration() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        Executor executor = config.augmentExecutor();

        assertThat(executor).isInstanceOf(ThreadPoolTaskExecutor.class);

        ThreadPoolTaskExecutor taskExecutor = (ThreadPoolTaskExecutor) executor;
        int processors = Runtime.getRuntime().availableProcessors();
        assertThat(taskExecutor.getCorePoolSize()).isEqualTo(processors);
        assertThat(taskExecutor.getMaxPoolSize()).isEqualTo(processors);
        assertThat(taskExecutor.getThreadNamePrefix()).isEqualTo("augment-pool-");
        taskExecutor.shutdown();
    }

    @Test
    void shouldNeverConfigureMaxBelowCore() {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getAugment().setCorePoolSize(4);
        properties.getAugment().setMaxPoolSize(2);

        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new ThreadPoolConfig(properties).augmentExecutor();

        assertThat(executor.getMaxPoolSize()).isEqualTo(4);
        executor.shutdown();
    }

    @Test
    void shouldHandleConcurrentTasks() throws InterruptedException {
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).augmentExecutor();

        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completedTasks = new AtomicInteger(0);

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                try {
                    Thread.sleep(10);
                    completedTasks.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completedTasks.get()).isEqualTo(taskCount);
        executor.shutdown();
    }

    @Test
    void shouldRunOnCallerWhenSaturated() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getAugment().setCorePoolSize(1);
        properties.getAugment().setMaxPoolSize(1);
        properties.getAugment().setQueueCapacity(1);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new ThreadPoolConfig(properties).augmentExecutor();

        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(3);
        AtomicReference<String> thirdThread = new AtomicReference<>();
        Runnable blocking = () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                done.countDown();
            }
        };

        executor.execute(blocking);
        executor.execute(blocking);
        executor.execute(() -> {
            thirdThread.set(Thread.currentThread().getName());
            done.countDown();
        });
        release.countDown();

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(thirdThread.get()).isEqualTo(Thread.currentThread().getName());
        executor.shutdown();
    }

    @Test
    void shouldCopyThreadContextToWorkers() throws InterruptedException {
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).augmentExecutor();
        ThreadContext.put("batchId", "abc123");

        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> threadName = new AtomicReference<>();
        executor.execute(() -> {
            seen.set(ThreadContext.get("batchId"));
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("abc123");
        assertThat(threadName.get()).startsWith("augment-pool-");
        executor.shutdown();
    }

    @Test
    void decoratorRestoresWorkerContext() {
        ThreadContext.put("batchId", "submitter");
        Runnable decorated = ThreadPoolConfig.contextPropagatingDecorator()
                .decorate(() -> assertThat(ThreadContext.get("batchId")).isEqualTo("submitter"));

        ThreadContext.clearAll();
        ThreadContext.put("stage", "worker");
        decorated.run();

        assertThat(ThreadContext.get("batchId")).isNull();
        assertThat(ThreadContext.get("stage")).isEqualTo("worker");
    }

    @Test
    void shouldShutdownGracefully() {
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).augmentExecutor();

        executor.execute(() -> {
            // Simple task
        });

        executor.shutdown();
        assertThat(executor.getThreadPoolExecutor().isShutdown()).isTrue();
    }
}
