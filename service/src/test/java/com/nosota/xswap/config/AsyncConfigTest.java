package com.nosota.xswap.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AsyncConfigTest {

    private final AsyncConfig asyncConfig = new AsyncConfig();

    @Test
    @DisplayName("a saga submitted while the core threads are busy starts right away")
    void sagaNotQueuedBehindLongRuns() throws Exception {
        ThreadPoolTaskExecutor executor = asyncConfig.swapTaskExecutor(4, 256);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        try {
            for (int i = 0; i < 4; i++) {
                executor.execute(() -> {
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }

            executor.execute(started::countDown);

            assertThat(started.await(1, TimeUnit.SECONDS)).isTrue();
            assertThat(executor.getActiveCount()).isGreaterThanOrEqualTo(4);
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("a saturated executor rejects instead of queueing")
    void saturatedExecutorRejects() {
        ThreadPoolTaskExecutor executor = asyncConfig.swapTaskExecutor(1, 2);
        CountDownLatch release = new CountDownLatch(1);
        Runnable blocking = () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        try {
            executor.execute(blocking);
            executor.execute(blocking);

            assertThatThrownBy(() -> executor.execute(blocking))
                    .isInstanceOf(TaskRejectedException.class);
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("attestation polls get a thread each")
    void pollsGetOwnThreads() throws Exception {
        ThreadPoolTaskExecutor executor = asyncConfig.attestationPollExecutor(256);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(8);
        try {
            for (int i = 0; i < 8; i++) {
                executor.execute(() -> {
                    started.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }

            assertThat(started.await(1, TimeUnit.SECONDS)).isTrue();
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }
}
