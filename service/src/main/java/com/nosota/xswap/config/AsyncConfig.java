package com.nosota.xswap.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named thread pools: swap-task-executor runs whole sagas and attestation waits (one task per swap),
 * attestation-poll-executor runs single attestation polls so they can be abandoned on timeout.
 *
 * <p>Both pools hand tasks straight to a thread (queue capacity 0), so a long attestation wait
 * never queues another swap behind it. Once {@code max-pool-size} threads are busy, further
 * submissions fail with {@link org.springframework.core.task.TaskRejectedException}.
 */
@Configuration
public class AsyncConfig {

    public static final String SWAP_TASK_EXECUTOR = "swapTaskExecutor";
    public static final String ATTESTATION_POLL_EXECUTOR = "attestationPollExecutor";

    @Bean(name = SWAP_TASK_EXECUTOR)
    public ThreadPoolTaskExecutor swapTaskExecutor(@Value("${swap.executor.core-pool-size:4}") int corePoolSize,
                                                   @Value("${swap.executor.max-pool-size:256}") int maxPoolSize) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(corePoolSize);
        e.setMaxPoolSize(maxPoolSize);
        e.setQueueCapacity(0);
        e.setKeepAliveSeconds(60);
        e.setThreadNamePrefix("swap-");
        e.initialize();
        return e;
    }

    @Bean(name = ATTESTATION_POLL_EXECUTOR)
    public ThreadPoolTaskExecutor attestationPollExecutor(
            @Value("${attestation.poll-executor.max-pool-size:256}") int maxPoolSize) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(0);
        e.setMaxPoolSize(maxPoolSize);
        e.setQueueCapacity(0);
        e.setKeepAliveSeconds(30);
        e.setThreadNamePrefix("attestation-poll-");
        e.initialize();
        return e;
    }
}
