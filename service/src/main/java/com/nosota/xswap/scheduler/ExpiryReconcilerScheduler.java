package com.nosota.xswap.scheduler;

import com.nosota.xswap.service.ExpiryReconciler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Scheduled expiry sweep.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   expiry-sweep:
 *     enabled: true              # enable/disable scheduler
 *     cron: "0 * * * * *"        # every minute
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.expiry-sweep.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class ExpiryReconcilerScheduler {

    private final ExpiryReconciler expiryReconciler;

    /**
     * Moves every active swap past its deadline to EXPIRED.
     */
    @Scheduled(cron = "${scheduler.expiry-sweep.cron:0 * * * * *}")
    public void expireOverdueSwaps() {
        log.debug("Starting scheduled job: expire overdue swaps");

        try {
            List<Long> expired = expiryReconciler.sweepAll();

            if (!expired.isEmpty()) {
                log.info("Expired {} overdue swaps", expired.size());
            } else {
                log.debug("No overdue swaps found");
            }

        } catch (Exception e) {
            log.error("Failed to expire overdue swaps: {}", e.getMessage(), e);
        }
    }
}
