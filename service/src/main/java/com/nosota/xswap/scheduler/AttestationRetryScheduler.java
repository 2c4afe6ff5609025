package com.nosota.xswap.scheduler;

import com.nosota.xswap.service.SagaExecutor;
import com.nosota.xswap.service.SwapLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;

/**
 * Resumes swaps whose attestation wait timed out.
 *
 * <p>Picks BRIDGE_SENT swaps that are before their deadline and not claimed by a running
 * step, and resumes their saga on the swap task executor. The resumed run continues with
 * the destination step once the attestation is recorded. A swap whose resumed run has not
 * finished yet is not submitted again.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   attestation-retry:
 *     enabled: true
 *     fixed-delay: 60000     # ms between runs
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.attestation-retry.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class AttestationRetryScheduler {

    private final SwapLedger swapLedger;
    private final SagaExecutor sagaExecutor;
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    @Scheduled(fixedDelayString = "${scheduler.attestation-retry.fixed-delay:60000}")
    public void resumePendingAttestations() {
        try {
            List<Long> swapIds = swapLedger.findIdsAwaitingAttestation();
            if (swapIds.isEmpty()) {
                log.debug("No swaps awaiting attestation");
                return;
            }

            log.info("Resuming {} swaps awaiting attestation", swapIds.size());
            int submitted = 0;
            for (Long swapId : swapIds) {
                if (resume(swapId)) {
                    submitted++;
                }
            }
            log.info("Submitted {} of {} swaps awaiting attestation", submitted, swapIds.size());

        } catch (Exception e) {
            log.error("Failed to resume swaps awaiting attestation: {}", e.getMessage(), e);
        }
    }

    private boolean resume(Long swapId) {
        if (!inFlight.add(swapId)) {
            log.debug("Resumed run still in flight: swapId={}", swapId);
            return false;
        }
        try {
            sagaExecutor.runAsync(swapId).whenComplete((swap, error) -> inFlight.remove(swapId));
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(swapId);
            log.warn("Swap executor saturated, retrying next round: swapId={}", swapId);
            return false;
        }
    }
}
