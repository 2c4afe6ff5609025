package com.nosota.xswap.service;

import com.nosota.xswap.error.AttestationFailedException;
import com.nosota.xswap.error.AttestationTimeoutException;
import com.nosota.xswap.error.CollaboratorFailureException;
import com.nosota.xswap.gateway.AttestationProof;
import com.nosota.xswap.gateway.AttestationStatus;
import com.nosota.xswap.gateway.BridgeTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.nosota.xswap.config.AsyncConfig.ATTESTATION_POLL_EXECUTOR;

/**
 * Polls the attestation service until a transfer is attested.
 *
 * <p>Each poll runs on the attestation poll executor and is abandoned after the
 * per-attempt timeout; a slow, failing or unscheduled poll counts as "still pending". Between
 * polls the waiter sleeps for the configured interval, never past the swap deadline. The wait
 * ends with:
 * <ul>
 *   <li>a complete proof (READY),</li>
 *   <li>{@link AttestationFailedException} if the service reports the transfer as failed,</li>
 *   <li>{@link AttestationTimeoutException} when the overall timeout elapses or the swap deadline passes.</li>
 * </ul>
 */
@Component
@Slf4j
public class AttestationWaiter {

    private final BridgeTransport bridgeTransport;
    private final Executor pollExecutor;
    private final Clock clock;
    private final Duration pollInterval;

    public AttestationWaiter(BridgeTransport bridgeTransport,
                             @Qualifier(ATTESTATION_POLL_EXECUTOR) Executor pollExecutor,
                             Clock clock,
                             @Value("${attestation.poll-interval:PT10S}") Duration pollInterval) {
        this.bridgeTransport = bridgeTransport;
        this.pollExecutor = pollExecutor;
        this.clock = clock;
        this.pollInterval = pollInterval;
    }

    /**
     * Blocks the calling thread until the transfer behind {@code handle} is attested.
     *
     * @param handle             Bridge transfer handle
     * @param perAttemptTimeout  Upper bound of a single poll
     * @param overallTimeout     Upper bound of the whole wait
     * @param deadline           Swap deadline; waiting stops once it has passed
     * @return Complete attestation proof
     * @throws AttestationTimeoutException if no proof arrived in time
     * @throws AttestationFailedException  if the transfer will never be attested
     */
    public AttestationProof waitForAttestation(String handle, Duration perAttemptTimeout, Duration overallTimeout,
                                               LocalDateTime deadline)
            throws AttestationTimeoutException, AttestationFailedException {
        long startedAt = System.nanoTime();
        long overallNanos = overallTimeout.toNanos();
        int attempt = 0;

        log.info("Waiting for attestation: handle={}, overallTimeout={}, deadline={}", handle, overallTimeout, deadline);

        while (true) {
            if (deadline != null && !LocalDateTime.now(clock).isBefore(deadline)) {
                throw new AttestationTimeoutException(
                        "Swap deadline " + deadline + " passed while waiting for attestation of " + handle, true);
            }
            long remaining = overallNanos - (System.nanoTime() - startedAt);
            if (remaining <= 0) {
                throw new AttestationTimeoutException(
                        "No attestation for " + handle + " after " + attempt + " attempts within " + overallTimeout, false);
            }

            attempt++;
            AttestationStatus status = pollOnce(handle, Math.min(perAttemptTimeout.toNanos(), remaining), attempt);
            if (status != null) {
                switch (status.kind()) {
                    case READY -> {
                        AttestationProof proof = status.proof();
                        if (proof != null && proof.isComplete()) {
                            log.info("Attestation ready: handle={}, attestationRef={}, attempts={}",
                                    handle, proof.attestationRef(), attempt);
                            return proof;
                        }
                        log.warn("Attestation reported ready without a complete proof: handle={}, attempt={}",
                                handle, attempt);
                    }
                    case FAILED -> throw new AttestationFailedException(
                            "Attestation failed for " + handle + ": " + status.detail());
                    case PENDING -> log.debug("Attestation pending: handle={}, attempt={}", handle, attempt);
                }
            }

            long sleepNanos = Math.min(pollInterval.toNanos(), overallNanos - (System.nanoTime() - startedAt));
            if (deadline != null) {
                Duration untilDeadline = Duration.between(LocalDateTime.now(clock), deadline);
                if (untilDeadline.compareTo(pollInterval) < 0) {
                    sleepNanos = Math.min(sleepNanos, Math.max(untilDeadline.toNanos(), 0));
                }
            }
            if (sleepNanos > 0) {
                try {
                    TimeUnit.NANOSECONDS.sleep(sleepNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new AttestationTimeoutException("Interrupted while waiting for attestation of " + handle, false);
                }
            }
        }
    }

    /**
     * @return Poll result, or null if the poll failed or did not answer in time
     */
    private AttestationStatus pollOnce(String handle, long timeoutNanos, int attempt)
            throws AttestationTimeoutException {
        CompletableFuture<AttestationStatus> poll;
        try {
            poll = CompletableFuture.supplyAsync(() -> {
                try {
                    return bridgeTransport.fetchAttestation(handle);
                } catch (CollaboratorFailureException e) {
                    throw new CompletionException(e);
                }
            }, pollExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Attestation poll not started, poll executor saturated: handle={}, attempt={}", handle, attempt);
            return null;
        }

        try {
            return poll.get(timeoutNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            poll.cancel(true);
            log.warn("Attestation poll timed out: handle={}, attempt={}", handle, attempt);
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                    ? e.getCause().getCause()
                    : e.getCause();
            log.warn("Attestation poll failed: handle={}, attempt={}, error={}", handle, attempt,
                    cause != null ? cause.getMessage() : e.getMessage());
            return null;
        } catch (InterruptedException e) {
            poll.cancel(true);
            Thread.currentThread().interrupt();
            throw new AttestationTimeoutException("Interrupted while waiting for attestation of " + handle, false);
        }
    }
}
