package com.nosota.xswap.service;

import com.nosota.xswap.api.model.SwapState;
import com.nosota.xswap.api.response.SwapStatisticsResponse;
import com.nosota.xswap.model.CounterName;
import com.nosota.xswap.repository.SwapCounterRepository;
import com.nosota.xswap.repository.SwapRepository;
import jakarta.transaction.Transactional;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

/**
 * Cross-swap counters: fee collector balance and completed/refunded volumes.
 *
 * <p>The record methods are called from inside ledger transitions, so a counter moves
 * in the same transaction as the swap state that justifies it.
 */
@Service
@AllArgsConstructor
@Slf4j
public class SwapStatisticService {

    private final SwapCounterRepository swapCounterRepository;
    private final SwapRepository swapRepository;

    @Transactional
    public void recordCompletion(long outputAmount) {
        increment(CounterName.COMPLETED_VOLUME, outputAmount);
        increment(CounterName.COMPLETED_SWAPS, 1L);
    }

    @Transactional
    public void recordRefund(long refundAmount, long feeAmount) {
        increment(CounterName.REFUNDED_VOLUME, refundAmount);
        increment(CounterName.REFUNDED_SWAPS, 1L);
        if (feeAmount > 0) {
            increment(CounterName.FEE_COLLECTOR_BALANCE, feeAmount);
        }
    }

    public Long getFeeCollectorBalance() {
        return swapCounterRepository.getAmount(CounterName.FEE_COLLECTOR_BALANCE);
    }

    public Long getCounter(CounterName name) {
        return swapCounterRepository.getAmount(name);
    }

    /**
     * Retrieves counters and the number of swaps per state.
     *
     * <p>NOTE: counts every state with a separate query.
     */
    public SwapStatisticsResponse getStatistics() {
        Map<SwapState, Long> swapsByState = new EnumMap<>(SwapState.class);
        for (SwapState state : SwapState.values()) {
            swapsByState.put(state, swapRepository.countByState(state));
        }
        return new SwapStatisticsResponse(
                getFeeCollectorBalance(),
                getCounter(CounterName.COMPLETED_VOLUME),
                getCounter(CounterName.REFUNDED_VOLUME),
                swapsByState
        );
    }

    private void increment(CounterName name, long delta) {
        int updated = swapCounterRepository.increment(name, delta);
        if (updated != 1) {
            throw new IllegalStateException("Counter " + name + " is missing");
        }
        log.debug("Counter incremented: name={}, delta={}", name, delta);
    }
}
