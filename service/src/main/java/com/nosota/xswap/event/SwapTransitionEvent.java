package com.nosota.xswap.event;

import com.nosota.xswap.api.model.SwapState;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.time.LocalDateTime;

/**
 * Published after every accepted swap transition, once the transition row has been written.
 * {@code oldState} is null for the creation of a swap.
 */
@Getter
public class SwapTransitionEvent extends ApplicationEvent {

    private final Long swapId;
    private final SwapState oldState;
    private final SwapState newState;
    private final String reason;
    private final LocalDateTime occurredAt;

    public SwapTransitionEvent(Object source, Long swapId, SwapState oldState, SwapState newState,
                               String reason, LocalDateTime occurredAt) {
        super(source);
        this.swapId = swapId;
        this.oldState = oldState;
        this.newState = newState;
        this.reason = reason;
        this.occurredAt = occurredAt;
    }
}
