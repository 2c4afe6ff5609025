package com.nosota.xswap.model;

import com.nosota.xswap.api.model.SwapState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Audit row written for every accepted ledger transition, including creation
 * (fromState = null). Never updated or deleted.
 */
@Entity
@Table(name = "swap_transition")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class SwapTransition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "swap_id", nullable = false, updatable = false)
    private Long swapId;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_state", updatable = false, length = 32)
    private SwapState fromState;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_state", nullable = false, updatable = false, length = 32)
    private SwapState toState;

    @Column(name = "reason", updatable = false, length = 1000)
    private String reason;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private LocalDateTime occurredAt;
}
