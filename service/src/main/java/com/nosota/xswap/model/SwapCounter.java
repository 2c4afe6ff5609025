package com.nosota.xswap.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Cross-swap aggregate counter (fee collector balance, volumes).
 *
 * <p>Rows are seeded by migration and only ever changed through
 * {@code SwapCounterRepository#increment}, a single atomic UPDATE.
 */
@Entity
@Table(name = "swap_counter")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class SwapCounter {

    @Id
    @Enumerated(EnumType.STRING)
    @Column(name = "name", length = 64)
    private CounterName name;

    @Column(name = "amount", nullable = false)
    private Long amount;
}
