package com.nosota.xswap.repository;

import com.nosota.xswap.model.CounterName;
import com.nosota.xswap.model.SwapCounter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface SwapCounterRepository extends JpaRepository<SwapCounter, CounterName> {

    /**
     * Atomically adds {@code delta} to a counter. Concurrent increments are never lost
     * because the read-modify-write happens inside a single UPDATE statement.
     *
     * @param name  Counter name
     * @param delta Amount to add
     * @return Number of updated rows (1 when the counter exists)
     */
    @Modifying
    @Query("UPDATE SwapCounter c SET c.amount = c.amount + :delta WHERE c.name = :name")
    int increment(@Param("name") CounterName name, @Param("delta") Long delta);

    // Uses COALESCE to return 0 for a missing counter.
    @Query("SELECT COALESCE(MAX(c.amount), 0) FROM SwapCounter c WHERE c.name = :name")
    Long getAmount(@Param("name") CounterName name);
}
