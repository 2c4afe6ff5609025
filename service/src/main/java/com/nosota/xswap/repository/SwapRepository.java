package com.nosota.xswap.repository;

import com.nosota.xswap.api.model.SwapState;
import com.nosota.xswap.model.Swap;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for {@link Swap} entity operations.
 *
 * <p>Besides the read-only queries (by owner, by attestation, by state) it provides
 * the two per-row concurrency primitives used by the ledger:
 * <ul>
 *   <li>{@link #getOneForUpdate(Long)} - row lock under which a transition compares
 *       the observed state with the expected one</li>
 *   <li>{@link #claimStep} - conditional update marking a step as in flight</li>
 * </ul>
 */
@Repository
public interface SwapRepository extends JpaRepository<Swap, Long> {

    /**
     * Retrieves the swap and locks its row for update.
     * <p>
     * Only the swap's own row is locked, so transitions of different swaps never contend.
     * Keep the surrounding transaction short.
     * </p>
     *
     * @param id Swap id
     * @return Locked swap, or null if not found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Swap s WHERE s.id = :id")
    Swap getOneForUpdate(@Param("id") Long id);

    /**
     * Marks a step as in flight if the swap is still in {@code expectedState}
     * and no other (non-stale) claim exists.
     *
     * @param id            Swap id
     * @param expectedState State the caller observed
     * @param now           Claim timestamp
     * @param staleBefore   Claims older than this are considered abandoned
     * @return 1 if the claim was taken, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Swap s
               SET s.stepClaimedAt = :now
             WHERE s.id = :id
               AND s.state = :expectedState
               AND (s.stepClaimedAt IS NULL OR s.stepClaimedAt < :staleBefore)
            """)
    int claimStep(@Param("id") Long id,
                  @Param("expectedState") SwapState expectedState,
                  @Param("now") LocalDateTime now,
                  @Param("staleBefore") LocalDateTime staleBefore);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Swap s SET s.stepClaimedAt = NULL WHERE s.id = :id")
    int releaseClaim(@Param("id") Long id);

    Page<Swap> findByOwnerOrderByCreatedAtDesc(String owner, Pageable pageable);

    @Query("SELECT s.id FROM Swap s WHERE s.owner = :owner ORDER BY s.id")
    List<Long> findIdsByOwner(@Param("owner") String owner);

    Optional<Swap> findByAttestationRef(String attestationRef);

    List<Swap> findByStateOrderByIdAsc(SwapState state);

    /**
     * Finds swaps that can still progress but whose deadline has passed.
     *
     * @param states Active states
     * @param now    Current timestamp
     * @return Ids of swaps due for expiry
     */
    @Query("""
            SELECT s.id
            FROM Swap s
            WHERE s.state IN :states
              AND s.deadline <= :now
            ORDER BY s.id
            """)
    List<Long> findIdsDueForExpiry(@Param("states") Collection<SwapState> states,
                                   @Param("now") LocalDateTime now);

    /**
     * Finds swaps in {@code state} that are still before their deadline and not being worked on.
     * Used to retry attestation waits that timed out.
     */
    @Query("""
            SELECT s.id
            FROM Swap s
            WHERE s.state = :state
              AND s.deadline > :now
              AND (s.stepClaimedAt IS NULL OR s.stepClaimedAt < :staleBefore)
            ORDER BY s.id
            """)
    List<Long> findIdsUnclaimedBeforeDeadline(@Param("state") SwapState state,
                                              @Param("now") LocalDateTime now,
                                              @Param("staleBefore") LocalDateTime staleBefore);

    long countByState(SwapState state);
}
