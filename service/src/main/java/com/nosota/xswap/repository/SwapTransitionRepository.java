package com.nosota.xswap.repository;

import com.nosota.xswap.model.SwapTransition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SwapTransitionRepository extends JpaRepository<SwapTransition, Long> {

    List<SwapTransition> findBySwapIdOrderByIdAsc(Long swapId);
}
