package org.nowstart.retune.repository;

import java.util.List;
import java.util.Optional;
import org.nowstart.retune.data.entity.OptimizationHistoryEntry;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OptimizationHistoryRepository extends JpaRepository<OptimizationHistoryEntry, Long> {

    List<OptimizationHistoryEntry> findByHorizonOrderByIdAsc(String horizon);

    Optional<OptimizationHistoryEntry> findTopByHorizonAndSearchedTrueOrderByStartedAtDesc(String horizon);
}
