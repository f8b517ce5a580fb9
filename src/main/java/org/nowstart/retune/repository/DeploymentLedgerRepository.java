package org.nowstart.retune.repository;

import java.util.List;
import java.util.Optional;
import org.nowstart.retune.data.entity.DeploymentLedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DeploymentLedgerRepository extends JpaRepository<DeploymentLedgerEntry, Long> {

    List<DeploymentLedgerEntry> findByHorizonOrderByIdAsc(String horizon);

    Optional<DeploymentLedgerEntry> findTopByHorizonOrderByIdDesc(String horizon);
}
