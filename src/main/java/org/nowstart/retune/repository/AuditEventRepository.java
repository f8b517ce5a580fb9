package org.nowstart.retune.repository;

import java.util.List;
import java.util.UUID;
import org.nowstart.retune.data.entity.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

    List<AuditEvent> findByHorizonOrderByEmittedAtAsc(String horizon);
}
