package org.aviator.repo;

import org.aviator.model.AuditLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {
    List<AuditLog> findByOrderByCreatedAtDesc(Pageable pageable);

    List<AuditLog> findByEventTypeOrderByCreatedAtDesc(String eventType, Pageable pageable);
}
