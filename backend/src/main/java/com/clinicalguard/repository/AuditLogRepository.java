package com.clinicalguard.repository;

import com.clinicalguard.entity.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {
    Optional<AuditLog> findFirstByEntityIdAndActionOrderByOccurredAtDesc(String entityId, AuditLog.AuditAction action);
}
