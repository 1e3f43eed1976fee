package com.clinicalguard.service;

import com.clinicalguard.entity.AuditLog;
import com.clinicalguard.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Persists audit entries off the request thread. A failed write is logged and
 * never reaches the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditWriter {

    private final AuditLogRepository auditLogRepository;

    @Async
    public void write(AuditLog entry) {
        try {
            auditLogRepository.save(entry);
        } catch (Exception e) {
            log.error("Failed to create audit log: {}", e.getMessage(), e);
        }
    }
}
