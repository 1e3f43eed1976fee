package com.clinicalguard.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "audit_logs", indexes = {
    @Index(name = "idx_audit_user", columnList = "user_id"),
    @Index(name = "idx_audit_entity", columnList = "entity_type, entity_id"),
    @Index(name = "idx_audit_occurred_at", columnList = "occurred_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id")
    private String userId;

    @Column(name = "user_email")
    private String userEmail;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AuditAction action;

    @Column(name = "entity_type", nullable = false)
    private String entityType;

    @Column(name = "entity_id")
    private String entityId;

    @Column(name = "encounter_ref")
    private String encounterRef; // Caller-side reference only, never PHI

    @Column(name = "signal_color")
    private String signalColor;

    @Column(name = "override_policy")
    private String overridePolicy;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "justification", columnDefinition = "TEXT")
    private String justification;

    @Column(name = "supervisor_id")
    private String supervisorId;

    @Column(name = "ip_address")
    private String ipAddress;

    @Column(name = "user_agent")
    private String userAgent;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    public enum AuditAction {
        // Signals
        SIGNAL_ISSUED,

        // Clinician decisions
        DECISION_ACCEPTED,
        OVERRIDE_JUSTIFIED,
        OVERRIDE_SUPERVISED,
        OVERRIDE_REJECTED,

        // System
        SNAPSHOT_REFRESHED
    }
}
