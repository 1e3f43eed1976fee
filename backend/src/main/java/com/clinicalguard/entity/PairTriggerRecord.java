package com.clinicalguard.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "pair_triggers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class PairTriggerRecord {

    @Id
    @Column(name = "trigger_id", nullable = false, updatable = false)
    private String triggerId;

    @Column(name = "drug_keyword", nullable = false)
    private String drugKeyword;

    @Column(name = "context_keyword", nullable = false)
    private String contextKeyword;

    @Column(name = "primary_drug_id", nullable = false)
    private String primaryDrugId;

    @Column(name = "secondary_drug_id", nullable = false)
    private String secondaryDrugId;

    @Column(name = "fallback_severity", nullable = false)
    private String fallbackSeverity;

    @Column(name = "message", columnDefinition = "TEXT")
    private String message;

    @Column(name = "active", nullable = false)
    private boolean active;
}
