package com.clinicalguard.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

/**
 * One version of an externally authored rule. Disabling a rule is a content
 * change: flip {@code active} on its latest version.
 */
@Entity
@Immutable
@Table(name = "clinical_rules", indexes = {
    @Index(name = "idx_rule_id_version", columnList = "rule_id, version", unique = true)
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class ClinicalRule {

    @Id
    private Long id;

    @Column(name = "rule_id", nullable = false)
    private String ruleId;

    @Column(name = "version", nullable = false)
    private int version;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "category", nullable = false)
    private String category;

    @Column(name = "priority", nullable = false)
    private int priority;

    @Column(name = "logic", columnDefinition = "TEXT", nullable = false)
    private String logic;

    @Column(name = "severity", nullable = false)
    private String severity;

    @Column(name = "message", columnDefinition = "TEXT")
    private String message;

    @Column(name = "active", nullable = false)
    private boolean active;
}
