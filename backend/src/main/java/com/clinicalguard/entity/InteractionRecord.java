package com.clinicalguard.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "interaction_facts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class InteractionRecord {

    @Id
    private Long id;

    @Column(name = "drug_a_id", nullable = false)
    private String drugAId;

    @Column(name = "drug_b_id", nullable = false)
    private String drugBId;

    @Column(name = "severity", nullable = false)
    private String severity;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "source")
    private String source;

    @Column(name = "active", nullable = false)
    private boolean active;
}
