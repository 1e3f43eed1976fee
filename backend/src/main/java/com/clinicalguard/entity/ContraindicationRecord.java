package com.clinicalguard.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "contraindication_facts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class ContraindicationRecord {

    @Id
    private Long id;

    @Column(name = "drug_id", nullable = false)
    private String drugId;

    @Column(name = "diagnosis_id", nullable = false)
    private String diagnosisId;

    @Column(name = "severity", nullable = false)
    private String severity;

    @Column(name = "reason", columnDefinition = "TEXT")
    private String reason;

    @Column(name = "active", nullable = false)
    private boolean active;
}
