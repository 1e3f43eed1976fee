package com.clinicalguard.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

/**
 * Editable keyword to diagnosis mapping used to infer conditions from free text.
 */
@Entity
@Immutable
@Table(name = "condition_keywords")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class ConditionKeywordRecord {

    @Id
    private Long id;

    @Column(name = "keyword", nullable = false)
    private String keyword;

    @Column(name = "diagnosis_id", nullable = false)
    private String diagnosisId;

    @Column(name = "active", nullable = false)
    private boolean active;
}
