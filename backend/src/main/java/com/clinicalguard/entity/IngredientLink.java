package com.clinicalguard.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "ingredient_links")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class IngredientLink {

    @Id
    private Long id;

    @Column(name = "drug_id", nullable = false)
    private String drugId;

    @Column(name = "ingredient_id", nullable = false)
    private String ingredientId;

    @Column(name = "active", nullable = false)
    private boolean active;
}
