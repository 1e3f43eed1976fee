package com.clinicalguard.repository;

import com.clinicalguard.entity.IngredientLink;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
@Transactional(readOnly = true)
public interface IngredientLinkRepository extends ReadOnlyRepository<IngredientLink, Long> {
    List<IngredientLink> findByActiveTrue();
}
