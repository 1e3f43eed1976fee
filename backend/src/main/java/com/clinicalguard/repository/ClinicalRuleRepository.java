package com.clinicalguard.repository;

import com.clinicalguard.entity.ClinicalRule;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@Transactional(readOnly = true)
public interface ClinicalRuleRepository extends ReadOnlyRepository<ClinicalRule, Long> {
}
