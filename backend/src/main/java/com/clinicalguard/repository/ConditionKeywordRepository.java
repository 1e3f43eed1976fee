package com.clinicalguard.repository;

import com.clinicalguard.entity.ConditionKeywordRecord;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
@Transactional(readOnly = true)
public interface ConditionKeywordRepository extends ReadOnlyRepository<ConditionKeywordRecord, Long> {
    List<ConditionKeywordRecord> findByActiveTrue();
}
