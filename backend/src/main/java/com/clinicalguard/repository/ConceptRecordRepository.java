package com.clinicalguard.repository;

import com.clinicalguard.entity.ConceptRecord;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@Transactional(readOnly = true)
public interface ConceptRecordRepository extends ReadOnlyRepository<ConceptRecord, String> {
}
