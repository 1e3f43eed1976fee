package com.clinicalguard.repository;

import com.clinicalguard.entity.ContraindicationRecord;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
@Transactional(readOnly = true)
public interface ContraindicationRecordRepository extends ReadOnlyRepository<ContraindicationRecord, Long> {
    List<ContraindicationRecord> findByActiveTrue();
}
