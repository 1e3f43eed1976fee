package com.clinicalguard.repository;

import com.clinicalguard.entity.PairTriggerRecord;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
@Transactional(readOnly = true)
public interface PairTriggerRepository extends ReadOnlyRepository<PairTriggerRecord, String> {
    List<PairTriggerRecord> findByActiveTrue();
}
