package com.clinicalguard.repository;

import com.clinicalguard.entity.InteractionRecord;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
@Transactional(readOnly = true)
public interface InteractionRecordRepository extends ReadOnlyRepository<InteractionRecord, Long> {
    List<InteractionRecord> findByActiveTrue();
}
