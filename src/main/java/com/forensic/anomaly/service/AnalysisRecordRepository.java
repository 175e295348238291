package com.forensic.anomaly.service;

import com.forensic.anomaly.domain.AnalysisRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Archive of analyses, keyed by analysis id.
 */
@Repository
public interface AnalysisRecordRepository extends JpaRepository<AnalysisRecordEntity, String> {
}
