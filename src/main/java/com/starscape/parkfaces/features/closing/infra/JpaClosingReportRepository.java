package com.starscape.parkfaces.features.closing.infra;

import com.starscape.parkfaces.features.closing.domain.ClosingReport;
import com.starscape.parkfaces.features.closing.domain.ClosingReportRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaClosingReportRepository extends JpaRepository<ClosingReport, String>, ClosingReportRepository {
}
