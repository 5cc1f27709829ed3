package com.starscape.parkfaces.features.closing.domain;

import java.util.List;
import java.util.Optional;

public interface ClosingReportRepository {
    <S extends ClosingReport> S save(S report);
    Optional<ClosingReport> findById(String closingId);
    Optional<ClosingReport> findTopByOrderByClosedAtDesc();
    List<ClosingReport> findAllByOrderByClosedAtDesc();
    long count();
}
