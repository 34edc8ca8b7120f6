package com.flagship.tax_submission.sequence;

import com.flagship.tax_submission.document.DocumentKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DocumentSeriesRepository extends JpaRepository<DocumentSeriesEntity, UUID> {

    List<DocumentSeriesEntity> findByTenantIdOrderByKindAscSeriesAsc(String tenantId);

    List<DocumentSeriesEntity> findByTenantIdAndKindAndActiveTrueOrderByCreatedAtAsc(String tenantId, DocumentKind kind);

    Optional<DocumentSeriesEntity> findByTenantIdAndKindAndSeries(String tenantId, DocumentKind kind, String series);
}
