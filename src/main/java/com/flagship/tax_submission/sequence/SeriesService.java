package com.flagship.tax_submission.sequence;

import com.flagship.tax_submission.document.DocumentKind;
import com.flagship.tax_submission.exception.InputValidationException;
import com.flagship.tax_submission.exception.NotFoundException;
import com.flagship.tax_submission.tenant.TenantService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Manages the series each tenant numbers its documents under.
 *
 * Every kind has a default series (B001, F001, NC01) that is always usable;
 * tenants may register more.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SeriesService {

    private final DocumentSeriesRepository repository;
    private final TenantService tenantService;

    @Transactional
    public DocumentSeries register(String tenantId, DocumentKind kind, String series) {
        tenantService.getTenant(tenantId);

        if (kind == null) {
            throw new InputValidationException("kind", "Document kind is required");
        }
        if (!DocumentSeries.isValidFor(kind, series)) {
            throw new InputValidationException("series", String.format(
                "Series '%s' is not valid for %s: expected 4 uppercase alphanumerics%s",
                series, kind, kind.getSeriesPrefix() != null ? " starting with " + kind.getSeriesPrefix() : ""));
        }

        var existing = repository.findByTenantIdAndKindAndSeries(tenantId, kind, series);
        if (existing.isPresent()) {
            log.debug("Series {} already registered for tenant {}", series, tenantId);
            return existing.get().toDomain();
        }

        DocumentSeries created = DocumentSeries.create(tenantId, kind, series);
        repository.save(DocumentSeriesEntity.fromDomain(created));
        log.info("Registered series {} for {} documents of tenant {}", series, kind, tenantId);
        return created;
    }

    @Transactional
    public DocumentSeries deactivate(String tenantId, DocumentKind kind, String series) {
        DocumentSeriesEntity entity = repository.findByTenantIdAndKindAndSeries(tenantId, kind, series)
            .orElseThrow(() -> new NotFoundException("Series", series));

        DocumentSeries deactivated = entity.toDomain().deactivate();
        entity.updateFromDomain(deactivated);
        repository.save(entity);
        log.info("Deactivated series {} for tenant {}", series, tenantId);
        return deactivated;
    }

    @Transactional(readOnly = true)
    public List<DocumentSeries> list(String tenantId) {
        return repository.findByTenantIdOrderByKindAscSeriesAsc(tenantId)
            .stream()
            .map(DocumentSeriesEntity::toDomain)
            .toList();
    }

    /**
     * Picks the series for a new document.
     *
     * A requested series must be the kind's default or an active registered
     * series. Without a request, the tenant's oldest active series is used,
     * falling back to the default.
     */
    @Transactional(readOnly = true)
    public String resolve(String tenantId, DocumentKind kind, String requested) {
        List<DocumentSeriesEntity> active =
            repository.findByTenantIdAndKindAndActiveTrueOrderByCreatedAtAsc(tenantId, kind);

        if (requested == null || requested.isBlank()) {
            return active.isEmpty() ? kind.getDefaultSeries() : active.get(0).getSeries();
        }

        if (requested.equals(kind.getDefaultSeries())
                || active.stream().anyMatch(s -> s.getSeries().equals(requested))) {
            return requested;
        }

        throw new InputValidationException("series",
            String.format("Series '%s' is not registered for %s documents", requested, kind));
    }
}
