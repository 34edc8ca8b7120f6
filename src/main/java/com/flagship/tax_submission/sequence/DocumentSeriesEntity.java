package com.flagship.tax_submission.sequence;

import com.flagship.tax_submission.document.DocumentKind;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "document_series",
    uniqueConstraints = @UniqueConstraint(name = "uq_document_series", columnNames = {"tenant_id", "kind", "series"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DocumentSeriesEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false, length = 11)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private DocumentKind kind;

    @Column(nullable = false, updatable = false, length = 4)
    private String series;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    static DocumentSeriesEntity fromDomain(DocumentSeries series) {
        return new DocumentSeriesEntity(
            series.getId(),
            series.getTenantId(),
            series.getKind(),
            series.getSeries(),
            series.isActive(),
            series.getCreatedAt()
        );
    }

    public DocumentSeries toDomain() {
        return new DocumentSeries(id, tenantId, kind, series, active, createdAt);
    }

    /**
     * Only the active flag may change after creation.
     */
    void updateFromDomain(DocumentSeries series) {
        this.active = series.isActive();
    }
}
