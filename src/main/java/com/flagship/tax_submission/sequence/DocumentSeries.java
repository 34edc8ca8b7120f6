package com.flagship.tax_submission.sequence;

import com.flagship.tax_submission.document.DocumentKind;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * A series a tenant numbers documents of one kind under, e.g. B001 for receipts.
 */
@Value
public class DocumentSeries {
    private static final Pattern SERIES_PATTERN = Pattern.compile("^[A-Z0-9]{4}$");

    UUID id;
    String tenantId;
    DocumentKind kind;
    String series;
    boolean active;
    Instant createdAt;

    public static DocumentSeries create(String tenantId, DocumentKind kind, String series) {
        return new DocumentSeries(UUID.randomUUID(), tenantId, kind, series, true, Instant.now());
    }

    /**
     * Checks the series format: four uppercase alphanumerics, starting with
     * the kind's letter when the kind has one.
     */
    public static boolean isValidFor(DocumentKind kind, String series) {
        return series != null && SERIES_PATTERN.matcher(series).matches() && kind.acceptsSeries(series);
    }

    public DocumentSeries deactivate() {
        return new DocumentSeries(id, tenantId, kind, series, false, createdAt);
    }
}
