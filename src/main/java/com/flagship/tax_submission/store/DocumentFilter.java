package com.flagship.tax_submission.store;

import com.flagship.tax_submission.document.DocumentKind;
import com.flagship.tax_submission.document.DocumentState;
import lombok.Value;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;

/**
 * Optional criteria for listing a tenant's documents. Null fields do not filter.
 * The issued-at range is inclusive at the start and exclusive at the end.
 */
@Value
public class DocumentFilter {
    DocumentState state;
    DocumentKind kind;
    Instant issuedFrom;
    Instant issuedTo;

    public static DocumentFilter none() {
        return new DocumentFilter(null, null, null, null);
    }

    Specification<DocumentEntity> toSpecification(String tenantId) {
        Specification<DocumentEntity> spec = (root, query, cb) -> cb.equal(root.get("tenantId"), tenantId);
        if (state != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("state"), state));
        }
        if (kind != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("kind"), kind));
        }
        if (issuedFrom != null) {
            spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(root.get("issuedAt"), issuedFrom));
        }
        if (issuedTo != null) {
            spec = spec.and((root, query, cb) -> cb.lessThan(root.get("issuedAt"), issuedTo));
        }
        return spec;
    }
}
