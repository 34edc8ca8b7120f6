package com.flagship.tax_submission.generation;

import com.flagship.tax_submission.document.CurrencyCode;
import com.flagship.tax_submission.document.Document;
import com.flagship.tax_submission.document.DocumentKind;
import com.flagship.tax_submission.document.DocumentReference;
import com.flagship.tax_submission.exception.NotFoundException;
import com.flagship.tax_submission.observability.SubmissionMetrics;
import com.flagship.tax_submission.sequence.SequenceCounter;
import com.flagship.tax_submission.sequence.SeriesService;
import com.flagship.tax_submission.store.TenantIsolatedStore;
import com.flagship.tax_submission.tenant.Tenant;
import com.flagship.tax_submission.tenant.TenantService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Issues new tax documents.
 *
 * Order of work:
 * 1. Tenant must exist and be active
 * 2. Payload is validated (nothing is reserved or written on failure)
 * 3. Series is resolved and the next number reserved
 * 4. UBL XML is rendered
 * 5. Document is saved as PENDING with its DocumentIssued event
 *
 * A number reserved in step 3 is never handed out again, even if step 5 fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentGenerator {

    private final TenantService tenantService;
    private final SeriesService seriesService;
    private final SequenceCounter sequenceCounter;
    private final DocumentPayloadValidator validator;
    private final UblXmlWriter xmlWriter;
    private final TenantIsolatedStore store;
    private final SubmissionMetrics metrics;
    private final Clock clock;

    public Document generate(String tenantId, DocumentKind kind, DocumentPayload payload) {
        return generate(tenantId, kind, payload, null);
    }

    /**
     * @param idempotencyKey optional; recorded on the document for duplicate detection
     */
    public Document generate(String tenantId, DocumentKind kind, DocumentPayload payload, String idempotencyKey) {
        long startTime = System.currentTimeMillis();
        String kindTag = String.valueOf(kind);

        try {
            Tenant tenant = tenantService.requireActive(tenantId);
            DocumentPayload valid = validator.validate(kind, payload);
            DocumentReference reference = kind == DocumentKind.CREDIT_NOTE
                ? resolveReference(tenantId, valid)
                : null;

            String series = seriesService.resolve(tenantId, kind, valid.getSeries());
            long sequence = sequenceCounter.next(tenantId, kind, series);
            String documentNumber = SequenceCounter.format(series, sequence);
            Instant issuedAt = clock.instant();

            Document draft = Document.issue(tenantId, kind, series, sequence, documentNumber, issuedAt,
                CurrencyCode.valueOf(valid.getCurrency()), tenant.asIssuer(), valid.getRecipient(),
                valid.getItems(), reference, null);
            Document document = draft.toBuilder()
                .rawXml(xmlWriter.write(draft, clock.getZone()))
                .build();

            Document saved = store.saveDocument(tenantId, document, idempotencyKey);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordDocumentIssued(kindTag, "success");
            metrics.recordLatency("generate", duration);
            log.info("Issued {} {} for tenant {}: total={} {}, duration={}ms",
                kind, documentNumber, tenantId, saved.getTotals().getTotal(), saved.getCurrency(), duration);
            return saved;

        } catch (RuntimeException e) {
            metrics.recordDocumentIssued(kindTag, "error");
            metrics.recordLatency("generate", System.currentTimeMillis() - startTime);
            log.warn("Document generation refused for tenant {} ({}): {}", tenantId, kind, e.getMessage());
            throw e;
        }
    }

    private DocumentReference resolveReference(String tenantId, DocumentPayload payload) {
        String referencedNumber = payload.getReferencedNumber().trim();
        Document referenced = store.findDocument(tenantId, referencedNumber)
            .orElseThrow(() -> new NotFoundException("Document", referencedNumber));
        return new DocumentReference(referencedNumber, referenced.getKind(),
            payload.getReasonCode(), payload.getReferenceDescription().trim());
    }
}
