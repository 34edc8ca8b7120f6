package com.flagship.tax_submission.generation;

import com.flagship.tax_submission.document.Document;
import com.flagship.tax_submission.document.DocumentKind;
import com.flagship.tax_submission.document.DocumentState;
import com.flagship.tax_submission.generation.dto.DocumentPageResponse;
import com.flagship.tax_submission.generation.dto.DocumentResponse;
import com.flagship.tax_submission.generation.dto.GenerateDocumentRequest;
import com.flagship.tax_submission.observability.CorrelationContext;
import com.flagship.tax_submission.observability.SubmissionMetrics;
import com.flagship.tax_submission.store.DocumentFilter;
import com.flagship.tax_submission.store.TenantIsolatedStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Optional;

/**
 * REST controller for issuing and reading a tenant's documents.
 *
 * Issuing is idempotent when the caller sends an Idempotency-Key header:
 * a repeated key returns the document produced the first time, with 200
 * instead of 201.
 */
@RestController
@RequestMapping("/api/tenants/{tenantId}/documents")
@RequiredArgsConstructor
@Slf4j
public class DocumentController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    private static final int MAX_PAGE_SIZE = 200;

    private final DocumentGenerator documentGenerator;
    private final IdempotencyService idempotencyService;
    private final TenantIsolatedStore store;
    private final SubmissionMetrics metrics;

    @PostMapping
    public ResponseEntity<DocumentResponse> generateDocument(
            @PathVariable String tenantId,
            @Valid @RequestBody GenerateDocumentRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received document request: kind={}, series={}, idempotencyKey={}",
            request.getKind(), request.getSeries(), idempotencyKey);

        try {
            if (idempotencyKey != null) {
                Optional<Document> existing = idempotencyService.findExisting(tenantId, idempotencyKey);
                if (existing.isPresent()) {
                    metrics.recordIdempotencyHit();
                    CorrelationContext.putDocument(tenantId, existing.get().getDocumentNumber());
                    log.info("Idempotency key already used, returning existing document");
                    return ResponseEntity.ok(DocumentResponse.from(existing.get()));
                }
                metrics.recordIdempotencyMiss();
            }

            Document document;
            try {
                document = documentGenerator.generate(tenantId, request.getKind(), request.toPayload(), idempotencyKey);
            } catch (DataIntegrityViolationException e) {
                // Concurrent request with the same key won the insert
                if (idempotencyKey == null) {
                    throw e;
                }
                Document winner = idempotencyService.findExisting(tenantId, idempotencyKey).orElseThrow(() -> e);
                log.info("Concurrent request with idempotency key {} produced {}", idempotencyKey,
                    winner.getDocumentNumber());
                return ResponseEntity.ok(DocumentResponse.from(winner));
            }

            CorrelationContext.putDocument(tenantId, document.getDocumentNumber());
            if (idempotencyKey != null) {
                idempotencyService.remember(tenantId, idempotencyKey, document.getDocumentNumber());
            }

            return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.from(document));

        } finally {
            CorrelationContext.clearDocument();
        }
    }

    @GetMapping
    public ResponseEntity<DocumentPageResponse> listDocuments(
            @PathVariable String tenantId,
            @RequestParam(required = false) DocumentState state,
            @RequestParam(required = false) DocumentKind kind,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {

        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE);
        }
        DocumentFilter filter = new DocumentFilter(state, kind, from, to);
        return ResponseEntity.ok(DocumentPageResponse.from(store.listDocuments(tenantId, filter, page, size)));
    }

    @GetMapping("/{documentNumber}")
    public ResponseEntity<DocumentResponse> getDocument(@PathVariable String tenantId,
                                                        @PathVariable String documentNumber) {
        return ResponseEntity.ok(DocumentResponse.from(store.getDocument(tenantId, documentNumber)));
    }

    /**
     * Returns the signed XML when the document has been signed, otherwise the
     * unsigned XML produced at issue time.
     */
    @GetMapping(value = "/{documentNumber}/xml", produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<byte[]> getDocumentXml(@PathVariable String tenantId,
                                                 @PathVariable String documentNumber) {
        Document document = store.getDocument(tenantId, documentNumber);
        byte[] xml = Optional.ofNullable(document.getSignedXmlKey())
            .flatMap(key -> store.getBlob(tenantId, key))
            .orElseGet(() -> document.getRawXml().getBytes(StandardCharsets.UTF_8));
        return ResponseEntity.ok()
            .contentType(MediaType.APPLICATION_XML)
            .body(xml);
    }
}
