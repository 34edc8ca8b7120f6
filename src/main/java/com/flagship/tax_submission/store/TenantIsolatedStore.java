package com.flagship.tax_submission.store;

import com.flagship.tax_submission.document.Document;
import com.flagship.tax_submission.document.DocumentReceipt;
import com.flagship.tax_submission.document.DocumentState;
import com.flagship.tax_submission.document.TransmissionError;
import com.flagship.tax_submission.document.event.DocumentIssuedEvent;
import com.flagship.tax_submission.document.event.DocumentStateChangedEvent;
import com.flagship.tax_submission.exception.NotFoundException;
import com.flagship.tax_submission.exception.OwnershipViolationException;
import com.flagship.tax_submission.observability.SubmissionMetrics;
import com.flagship.tax_submission.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Tenant-scoped persistence for documents and blobs.
 *
 * Key principles:
 * - Every write names the acting tenant and is checked against the record's own tenant
 * - Reads are keyed by (tenantId, documentNumber); another tenant's record is simply not found
 * - Blob keys live under the tenant's prefix ({tenantId}/...)
 * - State changes are conditional updates on the expected current state
 * - Lifecycle events go to the outbox in the same transaction as the change
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TenantIsolatedStore {

    private static final String DOCUMENT = "Document";

    private final DocumentRepository documentRepository;
    private final BlobRepository blobRepository;
    private final DocumentMapper documentMapper;
    private final OutboxService outboxService;
    private final SubmissionMetrics metrics;
    private final Clock clock;

    // ---------------------------------------------------------------------
    // Documents
    // ---------------------------------------------------------------------

    /**
     * Persists a freshly issued document and writes its DocumentIssued event.
     */
    @Transactional
    public Document saveDocument(String tenantId, Document document, String idempotencyKey) {
        requireOwner(tenantId, document.getTenantId(), "document " + document.getDocumentNumber());

        DocumentEntity saved = documentRepository.save(documentMapper.toEntity(document, idempotencyKey));
        outboxService.saveEvent(DocumentIssuedEvent.fromDocument(document));

        log.debug("Saved document {} for tenant {}", saved.getDocumentNumber(), tenantId);
        return documentMapper.toDomain(saved);
    }

    @Transactional(readOnly = true)
    public Optional<Document> findDocument(String tenantId, String documentNumber) {
        return documentRepository.findByTenantIdAndDocumentNumber(tenantId, documentNumber)
            .map(documentMapper::toDomain);
    }

    /**
     * @throws NotFoundException if the tenant has no document with that number
     */
    @Transactional(readOnly = true)
    public Document getDocument(String tenantId, String documentNumber) {
        return findDocument(tenantId, documentNumber)
            .orElseThrow(() -> new NotFoundException(DOCUMENT, documentNumber));
    }

    @Transactional(readOnly = true)
    public Optional<Document> findByIdempotencyKey(String tenantId, String idempotencyKey) {
        return documentRepository.findByTenantIdAndIdempotencyKey(tenantId, idempotencyKey)
            .map(documentMapper::toDomain);
    }

    /**
     * Lists a tenant's documents, newest first.
     */
    @Transactional(readOnly = true)
    public Page<Document> listDocuments(String tenantId, DocumentFilter filter, int page, int size) {
        DocumentFilter criteria = filter != null ? filter : DocumentFilter.none();
        PageRequest request = PageRequest.of(Math.max(page, 0), Math.max(size, 1),
            Sort.by(Sort.Direction.DESC, "issuedAt").and(Sort.by(Sort.Direction.DESC, "sequenceNumber")));
        return documentRepository.findAll(criteria.toSpecification(tenantId), request)
            .map(documentMapper::toDomain);
    }

    @Transactional
    public Document attachSignedXml(String tenantId, Document document, String blobKey) {
        requireOwner(tenantId, document.getTenantId(), "document " + document.getDocumentNumber());
        requireOwnedKey(tenantId, blobKey);

        DocumentEntity entity = load(tenantId, document.getDocumentNumber());
        entity.attachSignedXml(blobKey);
        return documentMapper.toDomain(documentRepository.save(entity));
    }

    @Transactional
    public Document attachReceipt(String tenantId, Document document, DocumentReceipt receipt) {
        requireOwner(tenantId, document.getTenantId(), "document " + document.getDocumentNumber());
        if (receipt.getBodyKey() != null) {
            requireOwnedKey(tenantId, receipt.getBodyKey());
        }

        DocumentEntity entity = load(tenantId, document.getDocumentNumber());
        entity.attachReceipt(receipt.getResponseCode(), receipt.getMessage(), receipt.getTicket(),
            receipt.getReceivedAt(), receipt.getBodyKey());
        return documentMapper.toDomain(documentRepository.save(entity));
    }

    /**
     * Moves a document from {@code from} to {@code to} if, and only if, it is
     * still in {@code from}. A same-state request is a no-op.
     *
     * @throws IllegalStateException if the transition is not allowed or the
     *         document is no longer in the expected state
     */
    @Transactional
    public Document transitionState(String tenantId, Document document, DocumentState from, DocumentState to) {
        String documentNumber = document.getDocumentNumber();
        requireOwner(tenantId, document.getTenantId(), "document " + documentNumber);

        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException(
                String.format("Cannot move document %s from %s to %s.", documentNumber, from, to));
        }
        if (from == to) {
            return getDocument(tenantId, documentNumber);
        }

        int updated = documentRepository.transitionState(tenantId, documentNumber, from, to, Instant.now(clock));
        if (updated == 0) {
            Document current = getDocument(tenantId, documentNumber);
            throw new IllegalStateException(
                String.format("Document %s is %s, expected %s.", documentNumber, current.getState(), from));
        }

        Document changed = getDocument(tenantId, documentNumber);
        outboxService.saveEvent(DocumentStateChangedEvent.fromTransition(changed, from, to));

        log.info("Document {} moved {} -> {} (tenant {})", documentNumber, from, to, tenantId);
        return changed;
    }

    /**
     * Persists the transmission error log and returns a SUBMITTED document to
     * PENDING so it can be re-driven.
     */
    @Transactional
    public Document recordTransmissionFailure(String tenantId, Document document, List<TransmissionError> errors) {
        String documentNumber = document.getDocumentNumber();
        requireOwner(tenantId, document.getTenantId(), "document " + documentNumber);

        DocumentEntity entity = load(tenantId, documentNumber);
        entity.recordTransmissionErrors(documentMapper.writeErrors(errors));
        Document current = documentMapper.toDomain(documentRepository.save(entity));

        if (current.getState() == DocumentState.SUBMITTED) {
            return transitionState(tenantId, current, DocumentState.SUBMITTED, DocumentState.PENDING);
        }
        return current;
    }

    // ---------------------------------------------------------------------
    // Blobs
    // ---------------------------------------------------------------------

    @Transactional
    public void putBlob(String tenantId, String key, byte[] content, String contentType) {
        requireOwnedKey(tenantId, key);

        BlobEntity blob = blobRepository.findById(key)
            .map(existing -> {
                existing.replaceContent(content, contentType);
                return existing;
            })
            .orElseGet(() -> BlobEntity.create(tenantId, key, content, contentType));
        blobRepository.save(blob);

        log.debug("Stored blob {} ({} bytes)", key, content.length);
    }

    /**
     * Returns the blob content, or empty when it does not exist or lies outside
     * the tenant's prefix.
     */
    @Transactional(readOnly = true)
    public Optional<byte[]> getBlob(String tenantId, String key) {
        if (!BlobKeys.belongsTo(tenantId, key)) {
            log.warn("Tenant {} requested blob outside its prefix: {}", tenantId, key);
            metrics.recordOwnershipViolation("blob_read");
            return Optional.empty();
        }
        return blobRepository.findById(key)
            .filter(blob -> blob.getTenantId().equals(tenantId))
            .map(BlobEntity::getContent);
    }

    @Transactional
    public void deleteBlob(String tenantId, String key) {
        requireOwnedKey(tenantId, key);
        blobRepository.findById(key).ifPresent(blobRepository::delete);
    }

    /**
     * Lists keys under a prefix, which must itself lie inside the tenant's space.
     */
    @Transactional(readOnly = true)
    public List<String> listBlobs(String tenantId, String prefix) {
        requireOwnedKey(tenantId, prefix);
        return blobRepository.findKeys(tenantId, escapeLike(prefix) + "%");
    }

    // ---------------------------------------------------------------------

    private DocumentEntity load(String tenantId, String documentNumber) {
        return documentRepository.findByTenantIdAndDocumentNumber(tenantId, documentNumber)
            .orElseThrow(() -> new NotFoundException(DOCUMENT, documentNumber));
    }

    private void requireOwner(String tenantId, String ownerTenantId, String resource) {
        if (tenantId == null || !tenantId.equals(ownerTenantId)) {
            log.warn("Ownership violation: tenant {} attempted to modify {} owned by {}",
                tenantId, resource, ownerTenantId);
            metrics.recordOwnershipViolation(DOCUMENT.toLowerCase());
            throw new OwnershipViolationException(tenantId, ownerTenantId, resource);
        }
    }

    private void requireOwnedKey(String tenantId, String key) {
        if (!BlobKeys.belongsTo(tenantId, key)) {
            String owner = key != null && key.contains("/") ? key.substring(0, key.indexOf('/')) : "unknown";
            log.warn("Ownership violation: tenant {} attempted to write blob {} owned by {}",
                tenantId, key, owner);
            metrics.recordOwnershipViolation("blob");
            throw new OwnershipViolationException(tenantId, owner, "blob " + key);
        }
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
