package com.flagship.tax_submission.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flagship.tax_submission.TestDocuments;
import com.flagship.tax_submission.document.Document;
import com.flagship.tax_submission.document.DocumentState;
import com.flagship.tax_submission.document.TransmissionError;
import com.flagship.tax_submission.document.event.DocumentIssuedEvent;
import com.flagship.tax_submission.document.event.DocumentStateChangedEvent;
import com.flagship.tax_submission.exception.NotFoundException;
import com.flagship.tax_submission.exception.OwnershipViolationException;
import com.flagship.tax_submission.observability.SubmissionMetrics;
import com.flagship.tax_submission.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for TenantIsolatedStore.
 *
 * These tests verify that:
 * - Writes naming a tenant other than the record's owner are refused
 * - Blob keys outside the tenant's prefix are neither written nor read
 * - State changes are conditional and emit lifecycle events
 */
@ExtendWith(MockitoExtension.class)
class TenantIsolatedStoreTest {

    private static final String TENANT_A = TestDocuments.TENANT_A;
    private static final String TENANT_B = TestDocuments.TENANT_B;
    private static final String NUMBER = "F001-00000001";

    @Mock
    private DocumentRepository documentRepository;

    @Mock
    private BlobRepository blobRepository;

    @Mock
    private OutboxService outboxService;

    @Mock
    private SubmissionMetrics metrics;

    private DocumentMapper mapper;
    private TenantIsolatedStore store;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printExpectedException(Exception e) {
        System.out.println("EXPECTED EXCEPTION: " + e.getClass().getSimpleName() + " - " + e.getMessage());
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        mapper = new DocumentMapper(new ObjectMapper().registerModule(new JavaTimeModule()));
        store = new TenantIsolatedStore(documentRepository, blobRepository, mapper, outboxService, metrics,
            Clock.fixed(TestDocuments.ISSUED_AT, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Saving a document writes it and its DocumentIssued event")
    void testSaveDocument() {
        Document document = TestDocuments.invoice(TENANT_A, NUMBER, DocumentState.PENDING);
        when(documentRepository.save(any(DocumentEntity.class))).thenAnswer(i -> i.getArgument(0));

        Document saved = store.saveDocument(TENANT_A, document, "key-1");

        assertEquals(NUMBER, saved.getDocumentNumber());
        assertEquals(document.getItems(), saved.getItems());
        assertEquals(document.getIssuer(), saved.getIssuer());
        verify(outboxService).saveEvent(any(DocumentIssuedEvent.class));
    }

    @Test
    @DisplayName("Tenant B cannot save or update tenant A's document")
    void testCrossTenantWrites() {
        printTestHeader("Cross-Tenant Writes");

        Document owned = TestDocuments.invoice(TENANT_A, NUMBER, DocumentState.PENDING);

        OwnershipViolationException e = assertThrows(OwnershipViolationException.class,
            () -> store.saveDocument(TENANT_B, owned, null));
        printExpectedException(e);
        assertThrows(OwnershipViolationException.class,
            () -> store.transitionState(TENANT_B, owned, DocumentState.PENDING, DocumentState.SUBMITTED));
        assertThrows(OwnershipViolationException.class,
            () -> store.attachSignedXml(TENANT_B, owned, TENANT_B + "/xml/signed-" + NUMBER + ".xml"));
        assertThrows(OwnershipViolationException.class,
            () -> store.recordTransmissionFailure(TENANT_B, owned, List.of()));

        verify(documentRepository, never()).save(any());
        verify(documentRepository, never()).transitionState(anyString(), anyString(), any(), any(), any());
        printSuccess("Every cross-tenant write refused");
    }

    @Test
    @DisplayName("Blob keys outside the tenant's prefix are refused on write and hidden on read")
    void testBlobPrefixIsolation() {
        printTestHeader("Blob Prefix Isolation");

        String foreignKey = TENANT_A + "/xml/signed-" + NUMBER + ".xml";

        assertThrows(OwnershipViolationException.class,
            () -> store.putBlob(TENANT_B, foreignKey, new byte[]{1}, "application/xml"));
        assertThrows(OwnershipViolationException.class, () -> store.deleteBlob(TENANT_B, foreignKey));
        assertThrows(OwnershipViolationException.class, () -> store.listBlobs(TENANT_B, TENANT_A + "/"));
        assertTrue(store.getBlob(TENANT_B, foreignKey).isEmpty());

        verify(blobRepository, never()).save(any());
        verify(blobRepository, never()).findById(anyString());
        verify(metrics).recordOwnershipViolation("blob_read");
        printSuccess("Foreign blob keys refused");
    }

    @Test
    @DisplayName("Another tenant's document number is simply not found")
    void testCrossTenantRead() {
        when(documentRepository.findByTenantIdAndDocumentNumber(TENANT_B, NUMBER)).thenReturn(Optional.empty());

        assertTrue(store.findDocument(TENANT_B, NUMBER).isEmpty());
        assertThrows(NotFoundException.class, () -> store.getDocument(TENANT_B, NUMBER));
    }

    @Test
    @DisplayName("Writing a blob under the tenant's own prefix stores it")
    void testPutBlob() {
        String key = TENANT_A + "/receipts/receipt-" + NUMBER + ".xml";
        when(blobRepository.findById(key)).thenReturn(Optional.empty());

        store.putBlob(TENANT_A, key, new byte[]{1, 2, 3}, "application/xml");

        verify(blobRepository).save(any(BlobEntity.class));
    }

    @Test
    @DisplayName("Listing escapes LIKE wildcards in the prefix")
    void testListBlobsEscapesPrefix() {
        when(blobRepository.findKeys(TENANT_A, TENANT_A + "/xml/RA\\_%")).thenReturn(List.of());

        assertTrue(store.listBlobs(TENANT_A, TENANT_A + "/xml/RA_").isEmpty());
    }

    @Test
    @DisplayName("A forbidden transition fails before touching the database")
    void testForbiddenTransition() {
        Document accepted = TestDocuments.invoice(TENANT_A, NUMBER, DocumentState.ACCEPTED);

        assertThrows(IllegalStateException.class,
            () -> store.transitionState(TENANT_A, accepted, DocumentState.ACCEPTED, DocumentState.PENDING));
        verify(documentRepository, never()).transitionState(anyString(), anyString(), any(), any(), any());
    }

    @Test
    @DisplayName("A transition that loses the race reports the current state")
    void testStaleTransition() {
        printTestHeader("Stale Transition");

        Document pending = TestDocuments.invoice(TENANT_A, NUMBER, DocumentState.PENDING);
        Document alreadySubmitted = pending.toBuilder().state(DocumentState.SUBMITTED).build();
        when(documentRepository.transitionState(eq(TENANT_A), eq(NUMBER), eq(DocumentState.PENDING),
            eq(DocumentState.SUBMITTED), any())).thenReturn(0);
        when(documentRepository.findByTenantIdAndDocumentNumber(TENANT_A, NUMBER))
            .thenReturn(Optional.of(mapper.toEntity(alreadySubmitted, null)));

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> store.transitionState(TENANT_A, pending, DocumentState.PENDING, DocumentState.SUBMITTED));
        printExpectedException(e);

        assertTrue(e.getMessage().contains("SUBMITTED"));
        verify(outboxService, never()).saveEvent(any());
        printSuccess("Conditional update enforced");
    }

    @Test
    @DisplayName("A successful transition emits DocumentStateChanged")
    void testTransitionEmitsEvent() {
        Document pending = TestDocuments.invoice(TENANT_A, NUMBER, DocumentState.PENDING);
        when(documentRepository.transitionState(eq(TENANT_A), eq(NUMBER), eq(DocumentState.PENDING),
            eq(DocumentState.SUBMITTED), any())).thenReturn(1);
        when(documentRepository.findByTenantIdAndDocumentNumber(TENANT_A, NUMBER))
            .thenReturn(Optional.of(mapper.toEntity(pending.toBuilder().state(DocumentState.SUBMITTED).build(), null)));

        Document changed = store.transitionState(TENANT_A, pending, DocumentState.PENDING, DocumentState.SUBMITTED);

        assertEquals(DocumentState.SUBMITTED, changed.getState());
        verify(outboxService).saveEvent(any(DocumentStateChangedEvent.class));
    }

    @Test
    @DisplayName("Recording a transmission failure returns a SUBMITTED document to PENDING")
    void testRecordTransmissionFailure() {
        Document submitted = TestDocuments.invoice(TENANT_A, NUMBER, DocumentState.SUBMITTED);
        when(documentRepository.findByTenantIdAndDocumentNumber(TENANT_A, NUMBER))
            .thenReturn(Optional.of(mapper.toEntity(submitted, null)));
        when(documentRepository.save(any(DocumentEntity.class))).thenAnswer(i -> i.getArgument(0));
        when(documentRepository.transitionState(eq(TENANT_A), eq(NUMBER), eq(DocumentState.SUBMITTED),
            eq(DocumentState.PENDING), any())).thenReturn(1);

        List<TransmissionError> errors = List.of(
            new TransmissionError(TestDocuments.ISSUED_AT, 1, "Read timed out", 0, "RECOVERABLE"));
        store.recordTransmissionFailure(TENANT_A, submitted, errors);

        verify(documentRepository).transitionState(eq(TENANT_A), eq(NUMBER), eq(DocumentState.SUBMITTED),
            eq(DocumentState.PENDING), any());
        verify(outboxService).saveEvent(any(DocumentStateChangedEvent.class));
    }
}
