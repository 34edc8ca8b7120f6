package com.flagship.tax_submission.voiding;

import com.flagship.tax_submission.TestDocuments;
import com.flagship.tax_submission.document.Document;
import com.flagship.tax_submission.document.DocumentKind;
import com.flagship.tax_submission.document.DocumentState;
import com.flagship.tax_submission.document.LineItem;
import com.flagship.tax_submission.exception.DocumentNotVoidableException;
import com.flagship.tax_submission.exception.InputValidationException;
import com.flagship.tax_submission.exception.NotFoundException;
import com.flagship.tax_submission.generation.DocumentGenerator;
import com.flagship.tax_submission.generation.DocumentPayload;
import com.flagship.tax_submission.sequence.SequenceCounter;
import com.flagship.tax_submission.store.TenantIsolatedStore;
import com.flagship.tax_submission.tenant.TenantService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
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
 * Unit tests for VoidingService.
 *
 * These tests verify that:
 * - Credit notes are issued only against ACCEPTED invoices
 * - Void communications cover ACCEPTED receipts only and are numbered per day
 * - Nothing is reserved or stored when the request is refused
 */
@ExtendWith(MockitoExtension.class)
class VoidingServiceTest {

    private static final String TENANT = TestDocuments.TENANT_A;
    private static final Clock CLOCK = Clock.fixed(TestDocuments.ISSUED_AT, ZoneId.of("America/Lima"));
    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);

    @Mock
    private TenantService tenantService;

    @Mock
    private TenantIsolatedStore store;

    @Mock
    private DocumentGenerator documentGenerator;

    @Mock
    private SequenceCounter sequenceCounter;

    private VoidingService service;

    @BeforeEach
    void setUp() {
        service = new VoidingService(tenantService, store, documentGenerator, sequenceCounter,
            new VoidCommunicationXmlWriter(), CLOCK);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printExpectedException(Exception e) {
        System.out.println("EXPECTED EXCEPTION: " + e.getClass().getSimpleName() + " - " + e.getMessage());
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("A credit note copies recipient, currency and items from the accepted invoice")
    void testCreditNoteFromInvoice() {
        printTestHeader("Credit Note From Invoice");

        Document invoice = TestDocuments.invoice(TENANT, "F001-00000010", DocumentState.ACCEPTED);
        Document creditNote = TestDocuments.document(TENANT, DocumentKind.CREDIT_NOTE, "NC01", "NC01-00000001",
            invoice.getRecipient(), DocumentState.PENDING);
        when(tenantService.requireActive(TENANT)).thenReturn(TestDocuments.tenant(TENANT));
        when(store.getDocument(TENANT, "F001-00000010")).thenReturn(invoice);
        when(documentGenerator.generate(eq(TENANT), eq(DocumentKind.CREDIT_NOTE), any(DocumentPayload.class)))
            .thenReturn(creditNote);

        Document result = service.issueCreditNote(TENANT, "F001-00000010",
            new CreditNoteRequest("01", "Anulacion de la operacion", null, null));
        printOutput("Credit note", result.getDocumentNumber());

        ArgumentCaptor<DocumentPayload> payload = ArgumentCaptor.forClass(DocumentPayload.class);
        verify(documentGenerator).generate(eq(TENANT), eq(DocumentKind.CREDIT_NOTE), payload.capture());
        printOutput("Payload", payload.getValue());

        assertEquals("NC01-00000001", result.getDocumentNumber());
        assertEquals("F001-00000010", payload.getValue().getReferencedNumber());
        assertEquals("01", payload.getValue().getReasonCode());
        assertEquals("Anulacion de la operacion", payload.getValue().getReferenceDescription());
        assertEquals("PEN", payload.getValue().getCurrency());
        assertEquals(invoice.getRecipient(), payload.getValue().getRecipient());
        assertEquals(invoice.getItems(), payload.getValue().getItems());

        printSuccess("Credit note issued from invoice content");
    }

    @Test
    @DisplayName("Items given on the request replace the invoice's items")
    void testCreditNotePartialItems() {
        printTestHeader("Credit Note Partial Items");

        Document invoice = TestDocuments.invoice(TENANT, "F001-00000010", DocumentState.ACCEPTED);
        List<LineItem> partial = List.of(TestDocuments.vatLine("Devolucion parcial", "1", "20.00"));
        when(tenantService.requireActive(TENANT)).thenReturn(TestDocuments.tenant(TENANT));
        when(store.getDocument(TENANT, "F001-00000010")).thenReturn(invoice);
        when(documentGenerator.generate(eq(TENANT), eq(DocumentKind.CREDIT_NOTE), any(DocumentPayload.class)))
            .thenReturn(invoice);

        service.issueCreditNote(TENANT, "F001-00000010",
            new CreditNoteRequest("07", "Devolucion por item", "NC02", partial));

        ArgumentCaptor<DocumentPayload> payload = ArgumentCaptor.forClass(DocumentPayload.class);
        verify(documentGenerator).generate(eq(TENANT), eq(DocumentKind.CREDIT_NOTE), payload.capture());

        assertEquals(partial, payload.getValue().getItems());
        assertEquals("NC02", payload.getValue().getSeries());

        printSuccess("Request items used");
    }

    @Test
    @DisplayName("Only ACCEPTED invoices can be credited")
    void testCreditNoteRequiresAccepted() {
        printTestHeader("Credit Note Requires Accepted");

        when(tenantService.requireActive(TENANT)).thenReturn(TestDocuments.tenant(TENANT));
        when(store.getDocument(TENANT, "F001-00000010"))
            .thenReturn(TestDocuments.invoice(TENANT, "F001-00000010", DocumentState.REJECTED));

        DocumentNotVoidableException e = assertThrows(DocumentNotVoidableException.class,
            () -> service.issueCreditNote(TENANT, "F001-00000010",
                new CreditNoteRequest("01", "Anulacion", null, null)));
        printExpectedException(e);

        assertEquals("not_voidable", e.getReason());
        verify(documentGenerator, never()).generate(anyString(), any(), any());

        printSuccess("Rejected invoice refused");
    }

    @Test
    @DisplayName("Receipts cannot be voided by credit note")
    void testCreditNoteAgainstReceipt() {
        printTestHeader("Credit Note Against Receipt");

        when(tenantService.requireActive(TENANT)).thenReturn(TestDocuments.tenant(TENANT));
        when(store.getDocument(TENANT, "B001-00000003"))
            .thenReturn(TestDocuments.receipt(TENANT, "B001-00000003", DocumentState.ACCEPTED));

        DocumentNotVoidableException e = assertThrows(DocumentNotVoidableException.class,
            () -> service.issueCreditNote(TENANT, "B001-00000003",
                new CreditNoteRequest("01", "Anulacion", null, null)));
        printExpectedException(e);

        assertTrue(e.getMessage().contains("void communication"));

        printSuccess("Receipt refused for credit note");
    }

    @Test
    @DisplayName("A void communication is numbered by day and stored under the tenant's xml space")
    void testVoidCommunication() {
        printTestHeader("Void Communication");

        when(tenantService.requireActive(TENANT)).thenReturn(TestDocuments.tenant(TENANT));
        when(store.getDocument(TENANT, "B001-00000003"))
            .thenReturn(TestDocuments.receipt(TENANT, "B001-00000003", DocumentState.ACCEPTED));
        when(store.getDocument(TENANT, "B001-00000004"))
            .thenReturn(TestDocuments.receipt(TENANT, "B001-00000004", DocumentState.ACCEPTED));
        when(sequenceCounter.next(TENANT, "RA", "RA-20240315")).thenReturn(2L);

        VoidCommunication communication = service.issueVoidCommunication(TENANT, TODAY,
            List.of("B001-00000003", " B001-00000004 "), " Error en el importe ");
        printOutput("Communication", communication);

        assertEquals("RA-20240315-2", communication.getCommunicationNumber());
        assertEquals(TENANT + "/xml/RA-20240315-2.xml", communication.getBlobKey());
        assertEquals(List.of("B001-00000003", "B001-00000004"), communication.getDocumentNumbers());
        assertEquals("Error en el importe", communication.getReason());
        assertEquals(TestDocuments.ISSUED_AT, communication.getIssuedAt());

        ArgumentCaptor<byte[]> xml = ArgumentCaptor.forClass(byte[].class);
        verify(store).putBlob(eq(TENANT), eq(communication.getBlobKey()), xml.capture(), eq("application/xml"));
        String rendered = new String(xml.getValue(), StandardCharsets.UTF_8);
        printOutput("XML length", rendered.length());

        assertTrue(rendered.contains("<cbc:ID>RA-20240315-2</cbc:ID>"));
        assertTrue(rendered.contains("<sac:DocumentNumberID>00000004</sac:DocumentNumberID>"));

        printSuccess("Void communication issued and stored");
    }

    @Test
    @DisplayName("Void communications refuse receipts that are not ACCEPTED")
    void testVoidCommunicationRequiresAccepted() {
        printTestHeader("Void Communication Requires Accepted");

        when(tenantService.requireActive(TENANT)).thenReturn(TestDocuments.tenant(TENANT));
        when(store.getDocument(TENANT, "B001-00000003"))
            .thenReturn(TestDocuments.receipt(TENANT, "B001-00000003", DocumentState.SUBMITTED));

        DocumentNotVoidableException e = assertThrows(DocumentNotVoidableException.class,
            () -> service.issueVoidCommunication(TENANT, TODAY, List.of("B001-00000003"), "Error"));
        printExpectedException(e);

        verify(sequenceCounter, never()).next(anyString(), anyString(), anyString());
        verify(store, never()).putBlob(anyString(), anyString(), any(), anyString());

        printSuccess("Submitted receipt refused");
    }

    @Test
    @DisplayName("Void communications refuse invoices")
    void testVoidCommunicationRefusesInvoice() {
        printTestHeader("Void Communication Refuses Invoice");

        when(tenantService.requireActive(TENANT)).thenReturn(TestDocuments.tenant(TENANT));
        when(store.getDocument(TENANT, "F001-00000010"))
            .thenReturn(TestDocuments.invoice(TENANT, "F001-00000010", DocumentState.ACCEPTED));

        DocumentNotVoidableException e = assertThrows(DocumentNotVoidableException.class,
            () -> service.issueVoidCommunication(TENANT, TODAY, List.of("F001-00000010"), "Error"));
        printExpectedException(e);

        assertTrue(e.getMessage().contains("credit note"));

        printSuccess("Invoice refused for void communication");
    }

    @Test
    @DisplayName("Void communication input is checked before anything is read")
    void testVoidCommunicationInput() {
        printTestHeader("Void Communication Input");

        when(tenantService.requireActive(TENANT)).thenReturn(TestDocuments.tenant(TENANT));

        InputValidationException future = assertThrows(InputValidationException.class,
            () -> service.issueVoidCommunication(TENANT, TODAY.plusDays(1), List.of("B001-00000003"), "Error"));
        printExpectedException(future);
        assertEquals("voidDate", future.getField());

        InputValidationException empty = assertThrows(InputValidationException.class,
            () -> service.issueVoidCommunication(TENANT, TODAY, List.of(), "Error"));
        assertEquals("documentNumbers", empty.getField());

        InputValidationException reason = assertThrows(InputValidationException.class,
            () -> service.issueVoidCommunication(TENANT, TODAY, List.of("B001-00000003"), " "));
        assertEquals("reason", reason.getField());

        InputValidationException malformed = assertThrows(InputValidationException.class,
            () -> service.issueVoidCommunication(TENANT, TODAY, List.of("B00100000003"), "Error"));
        assertEquals("documentNumbers[1]", malformed.getField());

        verify(store, never()).getDocument(anyString(), anyString());

        printSuccess("Input rejected up front");
    }

    @Test
    @DisplayName("A receipt listed twice is refused")
    void testVoidCommunicationDuplicate() {
        printTestHeader("Void Communication Duplicate");

        when(tenantService.requireActive(TENANT)).thenReturn(TestDocuments.tenant(TENANT));
        when(store.getDocument(TENANT, "B001-00000003"))
            .thenReturn(TestDocuments.receipt(TENANT, "B001-00000003", DocumentState.ACCEPTED));

        InputValidationException e = assertThrows(InputValidationException.class,
            () -> service.issueVoidCommunication(TENANT, TODAY,
                List.of("B001-00000003", "B001-00000003"), "Error"));
        printExpectedException(e);

        assertEquals("documentNumbers[2]", e.getField());

        printSuccess("Duplicate refused");
    }

    @Test
    @DisplayName("Stored communications are listed by number and readable back")
    void testListAndRead() {
        printTestHeader("List And Read");

        when(store.listBlobs(TENANT, TENANT + "/xml/RA-"))
            .thenReturn(List.of(TENANT + "/xml/RA-20240314-1.xml", TENANT + "/xml/RA-20240315-1.xml"));
        when(store.getBlob(TENANT, TENANT + "/xml/RA-20240315-1.xml"))
            .thenReturn(Optional.of("<VoidedDocuments/>".getBytes(StandardCharsets.UTF_8)));

        List<String> numbers = service.listVoidCommunications(TENANT);
        printOutput("Numbers", numbers);

        assertEquals(List.of("RA-20240314-1", "RA-20240315-1"), numbers);
        assertEquals("<VoidedDocuments/>",
            new String(service.getVoidCommunicationXml(TENANT, "RA-20240315-1"), StandardCharsets.UTF_8));

        printSuccess("Communications listed and read");
    }

    @Test
    @DisplayName("Reading an unknown communication is not found")
    void testReadUnknown() {
        printTestHeader("Read Unknown");

        when(store.getBlob(TENANT, TENANT + "/xml/RA-20240301-9.xml")).thenReturn(Optional.empty());

        NotFoundException e = assertThrows(NotFoundException.class,
            () -> service.getVoidCommunicationXml(TENANT, "RA-20240301-9"));
        printExpectedException(e);

        printSuccess("Unknown communication not found");
    }
}
