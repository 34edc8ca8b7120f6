package com.flagship.tax_submission.document;

import com.flagship.tax_submission.TestDocuments;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Document lifecycle rules:
 * - PENDING -> SUBMITTED -> ACCEPTED | REJECTED | PENDING
 * - ACCEPTED and REJECTED are terminal
 * - Totals derive from the lines
 */
class DocumentTest {

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Issued document starts PENDING with totals derived from its lines")
    void testIssue() {
        printTestHeader("Issue Document");

        Document document = TestDocuments.invoice(TestDocuments.TENANT_A, "F001-00000001", DocumentState.PENDING);

        printOutput("State", document.getState());
        printOutput("Totals", document.getTotals());

        assertEquals(DocumentState.PENDING, document.getState());
        assertEquals(new BigDecimal("100.00"), document.getTotals().getSubtotal());
        assertEquals(new BigDecimal("18.00"), document.getTotals().getTax());
        assertEquals(new BigDecimal("118.00"), document.getTotals().getTotal());
        assertFalse(document.isSigned());
        assertFalse(document.isAwaitingRedrive());
        printSuccess("Document issued as PENDING");
    }

    @Test
    @DisplayName("Allowed transitions follow the lifecycle")
    void testAllowedTransitions() {
        printTestHeader("Allowed Transitions");

        assertTrue(DocumentState.PENDING.canTransitionTo(DocumentState.SUBMITTED));
        assertTrue(DocumentState.SUBMITTED.canTransitionTo(DocumentState.ACCEPTED));
        assertTrue(DocumentState.SUBMITTED.canTransitionTo(DocumentState.REJECTED));
        assertTrue(DocumentState.SUBMITTED.canTransitionTo(DocumentState.PENDING));
        assertTrue(DocumentState.SUBMITTED.canTransitionTo(DocumentState.SUBMITTED));
        printSuccess("All lifecycle edges allowed");
    }

    @Test
    @DisplayName("Terminal states and skipped steps are rejected")
    void testForbiddenTransitions() {
        printTestHeader("Forbidden Transitions");

        assertFalse(DocumentState.PENDING.canTransitionTo(DocumentState.ACCEPTED));
        assertFalse(DocumentState.PENDING.canTransitionTo(DocumentState.REJECTED));
        for (DocumentState target : List.of(DocumentState.PENDING, DocumentState.SUBMITTED)) {
            assertFalse(DocumentState.ACCEPTED.canTransitionTo(target));
            assertFalse(DocumentState.REJECTED.canTransitionTo(target));
        }
        assertTrue(DocumentState.ACCEPTED.isTerminal());
        assertTrue(DocumentState.REJECTED.isTerminal());
        printSuccess("Invalid transitions rejected");
    }

    @Test
    @DisplayName("A PENDING document with transmission errors awaits re-drive")
    void testAwaitingRedrive() {
        printTestHeader("Awaiting Re-drive");

        Document failed = TestDocuments.invoice(TestDocuments.TENANT_A, "F001-00000001", DocumentState.PENDING)
            .withTransmissionErrors(List.of(new TransmissionError(Instant.now(), 1, "timeout", 0, "RECOVERABLE")));

        assertTrue(failed.isAwaitingRedrive());
        assertFalse(failed.toBuilder().state(DocumentState.SUBMITTED).build().isAwaitingRedrive());
        printSuccess("Re-drive eligibility computed from state and error log");
    }

    @Test
    @DisplayName("Rejection reason is exposed only for REJECTED documents")
    void testRejectionReason() {
        printTestHeader("Rejection Reason");

        DocumentReceipt receipt = TestDocuments.receiptFor("2335", "El documento electronico ingresado ha sido alterado");
        Document rejected = TestDocuments.invoice(TestDocuments.TENANT_A, "F001-00000001", DocumentState.REJECTED)
            .withReceipt(receipt);
        Document accepted = rejected.toBuilder().state(DocumentState.ACCEPTED).build();

        printOutput("Reason", rejected.rejectionReason());
        assertEquals(receipt.getMessage(), rejected.rejectionReason());
        assertNull(accepted.rejectionReason());
        printSuccess("Rejection reason present only when rejected");
    }

    @Test
    @DisplayName("A document is signed once")
    void testSignedOnce() {
        printTestHeader("Signed Once");

        Document signed = TestDocuments.invoice(TestDocuments.TENANT_A, "F001-00000001", DocumentState.PENDING)
            .withSignedXml("20123456789/xml/signed-F001-00000001.xml");

        assertTrue(signed.isSigned());
        assertEquals(signed.getSignedXmlKey(), signed.withSignedXml(signed.getSignedXmlKey()).getSignedXmlKey());
        assertThrows(IllegalStateException.class, () -> signed.withSignedXml("20123456789/xml/other.xml"));
        printSuccess("Second signature with another key rejected");
    }
}
