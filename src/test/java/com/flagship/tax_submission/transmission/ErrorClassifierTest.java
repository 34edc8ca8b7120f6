package com.flagship.tax_submission.transmission;

import com.flagship.tax_submission.exception.AuthorityProtocolException;
import com.flagship.tax_submission.exception.TransientTransportException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier(
        List.of("timeout", "timed out", "econnrefused", "econnreset", "network", "service unavailable", "503", "504"),
        List.of("unauthorized", "401", "forbidden", "403", "not found", "404", "bad request", "400", "invalid",
            "already accepted"));

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Messages are matched case-insensitively against the tables")
    void testMessageClassification() {
        printTestHeader("Message Classification");

        assertEquals(ErrorClass.RECOVERABLE, classifier.classify("Connection TIMED OUT after 30s"));
        assertEquals(ErrorClass.RECOVERABLE, classifier.classify("connect ECONNREFUSED 10.0.0.1:443"));
        assertEquals(ErrorClass.RECOVERABLE, classifier.classify("HTTP 503 Service Unavailable"));
        assertEquals(ErrorClass.NON_RECOVERABLE, classifier.classify("401 Unauthorized"));
        assertEquals(ErrorClass.NON_RECOVERABLE, classifier.classify("Document already accepted"));
        assertEquals(ErrorClass.UNCLASSIFIED, classifier.classify("Something odd happened"));
        printSuccess("Messages classified");
    }

    @Test
    @DisplayName("The deny table wins when both tables match")
    void testDenyTableFirst() {
        assertEquals(ErrorClass.NON_RECOVERABLE, classifier.classify("Invalid payload, network retry pointless"));
    }

    @Test
    @DisplayName("Terms match on word boundaries only")
    void testWordBoundaries() {
        assertEquals(ErrorClass.UNCLASSIFIED, classifier.classify("Batch 5030 processed"));
        assertEquals(ErrorClass.UNCLASSIFIED, classifier.classify("Networking stack restarted"));
        assertEquals(ErrorClass.RECOVERABLE, classifier.classify("upstream returned 504"));
    }

    @Test
    @DisplayName("Empty messages are unclassified")
    void testEmptyMessage() {
        assertEquals(ErrorClass.UNCLASSIFIED, classifier.classify((String) null));
        assertEquals(ErrorClass.UNCLASSIFIED, classifier.classify("  "));
        assertEquals(ErrorClass.UNCLASSIFIED, classifier.classify(new IllegalStateException()));
    }

    @Test
    @DisplayName("A failure tag anywhere in the cause chain overrides the message")
    void testTagsWin() {
        printTestHeader("Tags Override Messages");

        TransientTransportException timeout =
            new TransientTransportException(FailureTag.TIMEOUT, "invalid socket state", null);
        assertEquals(ErrorClass.RECOVERABLE, classifier.classify(timeout));

        RuntimeException wrapped = new RuntimeException("wrapper: timed out",
            new AuthorityProtocolException(FailureTag.AUTHORIZATION, "credentials refused"));
        assertEquals(ErrorClass.NON_RECOVERABLE, classifier.classify(wrapped));

        AuthorityProtocolException unknown = new AuthorityProtocolException(FailureTag.UNKNOWN, "read timed out");
        assertEquals(ErrorClass.RECOVERABLE, classifier.classify(unknown));
        printSuccess("Tags take precedence, UNKNOWN falls back to the message");
    }
}
