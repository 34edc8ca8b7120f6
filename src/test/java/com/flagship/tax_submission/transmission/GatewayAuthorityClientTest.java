package com.flagship.tax_submission.transmission;

import com.flagship.tax_submission.TestDocuments;
import com.flagship.tax_submission.document.DocumentState;
import com.flagship.tax_submission.document.Receipt;
import com.flagship.tax_submission.exception.AuthorityProtocolException;
import com.flagship.tax_submission.exception.TransientTransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Wire-level tests for the authority gateway client.
 */
class GatewayAuthorityClientTest {

    private static final String BASE_URL = "http://gateway.test";
    private static final String TENANT = TestDocuments.TENANT_A;
    private static final AuthorityCredentials CREDENTIALS = new AuthorityCredentials("MODDATOS", "s3cret");

    private MockRestServiceServer server;
    private GatewayAuthorityClient client;
    private SubmissionArchive archive;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri(BASE_URL).build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new GatewayAuthorityClient(restTemplate, Clock.fixed(TestDocuments.ISSUED_AT, ZoneOffset.UTC));
        archive = SubmissionArchive.of(
            TestDocuments.receipt(TENANT, "B001-00000001", DocumentState.PENDING), "<Invoice/>");
    }

    @Test
    @DisplayName("Submit posts the zip with basic auth and maps the receipt")
    void testSubmit() {
        printTestHeader("Submit To Gateway");

        String body = Base64.getEncoder().encodeToString("<ApplicationResponse/>".getBytes(StandardCharsets.UTF_8));
        String expectedAuth = "Basic " + Base64.getEncoder()
            .encodeToString("MODDATOS:s3cret".getBytes(StandardCharsets.UTF_8));

        server.expect(requestTo(BASE_URL + "/submissions"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header("Authorization", expectedAuth))
            .andExpect(header(GatewayAuthorityClient.TENANT_HEADER, TENANT))
            .andExpect(jsonPath("$.file_name").value(TENANT + "-03-B001-00000001.zip"))
            .andExpect(jsonPath("$.content").value(Base64.getEncoder().encodeToString(archive.getContent())))
            .andRespond(withSuccess("{\"response_code\":\" 0 \",\"message\":\"Aceptada\",\"body\":\"" + body + "\"}",
                MediaType.APPLICATION_JSON));

        Receipt receipt = client.submit(TENANT, CREDENTIALS, archive);

        server.verify();
        assertEquals("0", receipt.getResponseCode());
        assertEquals("Aceptada", receipt.getMessage());
        assertNull(receipt.getTicket());
        assertEquals("<ApplicationResponse/>", new String(receipt.getRawBody(), StandardCharsets.UTF_8));
        assertEquals(TestDocuments.ISSUED_AT, receipt.getReceivedAt());
        printSuccess("Request and receipt mapped");
    }

    @Test
    @DisplayName("Status query keeps the requested ticket when the gateway omits it")
    void testQueryStatus() {
        server.expect(requestTo(BASE_URL + "/submissions/T-123"))
            .andExpect(method(HttpMethod.GET))
            .andRespond(withSuccess("{\"response_code\":\"PROCESSING\",\"message\":\"En proceso\"}",
                MediaType.APPLICATION_JSON));

        Receipt receipt = client.queryStatus(TENANT, CREDENTIALS, "T-123");

        assertEquals(Receipt.PROCESSING, receipt.getResponseCode());
        assertEquals("T-123", receipt.getTicket());
        assertFalse(receipt.hasBody());
    }

    @Test
    @DisplayName("A TICKET or PROCESSING receipt without a ticket is a protocol error")
    void testTicketCodeWithoutTicket() {
        printTestHeader("Ticket Code Without Ticket");

        server.expect(requestTo(BASE_URL + "/submissions"))
            .andRespond(withSuccess("{\"response_code\":\"TICKET\",\"message\":\"Recibido\"}",
                MediaType.APPLICATION_JSON));
        AuthorityProtocolException missing = assertThrows(AuthorityProtocolException.class,
            () -> client.submit(TENANT, CREDENTIALS, archive));
        assertEquals(FailureTag.UNKNOWN, missing.getTag());
        assertTrue(missing.getMessage().contains("TICKET"));

        server.reset();
        server.expect(requestTo(BASE_URL + "/submissions"))
            .andRespond(withSuccess("{\"response_code\":\"PROCESSING\",\"ticket\":\"  \"}",
                MediaType.APPLICATION_JSON));
        assertThrows(AuthorityProtocolException.class, () -> client.submit(TENANT, CREDENTIALS, archive));

        server.reset();
        server.expect(requestTo(BASE_URL + "/submissions"))
            .andRespond(withSuccess("{\"response_code\":\"TICKET\",\"ticket\":\"T-9\"}",
                MediaType.APPLICATION_JSON));
        assertEquals("T-9", client.submit(TENANT, CREDENTIALS, archive).getTicket());
        printSuccess("Ticket codes require a ticket to poll");
    }

    @Test
    @DisplayName("A response without a code is a protocol error")
    void testEmptyResponse() {
        server.expect(requestTo(BASE_URL + "/submissions"))
            .andRespond(withSuccess("{\"message\":\"??\"}", MediaType.APPLICATION_JSON));

        AuthorityProtocolException e = assertThrows(AuthorityProtocolException.class,
            () -> client.submit(TENANT, CREDENTIALS, archive));
        assertEquals(FailureTag.UNKNOWN, e.getTag());
    }

    @Test
    @DisplayName("Gateway HTTP errors map onto failure tags")
    void testHttpErrorTranslation() {
        printTestHeader("HTTP Error Translation");

        assertTag(HttpStatus.SERVICE_UNAVAILABLE, TransientTransportException.class, FailureTag.SERVICE_UNAVAILABLE);
        assertTag(HttpStatus.GATEWAY_TIMEOUT, TransientTransportException.class, FailureTag.TIMEOUT);
        assertTag(HttpStatus.UNAUTHORIZED, AuthorityProtocolException.class, FailureTag.AUTHORIZATION);
        assertTag(HttpStatus.BAD_REQUEST, AuthorityProtocolException.class, FailureTag.INVALID_REQUEST);
        assertTag(HttpStatus.CONFLICT, AuthorityProtocolException.class, FailureTag.DUPLICATE_SUBMISSION);
        printSuccess("Statuses translated");
    }

    private void assertTag(HttpStatus status, Class<? extends RuntimeException> type, FailureTag tag) {
        server.reset();
        server.expect(requestTo(BASE_URL + "/submissions")).andRespond(withStatus(status));

        RuntimeException e = assertThrows(type, () -> client.submit(TENANT, CREDENTIALS, archive));
        assertEquals(tag, ((TaggedFailure) e).getTag());
    }

    @Test
    @DisplayName("Unrecognised server errors pass through untouched")
    void testUnmappedStatus() {
        server.expect(requestTo(BASE_URL + "/submissions")).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        assertThrows(HttpServerErrorException.class, () -> client.submit(TENANT, CREDENTIALS, archive));
    }

    @Test
    @DisplayName("Socket timeouts and refused connections are transient")
    void testTransportFailures() {
        server.expect(requestTo(BASE_URL + "/submissions"))
            .andRespond(withException(new SocketTimeoutException("Read timed out")));
        TransientTransportException timeout = assertThrows(TransientTransportException.class,
            () -> client.submit(TENANT, CREDENTIALS, archive));
        assertTrue(timeout.isTimeout());

        server.reset();
        server.expect(requestTo(BASE_URL + "/submissions"))
            .andRespond(withException(new ConnectException("Connection refused")));
        TransientTransportException refused = assertThrows(TransientTransportException.class,
            () -> client.submit(TENANT, CREDENTIALS, archive));
        assertEquals(FailureTag.CONNECTION_FAILURE, refused.getTag());
    }
}
