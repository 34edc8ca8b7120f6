package com.flagship.tax_submission.transmission;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tax_submission.document.Receipt;
import com.flagship.tax_submission.exception.AuthorityProtocolException;
import com.flagship.tax_submission.exception.TransientTransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.time.Clock;
import java.util.Base64;
import java.util.List;

/**
 * {@link AuthorityClient} that talks JSON to the authority gateway over HTTP.
 *
 * Endpoints:
 * - POST /submissions: {file_name, content (base64 zip)}
 * - GET /submissions/{ticket}: status of an asynchronously processed submission
 *
 * Both answer {response_code, message, ticket, body (base64)}. The tenant's
 * credentials travel as HTTP Basic authentication.
 */
@Component
@Slf4j
public class GatewayAuthorityClient implements AuthorityClient {

    static final String SUBMISSIONS_PATH = "/submissions";
    static final String TENANT_HEADER = "X-Tenant-Id";

    private final RestTemplate restTemplate;
    private final Clock clock;

    public GatewayAuthorityClient(@Qualifier("authorityRestTemplate") RestTemplate restTemplate, Clock clock) {
        this.restTemplate = restTemplate;
        this.clock = clock;
    }

    @Override
    public Receipt submit(String tenantId, AuthorityCredentials credentials, SubmissionArchive archive) {
        GatewaySubmission body = new GatewaySubmission(archive.getFileName(),
            Base64.getEncoder().encodeToString(archive.getContent()));

        log.debug("Sending {} to authority gateway for tenant {}", archive.getFileName(), tenantId);
        GatewayReceipt response = exchange(HttpMethod.POST, SUBMISSIONS_PATH,
            new HttpEntity<>(body, headers(tenantId, credentials)));
        return toReceipt(response, null);
    }

    @Override
    public Receipt queryStatus(String tenantId, AuthorityCredentials credentials, String ticket) {
        log.debug("Querying ticket {} for tenant {}", ticket, tenantId);
        GatewayReceipt response = exchange(HttpMethod.GET, SUBMISSIONS_PATH + "/{ticket}",
            new HttpEntity<>(headers(tenantId, credentials)), ticket);
        return toReceipt(response, ticket);
    }

    private GatewayReceipt exchange(HttpMethod method, String path, HttpEntity<?> request, Object... uriVariables) {
        try {
            ResponseEntity<GatewayReceipt> response =
                restTemplate.exchange(path, method, request, GatewayReceipt.class, uriVariables);
            if (response.getBody() == null || response.getBody().responseCode() == null) {
                throw new AuthorityProtocolException(FailureTag.UNKNOWN, "Authority gateway returned an empty response");
            }
            return response.getBody();

        } catch (HttpStatusCodeException e) {
            throw translate(e);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new TransientTransportException(FailureTag.TIMEOUT,
                    "Authority gateway timed out: " + e.getMessage(), e);
            }
            throw new TransientTransportException(FailureTag.CONNECTION_FAILURE,
                "Authority gateway unreachable: " + e.getMessage(), e);
        }
    }

    /**
     * Maps gateway HTTP errors onto tagged failures. Unrecognised statuses pass through.
     */
    static RuntimeException translate(HttpStatusCodeException e) {
        int status = e.getStatusCode().value();
        String message = "Authority gateway returned " + status + ": " + e.getResponseBodyAsString();

        switch (status) {
            case 502:
            case 503:
                return new TransientTransportException(FailureTag.SERVICE_UNAVAILABLE, message, e);
            case 504:
                return new TransientTransportException(FailureTag.TIMEOUT, message, e);
            case 401:
            case 403:
                return new AuthorityProtocolException(FailureTag.AUTHORIZATION, message, e);
            case 400:
            case 422:
                return new AuthorityProtocolException(FailureTag.INVALID_REQUEST, message, e);
            case 409:
                return new AuthorityProtocolException(FailureTag.DUPLICATE_SUBMISSION, message, e);
            default:
                return e;
        }
    }

    private Receipt toReceipt(GatewayReceipt response, String requestedTicket) {
        byte[] rawBody = response.body() != null ? Base64.getDecoder().decode(response.body()) : null;
        String code = response.responseCode().trim();
        String ticket = response.ticket() != null && !response.ticket().isBlank() ? response.ticket() : requestedTicket;
        if ((Receipt.TICKET.equals(code) || Receipt.PROCESSING.equals(code)) && (ticket == null || ticket.isBlank())) {
            throw new AuthorityProtocolException(FailureTag.UNKNOWN,
                "Authority gateway returned " + code + " without a ticket");
        }
        return new Receipt(code, response.message(), ticket, rawBody, clock.instant());
    }

    private static HttpHeaders headers(String tenantId, AuthorityCredentials credentials) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBasicAuth(credentials.getUsername(), credentials.getPassword());
        headers.set(TENANT_HEADER, tenantId);
        return headers;
    }

    record GatewaySubmission(@JsonProperty("file_name") String fileName,
                             @JsonProperty("content") String content) {}

    record GatewayReceipt(@JsonProperty("response_code") String responseCode,
                          @JsonProperty("message") String message,
                          @JsonProperty("ticket") String ticket,
                          @JsonProperty("body") String body) {}
}
