package com.flagship.tax_submission.submission;

import com.flagship.tax_submission.observability.CorrelationContext;
import com.flagship.tax_submission.submission.dto.StatusResponse;
import com.flagship.tax_submission.submission.dto.SubmissionResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.function.Supplier;

/**
 * REST controller for transmitting documents to the tax authority and
 * reading back their status.
 */
@RestController
@RequestMapping("/api/tenants/{tenantId}/documents/{documentNumber}")
@RequiredArgsConstructor
@Slf4j
public class SubmissionController {

    private final SubmissionService submissionService;
    private final StatusQueryService statusQueryService;

    @PostMapping("/submit")
    public ResponseEntity<SubmissionResponse> submit(@PathVariable String tenantId,
                                                     @PathVariable String documentNumber) {
        return withDocumentContext(tenantId, documentNumber, "submit",
            () -> submissionService.submit(tenantId, documentNumber));
    }

    @PostMapping("/redrive")
    public ResponseEntity<SubmissionResponse> redrive(@PathVariable String tenantId,
                                                      @PathVariable String documentNumber) {
        return withDocumentContext(tenantId, documentNumber, "redrive",
            () -> submissionService.redrive(tenantId, documentNumber));
    }

    @PostMapping("/refresh-ticket")
    public ResponseEntity<SubmissionResponse> refreshTicket(@PathVariable String tenantId,
                                                            @PathVariable String documentNumber) {
        return withDocumentContext(tenantId, documentNumber, "refresh-ticket",
            () -> submissionService.refreshTicketStatus(tenantId, documentNumber));
    }

    @GetMapping("/status")
    public ResponseEntity<StatusResponse> status(@PathVariable String tenantId,
                                                 @PathVariable String documentNumber) {
        return ResponseEntity.ok(StatusResponse.from(statusQueryService.status(tenantId, documentNumber)));
    }

    @GetMapping("/receipt")
    public ResponseEntity<byte[]> downloadReceipt(@PathVariable String tenantId,
                                                  @PathVariable String documentNumber) {
        byte[] body = statusQueryService.receiptBody(tenantId, documentNumber);
        return ResponseEntity.ok()
            .contentType(MediaType.APPLICATION_XML)
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"R-" + documentNumber + ".xml\"")
            .body(body);
    }

    private ResponseEntity<SubmissionResponse> withDocumentContext(String tenantId, String documentNumber,
                                                                   String operation,
                                                                   Supplier<SubmissionOutcome> action) {
        CorrelationContext.putDocument(tenantId, documentNumber);
        long startTime = System.currentTimeMillis();
        try {
            SubmissionOutcome outcome = action.get();
            log.info("{} completed: state={}, attempts={}, duration={}ms",
                operation, outcome.getState(), outcome.getAttempts(), System.currentTimeMillis() - startTime);
            return ResponseEntity.ok(SubmissionResponse.from(outcome));
        } catch (RuntimeException e) {
            log.error("{} failed: error={}, duration={}ms",
                operation, e.getMessage(), System.currentTimeMillis() - startTime);
            throw e;
        } finally {
            CorrelationContext.clearDocument();
        }
    }
}
