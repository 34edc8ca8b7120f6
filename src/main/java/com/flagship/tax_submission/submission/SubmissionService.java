package com.flagship.tax_submission.submission;

import com.flagship.tax_submission.document.Document;
import com.flagship.tax_submission.document.DocumentState;
import com.flagship.tax_submission.document.Receipt;
import com.flagship.tax_submission.document.TransmissionError;
import com.flagship.tax_submission.exception.AuthorityProtocolException;
import com.flagship.tax_submission.exception.DocumentAlreadyAcceptedException;
import com.flagship.tax_submission.exception.DocumentNotSubmittableException;
import com.flagship.tax_submission.exception.InputValidationException;
import com.flagship.tax_submission.exception.RetryExhaustedException;
import com.flagship.tax_submission.observability.SubmissionMetrics;
import com.flagship.tax_submission.receipt.ResponseInterpreter;
import com.flagship.tax_submission.signing.DigitalSigner;
import com.flagship.tax_submission.store.BlobKeys;
import com.flagship.tax_submission.store.TenantIsolatedStore;
import com.flagship.tax_submission.tenant.Tenant;
import com.flagship.tax_submission.tenant.TenantService;
import com.flagship.tax_submission.transmission.AuthorityClient;
import com.flagship.tax_submission.transmission.AuthorityCredentials;
import com.flagship.tax_submission.transmission.ErrorClass;
import com.flagship.tax_submission.transmission.FailureTag;
import com.flagship.tax_submission.transmission.SubmissionArchive;
import com.flagship.tax_submission.transmission.TaggedFailure;
import com.flagship.tax_submission.transmission.TransmissionResult;
import com.flagship.tax_submission.transmission.TransmissionRetryEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives a document from PENDING to the authority and back.
 *
 * Pipeline:
 * 1. Validate input, load the active tenant and the document
 * 2. Refuse documents that are ACCEPTED, REJECTED or already SUBMITTED
 * 3. Sign once; later attempts reuse the stored signed XML
 * 4. Zip, move PENDING -> SUBMITTED and transmit under the retry engine
 * 5. Apply the receipt
 *
 * A failed transmission, or a receipt that cannot be applied, leaves the
 * document PENDING with its error log, so it can be re-driven later.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionService {

    static final String SIGNED_XML_CONTENT_TYPE = "application/xml";

    private final TenantService tenantService;
    private final TenantIsolatedStore store;
    private final DigitalSigner signer;
    private final AuthorityClient authorityClient;
    private final TransmissionRetryEngine retryEngine;
    private final ResponseInterpreter interpreter;
    private final SubmissionMetrics metrics;

    /**
     * @throws InputValidationException if the tenant id or document number is malformed
     * @throws DocumentAlreadyAcceptedException if the authority already accepted the document
     * @throws DocumentNotSubmittableException if the document is REJECTED or SUBMITTED
     * @throws RetryExhaustedException if every attempt failed
     * @throws AuthorityProtocolException if a non-recoverable failure stopped the retries
     */
    public SubmissionOutcome submit(String tenantId, String documentNumber) {
        validateInput(tenantId, documentNumber);
        Tenant tenant = tenantService.requireActive(tenantId);
        Document document = store.getDocument(tenantId, documentNumber.trim());

        if (document.getState() == DocumentState.ACCEPTED) {
            throw new DocumentAlreadyAcceptedException(tenantId, document.getDocumentNumber());
        }
        if (document.getState() != DocumentState.PENDING) {
            throw new DocumentNotSubmittableException(tenantId, document.getDocumentNumber(),
                document.getState(), "cannot be submitted");
        }
        return transmit(tenant, document);
    }

    /**
     * Re-runs the pipeline for a document whose earlier transmission failed.
     *
     * @throws DocumentNotSubmittableException if the document has no failed transmission pending
     */
    public SubmissionOutcome redrive(String tenantId, String documentNumber) {
        validateInput(tenantId, documentNumber);
        Tenant tenant = tenantService.requireActive(tenantId);
        Document document = store.getDocument(tenantId, documentNumber.trim());

        if (!document.isAwaitingRedrive()) {
            throw new DocumentNotSubmittableException(tenantId, document.getDocumentNumber(),
                document.getState(), "is not awaiting re-drive");
        }
        log.info("Re-driving document {} after {} recorded failures (tenant {})",
            document.getDocumentNumber(), document.getTransmissionErrors().size(), tenantId);
        return transmit(tenant, document);
    }

    /**
     * Polls the authority once for a ticketed submission and applies the answer.
     */
    public SubmissionOutcome refreshTicketStatus(String tenantId, String documentNumber) {
        validateInput(tenantId, documentNumber);
        Tenant tenant = tenantService.requireActive(tenantId);
        Document document = store.getDocument(tenantId, documentNumber.trim());

        if (document.getState() != DocumentState.SUBMITTED
                || document.getReceipt() == null
                || !document.getReceipt().awaitsTicketResolution()) {
            throw new DocumentNotSubmittableException(tenantId, document.getDocumentNumber(),
                document.getState(), "has no ticket awaiting resolution");
        }

        String ticket = document.getReceipt().getTicket();
        Receipt receipt = authorityClient.queryStatus(tenantId, tenantService.credentialsFor(tenant), ticket);
        Document updated = interpreter.process(tenantId, document.getDocumentNumber(), receipt);

        log.info("Ticket {} for document {} resolved to {} (tenant {})",
            ticket, document.getDocumentNumber(), updated.getState(), tenantId);
        return new SubmissionOutcome(updated.getDocumentNumber(), updated.getState(), updated.getReceipt(), 1);
    }

    private SubmissionOutcome transmit(Tenant tenant, Document document) {
        long startTime = System.currentTimeMillis();
        String tenantId = tenant.getTenantId();
        String documentNumber = document.getDocumentNumber();

        String signedXml = signedXmlFor(tenantId, document);
        SubmissionArchive archive = SubmissionArchive.of(document, signedXml);
        AuthorityCredentials credentials = tenantService.credentialsFor(tenant);

        store.transitionState(tenantId, document, DocumentState.PENDING, DocumentState.SUBMITTED);

        TransmissionResult<Receipt> result = retryEngine.executeWithRetry(
            attempt -> authorityClient.submit(tenantId, credentials, archive), tenantId, documentNumber);

        if (!result.isSuccess()) {
            metrics.recordLatency("submit", System.currentTimeMillis() - startTime);
            if (result.isShortCircuited()) {
                throw protocolFailure(documentNumber, result);
            }
            throw new RetryExhaustedException(tenantId, documentNumber, result.getTotalAttempts(),
                result.getErrorLog());
        }

        Document updated;
        try {
            updated = interpreter.process(tenantId, documentNumber, result.getResult());
        } catch (RuntimeException e) {
            metrics.recordLatency("submit", System.currentTimeMillis() - startTime);
            throw returnToPending(tenantId, document, result, e);
        }

        long duration = System.currentTimeMillis() - startTime;
        metrics.recordLatency("submit", duration);
        log.info("Document {} submitted (tenant {}): state={}, attempts={}, duration={}ms",
            documentNumber, tenantId, updated.getState(), result.getTotalAttempts(), duration);

        return new SubmissionOutcome(documentNumber, updated.getState(), updated.getReceipt(),
            result.getTotalAttempts());
    }

    /**
     * Records a receipt that could not be applied and moves the document back
     * to PENDING so it stays re-drivable.
     */
    private RuntimeException returnToPending(String tenantId, Document document,
                                             TransmissionResult<Receipt> result, RuntimeException failure) {
        Receipt receipt = result.getResult();
        log.error("Receipt {} for document {} could not be applied (tenant {})",
            receipt.getResponseCode(), document.getDocumentNumber(), tenantId, failure);

        List<TransmissionError> errors = new ArrayList<>(result.getErrorLog());
        errors.add(new TransmissionError(Instant.now(), result.getTotalAttempts(),
            "Receipt " + receipt.getResponseCode() + " could not be applied: " + failure.getMessage(),
            0, ErrorClass.UNCLASSIFIED.name()));
        try {
            store.recordTransmissionFailure(tenantId, document, errors);
        } catch (RuntimeException compensationFailure) {
            log.error("Document {} could not be returned to PENDING (tenant {})",
                document.getDocumentNumber(), tenantId, compensationFailure);
            failure.addSuppressed(compensationFailure);
        }
        return failure;
    }

    private String signedXmlFor(String tenantId, Document document) {
        if (document.isSigned()) {
            return store.getBlob(tenantId, document.getSignedXmlKey())
                .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
                .orElseThrow(() -> new IllegalStateException(
                    "Signed XML for document " + document.getDocumentNumber() + " is missing"));
        }

        String signedXml = signer.sign(tenantId, document.getRawXml());
        String key = BlobKeys.signedXml(tenantId, document.getDocumentNumber());
        store.putBlob(tenantId, key, signedXml.getBytes(StandardCharsets.UTF_8), SIGNED_XML_CONTENT_TYPE);
        store.attachSignedXml(tenantId, document, key);
        return signedXml;
    }

    private static AuthorityProtocolException protocolFailure(String documentNumber,
                                                              TransmissionResult<Receipt> result) {
        Exception cause = result.getLastFailure();
        FailureTag tag = cause instanceof TaggedFailure ? ((TaggedFailure) cause).getTag() : FailureTag.UNKNOWN;
        String detail = cause != null && cause.getMessage() != null ? cause.getMessage() : "non-recoverable failure";
        return new AuthorityProtocolException(tag,
            "Authority refused document " + documentNumber + ": " + detail, cause);
    }

    private static void validateInput(String tenantId, String documentNumber) {
        if (!Tenant.isValidFiscalId(tenantId)) {
            throw new InputValidationException("tenantId", "Tenant id must be exactly 11 digits");
        }
        if (documentNumber == null || documentNumber.isBlank()) {
            throw new InputValidationException("documentNumber", "Document number is required");
        }
    }
}
