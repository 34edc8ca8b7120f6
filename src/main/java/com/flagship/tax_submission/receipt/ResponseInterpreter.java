package com.flagship.tax_submission.receipt;

import com.flagship.tax_submission.document.Document;
import com.flagship.tax_submission.document.DocumentReceipt;
import com.flagship.tax_submission.document.DocumentState;
import com.flagship.tax_submission.document.Receipt;
import com.flagship.tax_submission.observability.SubmissionMetrics;
import com.flagship.tax_submission.store.BlobKeys;
import com.flagship.tax_submission.store.TenantIsolatedStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Applies an authority receipt to a document.
 *
 * Stores the raw body as a tenant blob, records the receipt metadata and
 * moves the document to the state its response code maps to. All of it
 * commits or none of it does.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResponseInterpreter {

    static final String RECEIPT_CONTENT_TYPE = "application/xml";

    private final TenantIsolatedStore store;
    private final SubmissionMetrics metrics;

    @Transactional
    public Document process(String tenantId, String documentNumber, Receipt receipt) {
        Document document = store.getDocument(tenantId, documentNumber);

        String bodyKey = null;
        if (receipt.hasBody()) {
            bodyKey = BlobKeys.receipt(tenantId, documentNumber);
            store.putBlob(tenantId, bodyKey, receipt.getRawBody(), RECEIPT_CONTENT_TYPE);
        }

        Document updated = store.attachReceipt(tenantId, document, DocumentReceipt.from(receipt, bodyKey));

        ResponseCodeMapping mapping = ResponseCodeMapping.of(receipt.getResponseCode());
        DocumentState target = mapping.getState();
        if (updated.getState() != target) {
            updated = store.transitionState(tenantId, updated, updated.getState(), target);
        }

        metrics.recordSubmissionOutcome(mapping.name().toLowerCase());
        if (target == DocumentState.REJECTED) {
            log.warn("Document {} rejected by authority (tenant {}): code={}, message={}",
                documentNumber, tenantId, receipt.getResponseCode(), receipt.getMessage());
        } else {
            log.info("Document {} receipt applied (tenant {}): code={}, state={}",
                documentNumber, tenantId, receipt.getResponseCode(), updated.getState());
        }
        return updated;
    }
}
