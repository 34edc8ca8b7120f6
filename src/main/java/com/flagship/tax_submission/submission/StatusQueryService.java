package com.flagship.tax_submission.submission;

import com.flagship.tax_submission.document.Document;
import com.flagship.tax_submission.document.DocumentReceipt;
import com.flagship.tax_submission.exception.NotFoundException;
import com.flagship.tax_submission.store.TenantIsolatedStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Read side of the submission pipeline.
 */
@Service
@RequiredArgsConstructor
public class StatusQueryService {

    private final TenantIsolatedStore store;

    public DocumentStatus status(String tenantId, String documentNumber) {
        Document document = store.getDocument(tenantId, documentNumber);

        DocumentStatus.ReceiptSummary receipt = null;
        DocumentReceipt recorded = document.getReceipt();
        if (recorded != null) {
            String downloadUrl = recorded.getBodyKey() != null
                ? receiptDownloadPath(tenantId, document.getDocumentNumber())
                : null;
            receipt = new DocumentStatus.ReceiptSummary(recorded.getResponseCode(), recorded.getMessage(),
                recorded.getTicket(), recorded.getReceivedAt(), downloadUrl);
        }

        return new DocumentStatus(document.getDocumentNumber(), document.getState(), receipt,
            document.rejectionReason(), document.getIssuedAt());
    }

    /**
     * Raw receipt body as returned by the authority.
     */
    public byte[] receiptBody(String tenantId, String documentNumber) {
        Document document = store.getDocument(tenantId, documentNumber);
        DocumentReceipt receipt = document.getReceipt();
        if (receipt == null || receipt.getBodyKey() == null) {
            throw new NotFoundException("Receipt", documentNumber);
        }
        return store.getBlob(tenantId, receipt.getBodyKey())
            .orElseThrow(() -> new NotFoundException("Receipt", documentNumber));
    }

    static String receiptDownloadPath(String tenantId, String documentNumber) {
        return "/api/tenants/" + tenantId + "/documents/" + documentNumber + "/receipt";
    }
}
