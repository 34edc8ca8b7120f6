package com.flagship.tax_submission.voiding;

import com.flagship.tax_submission.document.Document;
import com.flagship.tax_submission.document.DocumentKind;
import com.flagship.tax_submission.document.DocumentState;
import com.flagship.tax_submission.exception.DocumentNotVoidableException;
import com.flagship.tax_submission.exception.InputValidationException;
import com.flagship.tax_submission.exception.NotFoundException;
import com.flagship.tax_submission.generation.DocumentGenerator;
import com.flagship.tax_submission.generation.DocumentPayload;
import com.flagship.tax_submission.sequence.SequenceCounter;
import com.flagship.tax_submission.store.BlobKeys;
import com.flagship.tax_submission.store.TenantIsolatedStore;
import com.flagship.tax_submission.tenant.Tenant;
import com.flagship.tax_submission.tenant.TenantService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Voids accepted documents.
 *
 * Invoices are voided by a credit note, a regular document that goes
 * through generation, signing and submission like any other. Receipts are
 * voided in bulk by a daily void communication numbered RA-{yyyyMMdd}-{n}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VoidingService {

    static final String VOID_COMMUNICATION_KIND = "RA";
    static final String VOID_COMMUNICATION_PREFIX = "RA-";
    static final String XML_CONTENT_TYPE = "application/xml";

    private static final DateTimeFormatter COMPACT_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final TenantService tenantService;
    private final TenantIsolatedStore store;
    private final DocumentGenerator documentGenerator;
    private final SequenceCounter sequenceCounter;
    private final VoidCommunicationXmlWriter xmlWriter;
    private final Clock clock;

    /**
     * Issues a credit note against an accepted invoice. Recipient and
     * currency are copied from the invoice; so are its items unless the
     * request lists its own.
     *
     * @throws NotFoundException if the invoice does not exist
     * @throws DocumentNotVoidableException if it is not an ACCEPTED invoice
     */
    public Document issueCreditNote(String tenantId, String invoiceNumber, CreditNoteRequest request) {
        if (request == null) {
            throw new InputValidationException("reference", "Credit note details are required");
        }
        tenantService.requireActive(tenantId);
        Document invoice = store.getDocument(tenantId, invoiceNumber);

        if (invoice.getKind() != DocumentKind.INVOICE) {
            throw new DocumentNotVoidableException(tenantId, invoiceNumber,
                invoice.getKind() + " documents are voided by void communication");
        }
        requireAccepted(tenantId, invoice);

        DocumentPayload payload = DocumentPayload.builder()
            .series(request.getSeries())
            .currency(invoice.getCurrency().name())
            .recipient(invoice.getRecipient())
            .items(request.getItems() != null && !request.getItems().isEmpty()
                ? request.getItems()
                : invoice.getItems())
            .referencedNumber(invoice.getDocumentNumber())
            .reasonCode(request.getReasonCode())
            .referenceDescription(request.getDescription())
            .build();

        Document creditNote = documentGenerator.generate(tenantId, DocumentKind.CREDIT_NOTE, payload);
        log.info("Issued credit note {} against invoice {} (tenant {}), reason={}",
            creditNote.getDocumentNumber(), invoiceNumber, tenantId, request.getReasonCode());
        return creditNote;
    }

    /**
     * Issues a void communication for accepted receipts and stores its XML
     * under the tenant's xml space.
     *
     * @throws InputValidationException if the date, the list or the reason is missing
     * @throws NotFoundException if a listed document does not exist
     * @throws DocumentNotVoidableException if a listed document is not an ACCEPTED receipt
     */
    public VoidCommunication issueVoidCommunication(String tenantId, LocalDate voidDate,
                                                    List<String> documentNumbers, String reason) {
        Tenant tenant = tenantService.requireActive(tenantId);
        LocalDate today = LocalDate.now(clock);

        if (voidDate == null) {
            throw new InputValidationException("voidDate", "Void date is required");
        }
        if (voidDate.isAfter(today)) {
            throw new InputValidationException("voidDate", "Void date cannot be in the future");
        }
        if (documentNumbers == null || documentNumbers.isEmpty()) {
            throw new InputValidationException("documentNumbers", "At least one document is required");
        }
        if (reason == null || reason.isBlank()) {
            throw new InputValidationException("reason", "Void reason is required");
        }

        List<String> numbers = documentNumbers.stream().map(n -> n == null ? "" : n.trim()).toList();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < numbers.size(); i++) {
            String number = numbers.get(i);
            if (number.isEmpty() || !number.contains("-")) {
                throw new InputValidationException("documentNumbers[" + (i + 1) + "]",
                    "Document number must look like SERIES-NUMBER");
            }
            if (!seen.add(number)) {
                throw new InputValidationException("documentNumbers[" + (i + 1) + "]",
                    "Document " + number + " is listed twice");
            }

            Document document = store.getDocument(tenantId, number);
            if (document.getKind() != DocumentKind.RECEIPT) {
                throw new DocumentNotVoidableException(tenantId, number,
                    document.getKind() + " documents are voided by credit note");
            }
            requireAccepted(tenantId, document);
        }

        String dateTag = voidDate.format(COMPACT_DATE);
        String series = VOID_COMMUNICATION_PREFIX + dateTag;
        long sequence = sequenceCounter.next(tenantId, VOID_COMMUNICATION_KIND, series);
        String communicationNumber = series + "-" + sequence;

        Instant issuedAt = clock.instant();
        String xml = xmlWriter.write(tenant, communicationNumber, LocalDate.ofInstant(issuedAt, clock.getZone()),
            voidDate, numbers, reason.trim());

        String blobKey = BlobKeys.voidCommunication(tenantId, communicationNumber);
        store.putBlob(tenantId, blobKey, xml.getBytes(StandardCharsets.UTF_8), XML_CONTENT_TYPE);

        log.info("Issued void communication {} for {} receipts (tenant {})",
            communicationNumber, numbers.size(), tenantId);
        return new VoidCommunication(tenantId, communicationNumber, voidDate, issuedAt, numbers,
            reason.trim(), blobKey);
    }

    /**
     * Numbers of the tenant's void communications, in key order.
     */
    public List<String> listVoidCommunications(String tenantId) {
        String prefix = BlobKeys.voidCommunication(tenantId, VOID_COMMUNICATION_PREFIX).replace(".xml", "");
        return store.listBlobs(tenantId, prefix).stream()
            .map(key -> key.substring(key.lastIndexOf('/') + 1, key.length() - ".xml".length()))
            .toList();
    }

    public byte[] getVoidCommunicationXml(String tenantId, String communicationNumber) {
        return store.getBlob(tenantId, BlobKeys.voidCommunication(tenantId, communicationNumber))
            .orElseThrow(() -> new NotFoundException("Void communication", communicationNumber));
    }

    private static void requireAccepted(String tenantId, Document document) {
        if (document.getState() != DocumentState.ACCEPTED) {
            throw new DocumentNotVoidableException(tenantId, document.getDocumentNumber(),
                "only ACCEPTED documents can be voided, state is " + document.getState());
        }
    }
}
