package com.flagship.tax_submission.generation;

import com.flagship.tax_submission.catalog.TaxCatalog;
import com.flagship.tax_submission.document.CurrencyCode;
import com.flagship.tax_submission.document.DocumentKind;
import com.flagship.tax_submission.document.LineItem;
import com.flagship.tax_submission.document.Party;
import com.flagship.tax_submission.exception.InputValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.IntStream;

/**
 * Validates a document payload before any number is reserved.
 *
 * The first problem found is raised as an {@link InputValidationException}
 * naming the field; items are numbered from 1 ({@code items[1].quantity}).
 */
@Component
@RequiredArgsConstructor
public class DocumentPayloadValidator {

    static final String PERSONAL_ID = "1";
    static final String FISCAL_ID = "6";

    private static final Pattern PERSONAL_ID_NUMBER = Pattern.compile("^\\d{8}$");
    private static final Pattern FISCAL_ID_NUMBER = Pattern.compile("^\\d{11}$");
    private static final String DEFAULT_UNIT_CODE = "NIU";

    private final TaxCatalog catalog;

    /**
     * Returns the payload with defaults applied: currency PEN, recipient id
     * type "1" for receipts and "6" otherwise, unit code NIU.
     */
    public DocumentPayload validate(DocumentKind kind, DocumentPayload payload) {
        if (kind == null) {
            throw new InputValidationException("kind", "Document kind is required");
        }
        if (payload == null) {
            throw new InputValidationException("payload", "Document content is required");
        }

        Party recipient = validateRecipient(kind, payload.getRecipient());
        List<LineItem> items = validateItems(payload.getItems());
        String currency = validateCurrency(payload.getCurrency());
        if (kind == DocumentKind.CREDIT_NOTE) {
            validateReference(payload);
        }

        return payload.toBuilder()
            .recipient(recipient)
            .items(items)
            .currency(currency)
            .build();
    }

    private Party validateRecipient(DocumentKind kind, Party recipient) {
        if (recipient == null) {
            throw new InputValidationException("recipient", "Recipient is required");
        }

        String idType;
        if (kind == DocumentKind.RECEIPT) {
            idType = isBlank(recipient.getIdType()) ? PERSONAL_ID : recipient.getIdType().trim();
            if (!catalog.contains(TaxCatalog.IDENTITY_TYPES, idType)) {
                throw new InputValidationException("recipient.idType",
                    "Identity document type '" + idType + "' is not in catalog 06");
            }
        } else {
            idType = FISCAL_ID;
            if (!isBlank(recipient.getIdType()) && !FISCAL_ID.equals(recipient.getIdType().trim())) {
                throw new InputValidationException("recipient.idType",
                    kind + " recipients must be identified by fiscal id (type 6)");
            }
        }

        String idNumber = recipient.getIdNumber() == null ? "" : recipient.getIdNumber().trim();
        if (PERSONAL_ID.equals(idType) && !PERSONAL_ID_NUMBER.matcher(idNumber).matches()) {
            throw new InputValidationException("recipient.idNumber", "Personal id must be exactly 8 digits");
        }
        if (FISCAL_ID.equals(idType) && !FISCAL_ID_NUMBER.matcher(idNumber).matches()) {
            throw new InputValidationException("recipient.idNumber", "Fiscal id must be exactly 11 digits");
        }
        if (idNumber.isEmpty()) {
            throw new InputValidationException("recipient.idNumber", "Recipient id number is required");
        }

        if (isBlank(recipient.getName())) {
            throw new InputValidationException("recipient.name", "Recipient name is required");
        }

        return new Party(idType, idNumber, recipient.getName().trim(), recipient.getAddress());
    }

    private List<LineItem> validateItems(List<LineItem> items) {
        if (items == null || items.isEmpty()) {
            throw new InputValidationException("items", "At least one line item is required");
        }

        return IntStream.range(0, items.size())
            .mapToObj(i -> validateItem(i + 1, items.get(i)))
            .toList();
    }

    private LineItem validateItem(int position, LineItem item) {
        String prefix = "items[" + position + "]";
        if (item == null) {
            throw new InputValidationException(prefix, "Line item is missing");
        }
        if (isBlank(item.getDescription())) {
            throw new InputValidationException(prefix + ".description", "Description is required");
        }
        if (!isPositive(item.getQuantity())) {
            throw new InputValidationException(prefix + ".quantity", "Quantity must be greater than zero");
        }
        if (!isPositive(item.getUnitPrice())) {
            throw new InputValidationException(prefix + ".unitPrice", "Unit price must be greater than zero");
        }
        if (!hasAtMostTwoDecimals(item.getUnitPrice())) {
            throw new InputValidationException(prefix + ".unitPrice", "Unit price must have at most 2 decimals");
        }
        if (item.getTax() == null || item.getTax().signum() < 0) {
            throw new InputValidationException(prefix + ".tax", "Tax must not be negative");
        }
        if (!hasAtMostTwoDecimals(item.getTax())) {
            throw new InputValidationException(prefix + ".tax", "Tax must have at most 2 decimals");
        }
        if (!isPositive(item.getTotal())) {
            throw new InputValidationException(prefix + ".total", "Total must be greater than zero");
        }
        if (!hasAtMostTwoDecimals(item.getTotal())) {
            throw new InputValidationException(prefix + ".total", "Total must have at most 2 decimals");
        }
        if (!catalog.contains(TaxCatalog.TAX_TREATMENTS, item.getTaxTreatment())) {
            throw new InputValidationException(prefix + ".taxTreatment",
                "Tax treatment '" + item.getTaxTreatment() + "' is not in catalog 07");
        }

        String unitCode = isBlank(item.getUnitCode()) ? DEFAULT_UNIT_CODE : item.getUnitCode().trim();
        return new LineItem(item.getDescription().trim(), item.getQuantity(), unitCode, item.getUnitPrice(),
            item.getTaxTreatment(), item.getTax(), item.getTotal());
    }

    private static String validateCurrency(String currency) {
        if (isBlank(currency)) {
            return CurrencyCode.PEN.name();
        }
        String normalized = currency.trim().toUpperCase();
        for (CurrencyCode code : CurrencyCode.values()) {
            if (code.name().equals(normalized)) {
                return normalized;
            }
        }
        throw new InputValidationException("currency", "Currency must be PEN or USD");
    }

    private void validateReference(DocumentPayload payload) {
        if (isBlank(payload.getReferencedNumber())) {
            throw new InputValidationException("reference.documentNumber",
                "Credit notes must reference the document they modify");
        }
        if (!catalog.contains(TaxCatalog.CREDIT_NOTE_REASONS, payload.getReasonCode())) {
            throw new InputValidationException("reference.reasonCode",
                "Reason code '" + payload.getReasonCode() + "' is not in catalog 09");
        }
        if (isBlank(payload.getReferenceDescription())) {
            throw new InputValidationException("reference.description", "Credit note description is required");
        }
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    private static boolean hasAtMostTwoDecimals(BigDecimal value) {
        return value.stripTrailingZeros().scale() <= 2;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
