package com.flagship.tax_submission.generation;

import com.flagship.tax_submission.document.LineItem;
import com.flagship.tax_submission.document.Party;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Caller-supplied content of a document to generate.
 *
 * Series and currency are optional (tenant default series, PEN). The
 * reference fields apply to credit notes only.
 */
@Value
@Builder(toBuilder = true)
public class DocumentPayload {
    String series;
    String currency;
    Party recipient;
    List<LineItem> items;
    String referencedNumber;
    String reasonCode;
    String referenceDescription;
}
