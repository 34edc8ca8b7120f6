package com.flagship.tax_submission.document;

import lombok.Value;

/**
 * Reference from a credit note to the document it modifies.
 */
@Value
public class DocumentReference {
    String documentNumber;
    DocumentKind kind;
    String reasonCode;      // catalog 09 code
    String description;
}
