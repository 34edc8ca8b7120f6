package com.flagship.tax_submission.document;

import lombok.Value;

/**
 * Snapshot of an issuer or recipient at the time a document is issued.
 *
 * The snapshot is copied into the document so later changes to the tenant
 * or customer never alter an issued document.
 */
@Value
public class Party {
    String idType;      // catalog 06 code, "6" for fiscal ids
    String idNumber;
    String name;
    String address;
}
