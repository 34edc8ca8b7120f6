package com.flagship.tax_submission.generation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tax_submission.document.DocumentKind;
import com.flagship.tax_submission.document.DocumentReference;
import lombok.Value;

/**
 * Document a credit note modifies. The kind is filled in on responses only.
 */
@Value
public class ReferenceDto {

    @JsonProperty("document_number")
    String documentNumber;

    @JsonProperty("kind")
    DocumentKind kind;

    @JsonProperty("reason_code")
    String reasonCode;

    @JsonProperty("description")
    String description;

    public static ReferenceDto from(DocumentReference reference) {
        return reference == null ? null
            : new ReferenceDto(reference.getDocumentNumber(), reference.getKind(),
                reference.getReasonCode(), reference.getDescription());
    }
}
