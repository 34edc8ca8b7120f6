package com.flagship.tax_submission.voiding.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tax_submission.voiding.VoidCommunication;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Value
public class VoidCommunicationResponse {

    @JsonProperty("communication_number")
    String communicationNumber;

    @JsonProperty("void_date")
    LocalDate voidDate;

    @JsonProperty("issued_at")
    Instant issuedAt;

    @JsonProperty("document_numbers")
    List<String> documentNumbers;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("xml_url")
    String xmlUrl;

    public static VoidCommunicationResponse from(VoidCommunication communication) {
        return new VoidCommunicationResponse(
            communication.getCommunicationNumber(),
            communication.getVoidDate(),
            communication.getIssuedAt(),
            communication.getDocumentNumbers(),
            communication.getReason(),
            "/api/tenants/" + communication.getTenantId() + "/void-communications/"
                + communication.getCommunicationNumber()
        );
    }
}
