package com.flagship.tax_submission.voiding.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
public class VoidCommunicationRequest {

    @NotNull(message = "Void date is required")
    @JsonProperty("void_date")
    LocalDate voidDate;

    @NotEmpty(message = "At least one document number is required")
    @JsonProperty("document_numbers")
    List<String> documentNumbers;

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;
}
