package com.flagship.tax_submission.voiding.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tax_submission.generation.dto.LineItemDto;
import com.flagship.tax_submission.voiding.CreditNoteRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.util.List;

@Value
public class CreditNoteRequestDto {

    @NotBlank(message = "Reason code is required")
    @JsonProperty("reason_code")
    String reasonCode;

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    String description;

    @JsonProperty("series")
    String series;

    @Valid
    @JsonProperty("items")
    List<LineItemDto> items;

    public CreditNoteRequest toDomain() {
        return new CreditNoteRequest(reasonCode, description, series,
            items != null ? items.stream().map(LineItemDto::toDomain).toList() : null);
    }
}
