package com.flagship.tax_submission.tenant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tax_submission.document.DocumentKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class SeriesRequest {

    @NotNull(message = "Document kind is required")
    @JsonProperty("kind")
    DocumentKind kind;

    @NotBlank(message = "Series is required")
    @JsonProperty("series")
    String series;
}
