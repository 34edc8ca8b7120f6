package com.flagship.tax_submission.tenant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tax_submission.document.DocumentKind;
import com.flagship.tax_submission.sequence.DocumentSeries;
import lombok.Value;

import java.time.Instant;

@Value
public class SeriesResponse {

    @JsonProperty("kind")
    DocumentKind kind;

    @JsonProperty("series")
    String series;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("created_at")
    Instant createdAt;

    public static SeriesResponse from(DocumentSeries series) {
        return new SeriesResponse(series.getKind(), series.getSeries(), series.isActive(), series.getCreatedAt());
    }
}
