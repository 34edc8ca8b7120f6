package com.flagship.tax_submission.tenant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tax_submission.tenant.Tenant;
import lombok.Value;

import java.time.Instant;

/**
 * Tenant as exposed over the API. Authority credentials are never returned.
 */
@Value
public class TenantResponse {

    @JsonProperty("tenant_id")
    String tenantId;

    @JsonProperty("legal_name")
    String legalName;

    @JsonProperty("trade_name")
    String tradeName;

    @JsonProperty("address")
    String address;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static TenantResponse from(Tenant tenant) {
        return new TenantResponse(tenant.getTenantId(), tenant.getLegalName(), tenant.getTradeName(),
            tenant.getAddress(), tenant.isActive(), tenant.getCreatedAt(), tenant.getUpdatedAt());
    }
}
