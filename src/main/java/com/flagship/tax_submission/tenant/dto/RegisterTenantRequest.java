package com.flagship.tax_submission.tenant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.ToString;
import lombok.Value;

@Value
public class RegisterTenantRequest {

    @NotBlank(message = "Tenant id is required")
    @Pattern(regexp = "^\\d{11}$", message = "Tenant id must be exactly 11 digits")
    @JsonProperty("tenant_id")
    String tenantId;

    @NotBlank(message = "Legal name is required")
    @JsonProperty("legal_name")
    String legalName;

    @JsonProperty("trade_name")
    String tradeName;

    @JsonProperty("address")
    String address;

    @NotBlank(message = "Authority username is required")
    @JsonProperty("authority_username")
    String authorityUsername;

    @NotBlank(message = "Authority password is required")
    @ToString.Exclude
    @JsonProperty("authority_password")
    String authorityPassword;
}
