package com.flagship.tax_submission.tenant;

import com.flagship.tax_submission.document.Party;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;
import java.util.regex.Pattern;

/**
 * A business issuing documents through the service, identified by its
 * 11-digit fiscal id.
 *
 * The authority password is held encrypted; it is decrypted only when a
 * submission needs it.
 */
@Value
public class Tenant {
    private static final Pattern FISCAL_ID = Pattern.compile("^\\d{11}$");

    String tenantId;
    String legalName;
    String tradeName;
    String address;
    String authorityUsername;
    @ToString.Exclude
    String encryptedAuthorityPassword;
    boolean active;
    Instant createdAt;
    Instant updatedAt;

    public static Tenant register(String tenantId, String legalName, String tradeName, String address,
                                  String authorityUsername, String encryptedAuthorityPassword) {
        Instant now = Instant.now();
        return new Tenant(tenantId, legalName, tradeName, address,
            authorityUsername, encryptedAuthorityPassword, true, now, now);
    }

    public static boolean isValidFiscalId(String value) {
        return value != null && FISCAL_ID.matcher(value).matches();
    }

    public Tenant withActive(boolean active) {
        return new Tenant(tenantId, legalName, tradeName, address,
            authorityUsername, encryptedAuthorityPassword, active, createdAt, Instant.now());
    }

    /**
     * Issuer snapshot copied into every document the tenant issues.
     */
    public Party asIssuer() {
        return new Party("6", tenantId, legalName, address);
    }
}
