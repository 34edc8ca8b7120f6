package com.flagship.tax_submission.transmission;

import lombok.ToString;
import lombok.Value;

/**
 * Decrypted credentials a tenant uses to authenticate with the tax authority.
 * Never persisted or logged in this form.
 */
@Value
public class AuthorityCredentials {
    String username;
    @ToString.Exclude
    String password;
}
