package com.flagship.tax_submission.exception;

/**
 * Raised when a record does not exist for the requesting tenant.
 *
 * A record owned by another tenant is reported the same way, so callers
 * cannot probe for foreign identifiers.
 */
public class NotFoundException extends RuntimeException {

    private final String resource;
    private final String identifier;

    public NotFoundException(String resource, String identifier) {
        super(String.format("%s not found: %s", resource, identifier));
        this.resource = resource;
        this.identifier = identifier;
    }

    public String getResource() {
        return resource;
    }

    public String getIdentifier() {
        return identifier;
    }
}
