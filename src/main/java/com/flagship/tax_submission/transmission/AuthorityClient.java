package com.flagship.tax_submission.transmission;

import com.flagship.tax_submission.document.Receipt;

/**
 * The tax authority's remote submission service.
 *
 * Implementations raise on transport or protocol failure. Failures they can
 * explain should implement {@link TaggedFailure}; anything else is classified
 * by message.
 */
public interface AuthorityClient {

    /**
     * Submits one compressed, signed document.
     */
    Receipt submit(String tenantId, AuthorityCredentials credentials, SubmissionArchive archive);

    /**
     * Resolves a ticket handed out for asynchronous processing. Returns a
     * receipt with code {@link Receipt#PROCESSING} while the authority is still working.
     */
    Receipt queryStatus(String tenantId, AuthorityCredentials credentials, String ticket);
}
