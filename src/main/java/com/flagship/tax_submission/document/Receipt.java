package com.flagship.tax_submission.document;

import lombok.Value;

import java.time.Instant;

/**
 * Response returned by the tax authority for a submission or a status query.
 *
 * A responseCode of "TICKET" means the authority accepted the payload for
 * asynchronous processing; the ticket must then be polled for the final code.
 */
@Value
public class Receipt {
    public static final String TICKET = "TICKET";
    public static final String PROCESSING = "PROCESSING";

    String responseCode;
    String message;
    String ticket;
    byte[] rawBody;
    Instant receivedAt;

    public boolean hasBody() {
        return rawBody != null && rawBody.length > 0;
    }
}
