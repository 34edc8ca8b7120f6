package com.flagship.tax_submission.document;

/**
 * Currencies a tax document may be issued in.
 */
public enum CurrencyCode {
    PEN,
    USD
}
