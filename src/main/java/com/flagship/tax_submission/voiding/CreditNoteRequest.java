package com.flagship.tax_submission.voiding;

import com.flagship.tax_submission.document.LineItem;
import lombok.Value;

import java.util.List;

/**
 * What a credit note against an accepted invoice should say. Without items,
 * the invoice's items are credited in full.
 */
@Value
public class CreditNoteRequest {
    String reasonCode;
    String description;
    String series;
    List<LineItem> items;
}
