package com.flagship.tax_submission.document;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Monetary totals of a document, always at 2 decimals rounded HALF_UP.
 */
@Value
public class Totals {
    BigDecimal subtotal;
    BigDecimal tax;
    BigDecimal total;

    /**
     * Derives the totals from the line items: subtotal is the sum of line
     * totals, tax the sum of line taxes, total their sum.
     */
    public static Totals of(List<LineItem> items) {
        BigDecimal subtotal = BigDecimal.ZERO;
        BigDecimal tax = BigDecimal.ZERO;
        for (LineItem item : items) {
            subtotal = subtotal.add(item.getTotal());
            tax = tax.add(item.getTax());
        }
        subtotal = round(subtotal);
        tax = round(tax);
        return new Totals(subtotal, tax, round(subtotal.add(tax)));
    }

    public static BigDecimal round(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }
}
