package com.flagship.tax_submission.document;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One line of a tax document, kept in input order.
 */
@Value
public class LineItem {
    String description;
    BigDecimal quantity;
    String unitCode;
    BigDecimal unitPrice;
    String taxTreatment;    // catalog 07 code
    BigDecimal tax;
    BigDecimal total;       // line amount before tax
}
