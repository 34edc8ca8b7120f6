package com.flagship.tax_submission.generation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tax_submission.document.LineItem;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One document line. total is the line amount before tax.
 */
@Value
public class LineItemDto {

    @JsonProperty("description")
    String description;

    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("unit_code")
    String unitCode;

    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @JsonProperty("tax_treatment")
    String taxTreatment;

    @JsonProperty("tax")
    BigDecimal tax;

    @JsonProperty("total")
    BigDecimal total;

    public LineItem toDomain() {
        return new LineItem(description, quantity, unitCode, unitPrice, taxTreatment, tax, total);
    }

    public static LineItemDto from(LineItem item) {
        return new LineItemDto(item.getDescription(), item.getQuantity(), item.getUnitCode(),
            item.getUnitPrice(), item.getTaxTreatment(), item.getTax(), item.getTotal());
    }
}
