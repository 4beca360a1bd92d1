package io.b2mash.einvoice.tax;

import java.math.BigDecimal;
import java.util.Objects;

/** One parsed invoice line as the reconciliation sees it. */
public record InvoiceLineItem(BigDecimal quantity, BigDecimal unitPrice, BigDecimal vatRate) {

  public InvoiceLineItem {
    Objects.requireNonNull(quantity, "quantity must not be null");
    Objects.requireNonNull(unitPrice, "unitPrice must not be null");
    Objects.requireNonNull(vatRate, "vatRate must not be null");
    if (vatRate.signum() < 0) {
      throw new IllegalArgumentException("VAT rate must not be negative, got: " + vatRate);
    }
  }

  /** Unrounded {@code quantity * unitPrice}. */
  public BigDecimal lineTotal() {
    return quantity.multiply(unitPrice);
  }
}
