package io.b2mash.einvoice.tax;

import java.math.BigDecimal;
import java.util.Objects;

/** The subtotal, VAT and grand total an invoice claims for itself. */
public record DeclaredTotals(BigDecimal subtotal, BigDecimal vat, BigDecimal total) {

  public DeclaredTotals {
    Objects.requireNonNull(subtotal, "subtotal must not be null");
    Objects.requireNonNull(vat, "vat must not be null");
    Objects.requireNonNull(total, "total must not be null");
  }
}
