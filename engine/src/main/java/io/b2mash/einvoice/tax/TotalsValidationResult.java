package io.b2mash.einvoice.tax;

import java.math.BigDecimal;
import java.util.List;

/**
 * Verdict of a totals reconciliation. One error per mismatched field; the computed figures are
 * returned so callers can show both sides.
 */
public record TotalsValidationResult(
    boolean valid,
    List<String> errors,
    BigDecimal computedSubtotal,
    BigDecimal computedVat,
    BigDecimal computedTotal) {

  public TotalsValidationResult {
    errors = List.copyOf(errors);
  }
}
