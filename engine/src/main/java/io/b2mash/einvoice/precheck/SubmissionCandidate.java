package io.b2mash.einvoice.precheck;

import io.b2mash.einvoice.tax.DeclaredTotals;
import io.b2mash.einvoice.tax.InvoiceLineItem;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * An already-parsed invoice about to be submitted.
 *
 * @param supplierTaxId the seller's VKN; may be null or blank, which fails the pre-check
 * @param customerTaxId the buyer's VKN/TCKN; null for consumers (e-Arşiv)
 */
public record SubmissionCandidate(
    String supplierTaxId,
    String customerTaxId,
    LocalDate issueDate,
    List<InvoiceLineItem> lines,
    DeclaredTotals declaredTotals) {

  public SubmissionCandidate {
    Objects.requireNonNull(issueDate, "issueDate must not be null");
    Objects.requireNonNull(declaredTotals, "declaredTotals must not be null");
    lines = List.copyOf(Objects.requireNonNull(lines, "lines must not be null"));
  }

  boolean hasCustomerTaxId() {
    return customerTaxId != null && !customerTaxId.isBlank();
  }
}
