package io.b2mash.einvoice.ledger;

import io.b2mash.einvoice.tax.VatBreakdown;
import java.util.List;
import java.util.Objects;

/**
 * Turns the VAT breakdown of a sales invoice into its journal postings, using the Turkish uniform
 * chart of accounts (Tek Düzen Hesap Planı).
 */
public final class SalesPostingAssembler {

  /** 120 Alıcılar. */
  public static final String RECEIVABLES_ACCOUNT = "120";

  /** 600 Yurtiçi Satışlar. */
  public static final String DOMESTIC_SALES_ACCOUNT = "600";

  /** 391 Hesaplanan KDV. */
  public static final String VAT_PAYABLE_ACCOUNT = "391";

  private SalesPostingAssembler() {}

  public static List<LedgerEntry> postingsFor(VatBreakdown breakdown) {
    Objects.requireNonNull(breakdown, "breakdown must not be null");
    return List.of(
        LedgerEntry.debit(RECEIVABLES_ACCOUNT, breakdown.totalAmount()),
        LedgerEntry.credit(DOMESTIC_SALES_ACCOUNT, breakdown.taxBase()),
        LedgerEntry.credit(VAT_PAYABLE_ACCOUNT, breakdown.taxAmount()));
  }
}
