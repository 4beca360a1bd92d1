package io.b2mash.einvoice.ledger;

import java.math.BigDecimal;

/**
 * One posting line of a journal entry. Either side may be absent (treated as zero); neither may
 * be negative.
 *
 * @param accountCode chart-of-accounts code, informational only
 */
public record LedgerEntry(String accountCode, BigDecimal debit, BigDecimal credit) {

  public LedgerEntry {
    if (debit != null && debit.signum() < 0) {
      throw new IllegalArgumentException("Debit must not be negative, got: " + debit);
    }
    if (credit != null && credit.signum() < 0) {
      throw new IllegalArgumentException("Credit must not be negative, got: " + credit);
    }
  }

  public static LedgerEntry of(BigDecimal debit, BigDecimal credit) {
    return new LedgerEntry(null, debit, credit);
  }

  public static LedgerEntry debit(String accountCode, BigDecimal amount) {
    return new LedgerEntry(accountCode, amount, null);
  }

  public static LedgerEntry credit(String accountCode, BigDecimal amount) {
    return new LedgerEntry(accountCode, null, amount);
  }
}
