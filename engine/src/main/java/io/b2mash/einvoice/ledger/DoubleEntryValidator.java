package io.b2mash.einvoice.ledger;

import io.b2mash.einvoice.config.ComplianceProperties;
import io.b2mash.einvoice.money.MoneyRounding;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Checks the double-entry invariant of an e-Defter journal entry: total debits (borç) equal total
 * credits (alacak). Both sums are rounded to kuruş before comparing; the entry balances when the
 * difference is strictly below the tolerance.
 */
@Service
public class DoubleEntryValidator {

  private static final Logger log = LoggerFactory.getLogger(DoubleEntryValidator.class);

  private final ComplianceProperties properties;

  public DoubleEntryValidator(ComplianceProperties properties) {
    this.properties = properties;
  }

  public LedgerBalance validateDoubleEntry(List<LedgerEntry> entries) {
    return validateDoubleEntry(entries, properties.tolerance());
  }

  public LedgerBalance validateDoubleEntry(List<LedgerEntry> entries, BigDecimal tolerance) {
    Objects.requireNonNull(entries, "entries must not be null");
    Objects.requireNonNull(tolerance, "tolerance must not be null");
    if (tolerance.signum() < 0) {
      throw new IllegalArgumentException("Tolerance must not be negative, got: " + tolerance);
    }

    BigDecimal totalDebit =
        MoneyRounding.round(
            entries.stream()
                .map(e -> MoneyRounding.orZero(e.debit()))
                .reduce(BigDecimal.ZERO, BigDecimal::add));
    BigDecimal totalCredit =
        MoneyRounding.round(
            entries.stream()
                .map(e -> MoneyRounding.orZero(e.credit()))
                .reduce(BigDecimal.ZERO, BigDecimal::add));
    BigDecimal difference = totalDebit.subtract(totalCredit).abs();
    boolean valid = difference.compareTo(tolerance) < 0;

    if (!valid) {
      log.debug(
          "Journal entry out of balance: debit={}, credit={}, difference={}",
          totalDebit,
          totalCredit,
          difference);
    }
    return new LedgerBalance(valid, totalDebit, totalCredit, difference);
  }
}
