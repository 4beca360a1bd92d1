package io.b2mash.einvoice.reporting;

import java.time.LocalDate;
import java.util.Objects;

/** e-Defter reporting period length, and how a period identifier is spelled for it. */
public enum PeriodGranularity {
  /** {@code 2024-03}. */
  MONTHLY,

  /** {@code 2024-Q1}. */
  QUARTERLY,

  /** {@code 2024}. */
  YEARLY;

  /**
   * Formats the identifier of the period containing {@code date}.
   *
   * @param date any day within the period
   * @return the period identifier
   */
  public String periodId(LocalDate date) {
    Objects.requireNonNull(date, "date must not be null");
    int year = date.getYear();
    int month = date.getMonthValue();
    return switch (this) {
      case MONTHLY -> String.format("%04d-%02d", year, month);
      case QUARTERLY -> String.format("%04d-Q%d", year, (month + 2) / 3);
      case YEARLY -> String.format("%04d", year);
    };
  }
}
