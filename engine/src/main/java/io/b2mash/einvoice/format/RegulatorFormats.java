package io.b2mash.einvoice.format;

import io.b2mash.einvoice.money.MoneyRounding;
import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Objects;

/** Text renderings the regulator's APIs and Turkish-language documents expect. */
public final class RegulatorFormats {

  /** Türkiye has been on a fixed UTC+3 offset since 2016. */
  public static final ZoneOffset TURKEY_OFFSET = ZoneOffset.ofHours(3);

  private static final Locale TURKISH = Locale.forLanguageTag("tr-TR");
  private static final DateTimeFormatter DATE_TIME_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSXXX");

  private RegulatorFormats() {}

  /** {@code 1234567.8 -> "1.234.567,80"}. */
  public static String formatAmount(BigDecimal amount) {
    Objects.requireNonNull(amount, "amount must not be null");
    // DecimalFormat is not thread-safe
    var format = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(TURKISH));
    format.setRoundingMode(MoneyRounding.MODE);
    return format.format(amount);
  }

  /** {@code yyyy-MM-dd}. */
  public static String formatDate(LocalDate date) {
    Objects.requireNonNull(date, "date must not be null");
    return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
  }

  /** The calendar date of {@code instant} in Türkiye. */
  public static String formatDate(Instant instant) {
    Objects.requireNonNull(instant, "instant must not be null");
    return formatDate(instant.atOffset(TURKEY_OFFSET).toLocalDate());
  }

  /**
   * ISO-8601 in Türkiye's offset with millisecond precision, e.g. {@code
   * 2024-01-15T13:30:00.000+03:00}.
   */
  public static String formatDateTime(Instant instant) {
    Objects.requireNonNull(instant, "instant must not be null");
    return DATE_TIME_FORMAT.format(
        instant.truncatedTo(ChronoUnit.MILLIS).atOffset(TURKEY_OFFSET));
  }
}
