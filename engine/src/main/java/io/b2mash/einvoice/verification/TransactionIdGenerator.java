package io.b2mash.einvoice.verification;

import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Produces the identifiers a document carries towards the regulator.
 *
 * <ul>
 *   <li>ETTN: a random (version 4) UUID rendered as 32 uppercase hex characters without dashes.
 *   <li>Invoice series id: 3-letter prefix + 4-digit year + 9-digit serial, e.g. {@code
 *       ABC2024000000001}.
 * </ul>
 */
public final class TransactionIdGenerator {

  private static final Pattern ETTN_PATTERN =
      Pattern.compile("[A-F0-9]{32}", Pattern.CASE_INSENSITIVE);

  static final char PREFIX_FILLER = 'X';
  static final int PREFIX_LENGTH = 3;
  static final int MAX_SERIAL = 999_999_999;

  private TransactionIdGenerator() {}

  /** Draws from {@link UUID#randomUUID()}, which is backed by a cryptographically strong RNG. */
  public static String generateTransactionId() {
    return UUID.randomUUID().toString().replace("-", "").toUpperCase(Locale.ROOT);
  }

  public static boolean isValidTransactionId(String candidate) {
    return candidate != null && ETTN_PATTERN.matcher(candidate).matches();
  }

  /**
   * Builds the human-readable invoice id. The prefix is uppercased, cut to three characters or
   * right-padded with {@code X}.
   *
   * @throws IllegalArgumentException if the year is not four digits or the serial does not fit in
   *     nine digits
   */
  public static String generateInvoiceSeriesId(String prefix, int year, long serial) {
    Objects.requireNonNull(prefix, "prefix must not be null");
    if (year < 1000 || year > 9999) {
      throw new IllegalArgumentException("Year must have four digits, got: " + year);
    }
    if (serial < 0 || serial > MAX_SERIAL) {
      throw new IllegalArgumentException(
          "Serial must be between 0 and " + MAX_SERIAL + ", got: " + serial);
    }
    return String.format("%s%04d%09d", normalizePrefix(prefix), year, serial);
  }

  private static String normalizePrefix(String prefix) {
    String upper = prefix.toUpperCase(Locale.ROOT);
    if (upper.length() >= PREFIX_LENGTH) {
      return upper.substring(0, PREFIX_LENGTH);
    }
    return upper + String.valueOf(PREFIX_FILLER).repeat(PREFIX_LENGTH - upper.length());
  }
}
