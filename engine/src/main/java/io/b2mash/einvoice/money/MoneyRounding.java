package io.b2mash.einvoice.money;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Kuruş-level rounding used for every monetary step: scale 2, HALF_UP. Callers round after each
 * arithmetic step, not only at the end, because that is how the regulator computes its figures.
 */
public final class MoneyRounding {

  public static final int SCALE = 2;
  public static final RoundingMode MODE = RoundingMode.HALF_UP;

  private MoneyRounding() {}

  public static BigDecimal round(BigDecimal amount) {
    return Objects.requireNonNull(amount, "amount must not be null").setScale(SCALE, MODE);
  }

  /** Treats a missing amount as zero; used where optional fields are summed. */
  public static BigDecimal orZero(BigDecimal amount) {
    return amount != null ? amount : BigDecimal.ZERO;
  }

  /**
   * Shortest plain decimal rendering ({@code 1180.50 -> "1180.5"}, {@code 100.00 -> "100"}), the
   * form amounts take inside verification digests.
   */
  public static String toPlainString(BigDecimal amount) {
    return Objects.requireNonNull(amount, "amount must not be null")
        .stripTrailingZeros()
        .toPlainString();
  }
}
