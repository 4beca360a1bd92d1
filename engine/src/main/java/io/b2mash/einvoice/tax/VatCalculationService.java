package io.b2mash.einvoice.tax;

import static io.b2mash.einvoice.money.MoneyRounding.round;

import io.b2mash.einvoice.config.ComplianceProperties;
import io.b2mash.einvoice.i18n.ComplianceMessages;
import io.b2mash.einvoice.i18n.MessageLocale;
import io.b2mash.einvoice.money.MoneyRounding;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Stateless KDV (VAT) arithmetic and invoice totals reconciliation. */
@Service
public class VatCalculationService {

  private static final Logger log = LoggerFactory.getLogger(VatCalculationService.class);
  private static final BigDecimal HUNDRED = new BigDecimal("100");

  private final ComplianceProperties properties;
  private final ComplianceMessages messages;

  public VatCalculationService(ComplianceProperties properties, ComplianceMessages messages) {
    this.properties = properties;
    this.messages = messages;
  }

  /**
   * Splits an amount into tax base, VAT and total. Every intermediate value is rounded to scale 2
   * (HALF_UP) before the next step uses it.
   *
   * @param amount the VAT-inclusive total when {@code vatIncluded}, otherwise the tax base
   * @param vatRatePercent the rate as a percentage (e.g. 20 for 20%)
   * @param vatIncluded whether {@code amount} already contains VAT
   * @throws IllegalArgumentException if the rate is negative
   */
  public VatBreakdown computeVat(
      BigDecimal amount, BigDecimal vatRatePercent, boolean vatIncluded) {
    Objects.requireNonNull(amount, "amount must not be null");
    Objects.requireNonNull(vatRatePercent, "vatRatePercent must not be null");
    if (vatRatePercent.signum() < 0) {
      throw new IllegalArgumentException("VAT rate must not be negative, got: " + vatRatePercent);
    }

    BigDecimal rate = vatRatePercent.movePointLeft(2);
    if (vatIncluded) {
      BigDecimal total = round(amount);
      BigDecimal taxBase =
          total.divide(BigDecimal.ONE.add(rate), MoneyRounding.SCALE, MoneyRounding.MODE);
      BigDecimal taxAmount = round(total.subtract(taxBase));
      return new VatBreakdown(taxBase, taxAmount, total);
    }
    BigDecimal taxBase = round(amount);
    BigDecimal taxAmount = round(taxBase.multiply(rate));
    return new VatBreakdown(taxBase, taxAmount, round(taxBase.add(taxAmount)));
  }

  public TotalsValidationResult validateInvoiceTotals(
      List<InvoiceLineItem> lineItems, DeclaredTotals declared) {
    return validateInvoiceTotals(
        lineItems, declared, properties.tolerance(), properties.defaultLocale());
  }

  /**
   * Recomputes subtotal and VAT from the lines and compares them, and their sum, with the declared
   * figures. Sums are accumulated unrounded and rounded once at the end; per-line rounding would
   * drift by a kuruş on invoices with many small lines.
   *
   * @throws IllegalArgumentException if the tolerance is negative
   */
  public TotalsValidationResult validateInvoiceTotals(
      List<InvoiceLineItem> lineItems,
      DeclaredTotals declared,
      BigDecimal tolerance,
      MessageLocale locale) {
    Objects.requireNonNull(lineItems, "lineItems must not be null");
    Objects.requireNonNull(declared, "declared must not be null");
    Objects.requireNonNull(tolerance, "tolerance must not be null");
    if (tolerance.signum() < 0) {
      throw new IllegalArgumentException("Tolerance must not be negative, got: " + tolerance);
    }

    BigDecimal subtotal = BigDecimal.ZERO;
    BigDecimal vat = BigDecimal.ZERO;
    for (InvoiceLineItem item : lineItems) {
      BigDecimal lineTotal = item.lineTotal();
      subtotal = subtotal.add(lineTotal);
      vat = vat.add(lineTotal.multiply(item.vatRate()).divide(HUNDRED));
    }
    subtotal = round(subtotal);
    vat = round(vat);
    BigDecimal total = subtotal.add(vat);

    var errors = new ArrayList<String>();
    checkField(
        errors, "totals.subtotal.mismatch", subtotal, declared.subtotal(), tolerance, locale);
    checkField(errors, "totals.vat.mismatch", vat, declared.vat(), tolerance, locale);
    checkField(errors, "totals.total.mismatch", total, declared.total(), tolerance, locale);

    if (!errors.isEmpty()) {
      log.debug(
          "Invoice totals mismatch: computed subtotal={}, vat={}, total={}; declared {}",
          subtotal,
          vat,
          total,
          declared);
    }
    return new TotalsValidationResult(errors.isEmpty(), errors, subtotal, vat, total);
  }

  private void checkField(
      List<String> errors,
      String key,
      BigDecimal computed,
      BigDecimal declared,
      BigDecimal tolerance,
      MessageLocale locale) {
    if (computed.subtract(declared).abs().compareTo(tolerance) > 0) {
      errors.add(messages.get(key, locale, computed.toPlainString(), declared.toPlainString()));
    }
  }
}
