package io.b2mash.einvoice.tax;

import static io.b2mash.einvoice.testutil.TestComplianceFactory.line;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.einvoice.i18n.MessageLocale;
import io.b2mash.einvoice.testutil.TestComplianceFactory;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class VatCalculationServiceTest {

  private final VatCalculationService service = TestComplianceFactory.vatCalculationService();

  // --- computeVat ---

  @Test
  void computeVat_exclusive_standardRate() {
    var breakdown = service.computeVat(new BigDecimal("100"), new BigDecimal("18"), false);

    assertThat(breakdown.taxBase()).isEqualByComparingTo(new BigDecimal("100.00"));
    assertThat(breakdown.taxAmount()).isEqualByComparingTo(new BigDecimal("18.00"));
    assertThat(breakdown.totalAmount()).isEqualByComparingTo(new BigDecimal("118.00"));
  }

  @Test
  void computeVat_inclusive_backsOutTaxBase() {
    var breakdown = service.computeVat(new BigDecimal("100"), new BigDecimal("18"), true);

    assertThat(breakdown.taxBase()).isEqualByComparingTo(new BigDecimal("84.75"));
    assertThat(breakdown.taxAmount()).isEqualByComparingTo(new BigDecimal("15.25"));
    assertThat(breakdown.totalAmount()).isEqualByComparingTo(new BigDecimal("100.00"));
  }

  @Test
  void computeVat_inclusive_roundsTaxAsRemainder() {
    var breakdown = service.computeVat(new BigDecimal("1000"), new BigDecimal("20"), true);

    assertThat(breakdown.taxBase()).isEqualByComparingTo(new BigDecimal("833.33"));
    assertThat(breakdown.taxAmount()).isEqualByComparingTo(new BigDecimal("166.67"));
    assertThat(breakdown.taxBase().add(breakdown.taxAmount()))
        .isEqualByComparingTo(breakdown.totalAmount());
  }

  @Test
  void computeVat_resultsCarryScaleTwo() {
    var breakdown = service.computeVat(new BigDecimal("33.33"), new BigDecimal("8"), false);

    assertThat(breakdown.taxBase().scale()).isEqualTo(2);
    assertThat(breakdown.taxAmount().scale()).isEqualTo(2);
    assertThat(breakdown.totalAmount().scale()).isEqualTo(2);
    assertThat(breakdown.taxAmount()).isEqualByComparingTo(new BigDecimal("2.67"));
    assertThat(breakdown.totalAmount()).isEqualByComparingTo(new BigDecimal("36.00"));
  }

  @Test
  void computeVat_inclusiveOfOwnTotal_reproducesTaxBase() {
    var forward = service.computeVat(new BigDecimal("33.33"), new BigDecimal("8"), false);
    var backward = service.computeVat(forward.totalAmount(), new BigDecimal("8"), true);

    assertThat(backward.taxBase().subtract(forward.taxBase()).abs())
        .isLessThanOrEqualTo(new BigDecimal("0.01"));
  }

  @Test
  void computeVat_zeroRate_taxIsZero() {
    var breakdown = service.computeVat(new BigDecimal("250.00"), BigDecimal.ZERO, true);

    assertThat(breakdown.taxAmount()).isEqualByComparingTo(BigDecimal.ZERO);
    assertThat(breakdown.taxBase()).isEqualByComparingTo(new BigDecimal("250.00"));
  }

  @Test
  void computeVat_negativeRate_throws() {
    assertThatThrownBy(() -> service.computeVat(BigDecimal.TEN, new BigDecimal("-1"), false))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("-1");
  }

  // --- validateInvoiceTotals ---

  @Test
  void validateInvoiceTotals_matchingTotals_isValid() {
    var result =
        service.validateInvoiceTotals(
            List.of(line("2", "50", "18")),
            new DeclaredTotals(new BigDecimal("100"), new BigDecimal("18"), new BigDecimal("118")));

    assertThat(result.valid()).isTrue();
    assertThat(result.errors()).isEmpty();
    assertThat(result.computedTotal()).isEqualByComparingTo(new BigDecimal("118.00"));
  }

  @Test
  void validateInvoiceTotals_vatMismatch_reportsExactlyOneError() {
    var result =
        service.validateInvoiceTotals(
            List.of(line("2", "50", "18")),
            new DeclaredTotals(new BigDecimal("100"), new BigDecimal("20"), new BigDecimal("118")));

    assertThat(result.valid()).isFalse();
    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0))
        .isEqualTo("KDV uyuşmazlığı: Hesaplanan 18.00, Beyan edilen 20");
  }

  @Test
  void validateInvoiceTotals_secondaryLocale_reportsEnglish() {
    var result =
        service.validateInvoiceTotals(
            List.of(line("2", "50", "18")),
            new DeclaredTotals(new BigDecimal("100"), new BigDecimal("20"), new BigDecimal("118")),
            new BigDecimal("0.01"),
            MessageLocale.SECONDARY);

    assertThat(result.errors()).containsExactly("VAT mismatch: calculated 18.00, declared 20");
  }

  @Test
  void validateInvoiceTotals_allFieldsWrong_reportsThreeErrors() {
    var result =
        service.validateInvoiceTotals(
            List.of(line("1", "100", "20")),
            new DeclaredTotals(new BigDecimal("90"), new BigDecimal("10"), new BigDecimal("130")));

    assertThat(result.errors()).hasSize(3);
  }

  @Test
  void validateInvoiceTotals_differenceEqualToTolerance_isAccepted() {
    var result =
        service.validateInvoiceTotals(
            List.of(line("2", "50", "18")),
            new DeclaredTotals(
                new BigDecimal("100"), new BigDecimal("18.01"), new BigDecimal("118.01")));

    assertThat(result.valid()).isTrue();
  }

  @Test
  void validateInvoiceTotals_roundsSumsNotLines() {
    // ten lines of 0.15 at 8%: per-line VAT would round to 0.01 each (0.10),
    // the unrounded sum is 0.12
    List<InvoiceLineItem> lines = Collections.nCopies(10, line("1", "0.15", "8"));

    var result =
        service.validateInvoiceTotals(
            lines,
            new DeclaredTotals(
                new BigDecimal("1.50"), new BigDecimal("0.12"), new BigDecimal("1.62")));

    assertThat(result.valid()).isTrue();
    assertThat(result.computedVat()).isEqualByComparingTo(new BigDecimal("0.12"));
  }

  @Test
  void validateInvoiceTotals_mixedRates() {
    var result =
        service.validateInvoiceTotals(
            List.of(line("3", "10", "20"), line("1", "50", "10"), line("2", "5", "1")),
            new DeclaredTotals(
                new BigDecimal("90"), new BigDecimal("11.10"), new BigDecimal("101.10")));

    assertThat(result.valid()).isTrue();
  }

  @Test
  void validateInvoiceTotals_noLines_comparesAgainstZero() {
    var result =
        service.validateInvoiceTotals(
            List.of(), new DeclaredTotals(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO));

    assertThat(result.valid()).isTrue();
  }

  @Test
  void validateInvoiceTotals_negativeTolerance_throws() {
    assertThatThrownBy(
            () ->
                service.validateInvoiceTotals(
                    List.of(),
                    new DeclaredTotals(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO),
                    new BigDecimal("-0.01"),
                    MessageLocale.PRIMARY))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void invoiceLineItem_negativeRate_throws() {
    assertThatThrownBy(() -> line("1", "10", "-5")).isInstanceOf(IllegalArgumentException.class);
  }
}
