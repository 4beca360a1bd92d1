package io.b2mash.einvoice.precheck;

import io.b2mash.einvoice.config.ComplianceProperties;
import io.b2mash.einvoice.error.Severity;
import io.b2mash.einvoice.format.RegulatorFormats;
import io.b2mash.einvoice.i18n.ComplianceMessages;
import io.b2mash.einvoice.i18n.MessageLocale;
import io.b2mash.einvoice.identifier.IdentifierValidationResult;
import io.b2mash.einvoice.identifier.TaxIdentifierValidator;
import io.b2mash.einvoice.reporting.BaBsReportingService;
import io.b2mash.einvoice.tax.TotalsValidationResult;
import io.b2mash.einvoice.tax.VatCalculationService;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs every check a document must pass before it is handed to the regulator-communication layer.
 * Checks never short-circuit: the caller gets the full list, in a stable order.
 *
 * <ol>
 *   <li>{@code supplier_tax_id}: seller VKN present and valid (ERROR)
 *   <li>{@code customer_tax_id}: buyer VKN/TCKN valid (ERROR); absent means e-Arşiv (WARNING)
 *   <li>{@code invoice_totals}: declared totals match the lines, one check per mismatch (ERROR)
 *   <li>{@code line_items}: at least one line (ERROR)
 *   <li>{@code issue_date_age}: issue date within the accepted window (WARNING)
 *   <li>{@code babs_counterparty}: Ba-Bs relevant totals name the buyer (WARNING)
 * </ol>
 */
@Service
public class SubmissionPrecheckService {

  private static final Logger log = LoggerFactory.getLogger(SubmissionPrecheckService.class);

  private final TaxIdentifierValidator identifierValidator;
  private final VatCalculationService vatCalculationService;
  private final BaBsReportingService baBsReportingService;
  private final ComplianceProperties properties;
  private final ComplianceMessages messages;
  private final Clock clock;

  public SubmissionPrecheckService(
      TaxIdentifierValidator identifierValidator,
      VatCalculationService vatCalculationService,
      BaBsReportingService baBsReportingService,
      ComplianceProperties properties,
      ComplianceMessages messages,
      Clock clock) {
    this.identifierValidator = identifierValidator;
    this.vatCalculationService = vatCalculationService;
    this.baBsReportingService = baBsReportingService;
    this.properties = properties;
    this.messages = messages;
    this.clock = clock;
  }

  public List<ValidationCheck> precheck(SubmissionCandidate candidate) {
    return precheck(candidate, properties.defaultLocale());
  }

  public List<ValidationCheck> precheck(SubmissionCandidate candidate, MessageLocale locale) {
    Objects.requireNonNull(candidate, "candidate must not be null");
    Objects.requireNonNull(locale, "locale must not be null");

    var checks = new ArrayList<ValidationCheck>();
    checks.add(checkSupplierTaxId(candidate, locale));
    checks.add(checkCustomerTaxId(candidate, locale));
    checks.addAll(checkTotals(candidate, locale));
    checks.add(checkLineItems(candidate, locale));
    checks.add(checkIssueDateAge(candidate, locale));
    checks.add(checkBaBsCounterparty(candidate, locale));

    if (log.isInfoEnabled()) {
      long failed = checks.stream().filter(c -> !c.passed()).count();
      log.info(
          "Submission pre-check finished: {} checks, {} failed, blocking={}",
          checks.size(),
          failed,
          hasBlockingFailures(checks));
    }
    return checks;
  }

  public boolean hasBlockingFailures(List<ValidationCheck> checks) {
    return checks.stream().anyMatch(c -> c.severity() == Severity.ERROR && !c.passed());
  }

  private ValidationCheck checkSupplierTaxId(SubmissionCandidate candidate, MessageLocale locale) {
    String supplier = candidate.supplierTaxId();
    if (supplier == null || supplier.isBlank()) {
      return new ValidationCheck(
          "supplier_tax_id",
          Severity.ERROR,
          false,
          messages.get("precheck.supplier.missing", locale));
    }
    IdentifierValidationResult result = identifierValidator.classifyAndValidate(supplier, locale);
    return new ValidationCheck(
        "supplier_tax_id",
        Severity.ERROR,
        result.valid(),
        result.valid()
            ? messages.get("precheck.supplier.valid", locale)
            : messages.get("precheck.supplier.invalid", locale, result.error()));
  }

  private ValidationCheck checkCustomerTaxId(SubmissionCandidate candidate, MessageLocale locale) {
    if (!candidate.hasCustomerTaxId()) {
      return new ValidationCheck(
          "customer_tax_id",
          Severity.WARNING,
          false,
          messages.get("precheck.customer.missing", locale));
    }
    IdentifierValidationResult result =
        identifierValidator.classifyAndValidate(candidate.customerTaxId(), locale);
    return new ValidationCheck(
        "customer_tax_id",
        Severity.ERROR,
        result.valid(),
        result.valid()
            ? messages.get("precheck.customer.valid", locale)
            : messages.get("precheck.customer.invalid", locale, result.error()));
  }

  private List<ValidationCheck> checkTotals(SubmissionCandidate candidate, MessageLocale locale) {
    TotalsValidationResult totals =
        vatCalculationService.validateInvoiceTotals(
            candidate.lines(), candidate.declaredTotals(), properties.tolerance(), locale);
    if (totals.valid()) {
      return List.of(
          new ValidationCheck(
              "invoice_totals",
              Severity.ERROR,
              true,
              messages.get("precheck.totals.valid", locale)));
    }
    return totals.errors().stream()
        .map(error -> new ValidationCheck("invoice_totals", Severity.ERROR, false, error))
        .toList();
  }

  private ValidationCheck checkLineItems(SubmissionCandidate candidate, MessageLocale locale) {
    boolean passed = !candidate.lines().isEmpty();
    return new ValidationCheck(
        "line_items",
        Severity.ERROR,
        passed,
        messages.get(passed ? "precheck.lines.present" : "precheck.lines.missing", locale));
  }

  private ValidationCheck checkIssueDateAge(SubmissionCandidate candidate, MessageLocale locale) {
    // issue dates are Turkish calendar days, whatever zone the clock carries
    LocalDate today = LocalDate.ofInstant(clock.instant(), RegulatorFormats.TURKEY_OFFSET);
    long ageDays = ChronoUnit.DAYS.between(candidate.issueDate(), today);
    boolean passed = ageDays <= properties.maxIssueAgeDays();
    return new ValidationCheck(
        "issue_date_age",
        Severity.WARNING,
        passed,
        passed
            ? messages.get("precheck.issueDate.fresh", locale)
            : messages.get(
                "precheck.issueDate.stale", locale, String.valueOf(properties.maxIssueAgeDays())));
  }

  private ValidationCheck checkBaBsCounterparty(
      SubmissionCandidate candidate, MessageLocale locale) {
    boolean passed =
        candidate.hasCustomerTaxId()
            || !baBsReportingService.requiresReporting(candidate.declaredTotals().total());
    return new ValidationCheck(
        "babs_counterparty",
        Severity.WARNING,
        passed,
        messages.get(passed ? "precheck.babs.ok" : "precheck.babs.counterpartyMissing", locale));
  }
}
