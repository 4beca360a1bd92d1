package io.b2mash.einvoice.config;

import io.b2mash.einvoice.i18n.MessageLocale;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Engine-wide defaults. Every value here can also be overridden per call where the operation
 * accepts it.
 *
 * @param tolerance maximum accepted absolute difference between declared and computed amounts
 * @param defaultLocale language of diagnostics when the caller does not pick one
 * @param babsThreshold amount (TL) from which a transaction must be reported on Form Ba/Bs
 * @param archiveVerificationUrl e-Arşiv portal page the QR payload points to
 * @param invoiceVerificationUrl e-Fatura verification page the QR payload points to
 * @param maxIssueAgeDays issue dates older than this many days get a pre-check warning
 */
@Validated
@ConfigurationProperties(prefix = "einvoice.compliance")
public record ComplianceProperties(
    @DefaultValue("0.01") @NotNull @DecimalMin("0.00") BigDecimal tolerance,
    @DefaultValue("PRIMARY") @NotNull MessageLocale defaultLocale,
    @DefaultValue("5000") @NotNull @DecimalMin("0.00") BigDecimal babsThreshold,
    @DefaultValue(ComplianceProperties.ARCHIVE_VERIFICATION_URL) @NotBlank
        String archiveVerificationUrl,
    @DefaultValue(ComplianceProperties.INVOICE_VERIFICATION_URL) @NotBlank
        String invoiceVerificationUrl,
    @DefaultValue("7") @Min(0) int maxIssueAgeDays) {

  public static final String ARCHIVE_VERIFICATION_URL =
      "https://earsivportal.efatura.gov.tr/intragibi/pages/FaturaGoruntule.xhtml";
  public static final String INVOICE_VERIFICATION_URL = "https://efatura.gov.tr/verify";

  /** The values used when nothing is configured, for callers outside a Spring context. */
  public static ComplianceProperties defaults() {
    return new ComplianceProperties(
        new BigDecimal("0.01"),
        MessageLocale.PRIMARY,
        new BigDecimal("5000"),
        ARCHIVE_VERIFICATION_URL,
        INVOICE_VERIFICATION_URL,
        7);
  }
}
