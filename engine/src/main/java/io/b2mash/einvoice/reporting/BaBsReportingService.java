package io.b2mash.einvoice.reporting;

import io.b2mash.einvoice.config.ComplianceProperties;
import java.math.BigDecimal;
import java.util.Objects;
import org.springframework.stereotype.Service;

/**
 * Ba-Bs reporting obligation: purchases and sales with a counterparty reaching the threshold must
 * be declared on Form Ba / Form Bs.
 */
@Service
public class BaBsReportingService {

  private final ComplianceProperties properties;

  public BaBsReportingService(ComplianceProperties properties) {
    this.properties = properties;
  }

  public BigDecimal threshold() {
    return properties.babsThreshold();
  }

  /** Inclusive: an amount equal to the threshold must be reported. */
  public boolean requiresReporting(BigDecimal amount) {
    Objects.requireNonNull(amount, "amount must not be null");
    return amount.compareTo(threshold()) >= 0;
  }

  public String formCode(BaBsForm form) {
    return Objects.requireNonNull(form, "form must not be null").formCode();
  }
}
