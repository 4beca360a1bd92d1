package io.b2mash.einvoice.verification;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/** Fields an e-Arşiv QR payload is derived from. */
public record ArchiveQrRequest(
    String transactionId, String taxId, Instant issuedAt, BigDecimal amount) {

  public ArchiveQrRequest {
    Objects.requireNonNull(transactionId, "transactionId must not be null");
    Objects.requireNonNull(taxId, "taxId must not be null");
    Objects.requireNonNull(issuedAt, "issuedAt must not be null");
    Objects.requireNonNull(amount, "amount must not be null");
  }
}
