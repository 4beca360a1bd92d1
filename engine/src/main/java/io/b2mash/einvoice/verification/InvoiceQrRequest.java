package io.b2mash.einvoice.verification;

import java.time.LocalDate;
import java.util.Objects;

/** Fields an e-Fatura QR payload is derived from. */
public record InvoiceQrRequest(
    String transactionId, String senderTaxId, String receiverTaxId, LocalDate issueDate) {

  public InvoiceQrRequest {
    Objects.requireNonNull(transactionId, "transactionId must not be null");
    Objects.requireNonNull(senderTaxId, "senderTaxId must not be null");
    Objects.requireNonNull(receiverTaxId, "receiverTaxId must not be null");
    Objects.requireNonNull(issueDate, "issueDate must not be null");
  }
}
