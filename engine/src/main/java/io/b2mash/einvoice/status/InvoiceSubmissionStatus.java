package io.b2mash.einvoice.status;

import java.util.Optional;

/** e-Fatura submission states. */
public enum InvoiceSubmissionStatus implements RegulatorStatus {
  DRAFT,
  QUEUED,
  SENDING,
  SENT,
  DELIVERED,
  ACCEPTED,
  REJECTED,
  CANCELLED,
  WAITING_RESPONSE,
  FAILED;

  @Override
  public String code() {
    return name();
  }

  /** Maps an internal invoice state; empty when the internal state has no e-Fatura counterpart. */
  static Optional<InvoiceSubmissionStatus> fromInternal(String internalStatus) {
    return switch (internalStatus) {
      case "DRAFT" -> Optional.of(DRAFT);
      case "PENDING" -> Optional.of(QUEUED);
      case "SUBMITTED" -> Optional.of(SENT);
      case "ACCEPTED" -> Optional.of(ACCEPTED);
      case "REJECTED" -> Optional.of(REJECTED);
      case "CANCELLED" -> Optional.of(CANCELLED);
      case "FAILED" -> Optional.of(FAILED);
      default -> Optional.empty();
    };
  }
}
