package io.b2mash.einvoice.status;

import java.util.Optional;

/**
 * e-Defter states. {@link #PENDING_CORRECTION} is only ever reported by the regulator; no internal
 * state maps to it.
 */
public enum LedgerSubmissionStatus implements RegulatorStatus {
  DRAFT,
  GENERATED,
  VALIDATED,
  SUBMITTED,
  ACCEPTED,
  REJECTED,
  PENDING_CORRECTION;

  @Override
  public String code() {
    return name();
  }

  static Optional<LedgerSubmissionStatus> fromInternal(String internalStatus) {
    return switch (internalStatus) {
      case "DRAFT" -> Optional.of(DRAFT);
      case "GENERATED" -> Optional.of(GENERATED);
      case "VALIDATED" -> Optional.of(VALIDATED);
      case "SUBMITTED" -> Optional.of(SUBMITTED);
      case "ACCEPTED" -> Optional.of(ACCEPTED);
      case "REJECTED" -> Optional.of(REJECTED);
      default -> Optional.empty();
    };
  }
}
