package io.b2mash.einvoice.status;

import java.util.Optional;

/** e-Arşiv invoice states. */
public enum ArchiveStatus implements RegulatorStatus {
  DRAFT,
  ARCHIVED,
  SENT_TO_CUSTOMER,
  CANCELLED,
  FAILED;

  @Override
  public String code() {
    return name();
  }

  static Optional<ArchiveStatus> fromInternal(String internalStatus) {
    return switch (internalStatus) {
      case "DRAFT" -> Optional.of(DRAFT);
      case "ARCHIVED" -> Optional.of(ARCHIVED);
      case "SENT" -> Optional.of(SENT_TO_CUSTOMER);
      case "CANCELLED" -> Optional.of(CANCELLED);
      case "FAILED" -> Optional.of(FAILED);
      default -> Optional.empty();
    };
  }
}
