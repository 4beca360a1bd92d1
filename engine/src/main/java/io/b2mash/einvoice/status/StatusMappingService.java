package io.b2mash.einvoice.status;

import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Translates internal lifecycle states into the regulator's vocabulary for a document kind.
 * Unknown internal states pass through unchanged rather than failing.
 */
@Service
public class StatusMappingService {

  private static final Logger log = LoggerFactory.getLogger(StatusMappingService.class);

  public Optional<? extends RegulatorStatus> lookup(String internalStatus, DocumentKind kind) {
    Objects.requireNonNull(internalStatus, "internalStatus must not be null");
    Objects.requireNonNull(kind, "kind must not be null");
    return switch (kind) {
      case INVOICE -> InvoiceSubmissionStatus.fromInternal(internalStatus);
      case ARCHIVE -> ArchiveStatus.fromInternal(internalStatus);
      case LEDGER -> LedgerSubmissionStatus.fromInternal(internalStatus);
    };
  }

  public String mapInternalStatusToRegulatorStatus(String internalStatus, DocumentKind kind) {
    Optional<? extends RegulatorStatus> mapped = lookup(internalStatus, kind);
    if (mapped.isEmpty()) {
      log.debug("No {} mapping for internal status {}, passing it through", kind, internalStatus);
      return internalStatus;
    }
    return mapped.get().code();
  }
}
