package io.b2mash.einvoice.error;

import io.b2mash.einvoice.config.ComplianceProperties;
import io.b2mash.einvoice.i18n.ComplianceMessages;
import io.b2mash.einvoice.i18n.MessageLocale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns raw regulator error codes into user-facing messages. Codes missing from {@link
 * RegulatorErrorCode} degrade to a generic "unknown error" text with {@link Severity#ERROR}.
 */
@Service
public class ErrorCatalog {

  private static final Logger log = LoggerFactory.getLogger(ErrorCatalog.class);

  private final ComplianceProperties properties;
  private final ComplianceMessages messages;

  public ErrorCatalog(ComplianceProperties properties, ComplianceMessages messages) {
    this.properties = properties;
    this.messages = messages;
  }

  public TranslatedError translateErrorCode(String code) {
    return translateErrorCode(code, properties.defaultLocale());
  }

  public TranslatedError translateErrorCode(String code, MessageLocale locale) {
    Objects.requireNonNull(locale, "locale must not be null");
    return RegulatorErrorCode.fromCode(code)
        .map(known -> new TranslatedError(known.message(locale), known.severity()))
        .orElseGet(
            () -> {
              log.warn("Unrecognized regulator error code: {}", code);
              return new TranslatedError(
                  messages.get("error.unknown", locale, String.valueOf(code)), Severity.ERROR);
            });
  }
}
