package io.b2mash.einvoice.document;

import io.b2mash.einvoice.config.ComplianceProperties;
import io.b2mash.einvoice.i18n.ComplianceMessages;
import io.b2mash.einvoice.i18n.MessageLocale;
import java.util.ArrayList;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Shallow completeness check of a serialized UBL-TR invoice: every required element and namespace
 * must appear somewhere in the text. All missing markers are reported in one pass.
 *
 * <p>This is not schema validation. A document that passes can still be rejected by the
 * regulator's XSD and Schematron checks.
 */
@Service
public class DocumentStructureValidator {

  private static final Logger log = LoggerFactory.getLogger(DocumentStructureValidator.class);

  private final ComplianceProperties properties;
  private final ComplianceMessages messages;

  public DocumentStructureValidator(ComplianceProperties properties, ComplianceMessages messages) {
    this.properties = properties;
    this.messages = messages;
  }

  public StructureValidationResult validateDocumentStructure(String serializedXml) {
    return validateDocumentStructure(serializedXml, properties.defaultLocale());
  }

  public StructureValidationResult validateDocumentStructure(
      String serializedXml, MessageLocale locale) {
    Objects.requireNonNull(serializedXml, "serializedXml must not be null");

    var errors = new ArrayList<String>();
    for (RequiredMarker required : RequiredMarker.values()) {
      if (!serializedXml.contains(required.marker())) {
        errors.add(messages.get(required.messageKey(), locale, required.messageArgs()));
      }
    }

    if (!errors.isEmpty()) {
      log.debug("Invoice document is missing {} required marker(s)", errors.size());
    }
    return new StructureValidationResult(errors.isEmpty(), errors);
  }
}
