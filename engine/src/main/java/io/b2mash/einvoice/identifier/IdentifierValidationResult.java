package io.b2mash.einvoice.identifier;

/**
 * Outcome of a tax identifier check. {@code kind} is only set to a concrete kind when the
 * identifier passed; failed checks always report {@link TaxIdentifierKind#UNKNOWN}.
 */
public record IdentifierValidationResult(boolean valid, TaxIdentifierKind kind, String error) {

  static IdentifierValidationResult valid(TaxIdentifierKind kind) {
    return new IdentifierValidationResult(true, kind, null);
  }

  static IdentifierValidationResult invalid(String error) {
    return new IdentifierValidationResult(false, TaxIdentifierKind.UNKNOWN, error);
  }
}
