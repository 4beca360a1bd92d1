package io.b2mash.einvoice.identifier;

import io.b2mash.einvoice.config.ComplianceProperties;
import io.b2mash.einvoice.i18n.ComplianceMessages;
import io.b2mash.einvoice.i18n.MessageLocale;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Validates Turkish tax identifiers: VKN (10 digits, organizations) and TCKN (11 digits,
 * individuals). Whitespace is ignored, including Unicode spaces such as U+00A0; any other
 * non-digit character fails the check.
 *
 * <p>Invalid input never throws. The result carries a localized reason instead.
 */
@Service
public class TaxIdentifierValidator {

  private static final Logger log = LoggerFactory.getLogger(TaxIdentifierValidator.class);

  private static final Pattern VKN_PATTERN = Pattern.compile("\\d{10}");
  private static final Pattern TCKN_PATTERN = Pattern.compile("\\d{11}");
  private static final Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  private final ComplianceProperties properties;
  private final ComplianceMessages messages;

  public TaxIdentifierValidator(ComplianceProperties properties, ComplianceMessages messages) {
    this.properties = properties;
    this.messages = messages;
  }

  public IdentifierValidationResult validateOrganization(String vkn) {
    return validateOrganization(vkn, properties.defaultLocale());
  }

  public IdentifierValidationResult validateOrganization(String vkn, MessageLocale locale) {
    if (vkn == null || vkn.isBlank()) {
      return reject("identifier.vkn.blank", locale);
    }
    String clean = strip(vkn);
    if (!VKN_PATTERN.matcher(clean).matches()) {
      return reject("identifier.vkn.format", locale);
    }

    int[] digits = digitsOf(clean);
    if (digits[9] != vknCheckDigit(digits)) {
      return reject("identifier.vkn.checksum", locale);
    }
    return IdentifierValidationResult.valid(TaxIdentifierKind.ORGANIZATION);
  }

  public IdentifierValidationResult validateIndividual(String tckn) {
    return validateIndividual(tckn, properties.defaultLocale());
  }

  public IdentifierValidationResult validateIndividual(String tckn, MessageLocale locale) {
    if (tckn == null || tckn.isBlank()) {
      return reject("identifier.tckn.blank", locale);
    }
    String clean = strip(tckn);
    if (!TCKN_PATTERN.matcher(clean).matches()) {
      return reject("identifier.tckn.format", locale);
    }
    if (clean.charAt(0) == '0') {
      return reject("identifier.tckn.leadingZero", locale);
    }

    int[] digits = digitsOf(clean);
    int[] check = tcknCheckDigits(digits);
    if (digits[9] != check[0]) {
      return reject("identifier.tckn.checksum10", locale);
    }
    if (digits[10] != check[1]) {
      return reject("identifier.tckn.checksum11", locale);
    }
    return IdentifierValidationResult.valid(TaxIdentifierKind.INDIVIDUAL);
  }

  /** Dispatches on the cleaned length: 10 digits is a VKN, 11 a TCKN, anything else fails. */
  public IdentifierValidationResult classifyAndValidate(String taxId) {
    return classifyAndValidate(taxId, properties.defaultLocale());
  }

  public IdentifierValidationResult classifyAndValidate(String taxId, MessageLocale locale) {
    String clean = taxId == null ? "" : strip(taxId);
    return switch (clean.length()) {
      case 10 -> validateOrganization(clean, locale);
      case 11 -> validateIndividual(clean, locale);
      default -> reject("identifier.length", locale);
    };
  }

  /**
   * VKN check digit over the first nine digits. Each digit is shifted by its position (mod 10),
   * then weighted by a power of two (mod 9); a shifted value of 9 counts as 9.
   */
  static int vknCheckDigit(int[] digits) {
    int sum = 0;
    for (int i = 0; i < 9; i++) {
      int shifted = (digits[i] + 10 - (i + 1)) % 10;
      sum += shifted == 9 ? shifted : (shifted * (1 << (9 - i))) % 9;
    }
    return (10 - (sum % 10)) % 10;
  }

  /** TCKN 10th and 11th digits, computed from the odd- and even-position sums. */
  static int[] tcknCheckDigits(int[] digits) {
    int oddSum = digits[0] + digits[2] + digits[4] + digits[6] + digits[8];
    int evenSum = digits[1] + digits[3] + digits[5] + digits[7];
    int tenth = Math.floorMod(oddSum * 7 - evenSum, 10);
    int eleventh = (oddSum + evenSum + digits[9]) % 10;
    return new int[] {tenth, eleventh};
  }

  private IdentifierValidationResult reject(String key, MessageLocale locale) {
    String error = messages.get(key, locale);
    log.debug("Tax identifier rejected: {}", key);
    return IdentifierValidationResult.invalid(error);
  }

  private static String strip(String value) {
    return WHITESPACE.matcher(value).replaceAll("");
  }

  private static int[] digitsOf(String clean) {
    int[] digits = new int[clean.length()];
    for (int i = 0; i < digits.length; i++) {
      digits[i] = clean.charAt(i) - '0';
    }
    return digits;
  }
}
