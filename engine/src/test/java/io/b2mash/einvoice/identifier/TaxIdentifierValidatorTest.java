package io.b2mash.einvoice.identifier;

import static io.b2mash.einvoice.testutil.TestComplianceFactory.VALID_TCKN;
import static io.b2mash.einvoice.testutil.TestComplianceFactory.VALID_TCKN_2;
import static io.b2mash.einvoice.testutil.TestComplianceFactory.VALID_VKN;
import static io.b2mash.einvoice.testutil.TestComplianceFactory.VALID_VKN_2;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.einvoice.i18n.MessageLocale;
import io.b2mash.einvoice.testutil.TestComplianceFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TaxIdentifierValidatorTest {

  private final TaxIdentifierValidator validator = TestComplianceFactory.identifierValidator();

  // --- VKN ---

  @ParameterizedTest
  @ValueSource(strings = {VALID_VKN, VALID_VKN_2, "0012345672", "4567890128"})
  void validateOrganization_acceptsValidVkn(String vkn) {
    var result = validator.validateOrganization(vkn);

    assertThat(result.valid()).isTrue();
    assertThat(result.kind()).isEqualTo(TaxIdentifierKind.ORGANIZATION);
    assertThat(result.error()).isNull();
  }

  @Test
  void validateOrganization_ignoresWhitespace() {
    assertThat(validator.validateOrganization(" 123 456 7890 ").valid()).isTrue();
  }

  @Test
  void validateOrganization_rejectsWrongCheckDigit() {
    var result = validator.validateOrganization("1234567891");

    assertThat(result.valid()).isFalse();
    assertThat(result.kind()).isEqualTo(TaxIdentifierKind.UNKNOWN);
    assertThat(result.error()).isEqualTo("VKN kontrol hanesi geçersiz");
  }

  @Test
  void validateOrganization_rejectsNonDigits() {
    var result = validator.validateOrganization("12345678AB");

    assertThat(result.valid()).isFalse();
    assertThat(result.error()).isEqualTo("VKN 10 haneli rakam olmalıdır");
  }

  @Test
  void validateOrganization_rejectsWrongLength() {
    assertThat(validator.validateOrganization("123456789").valid()).isFalse();
  }

  @Test
  void validateOrganization_blank_reportsEmpty() {
    assertThat(validator.validateOrganization("   ").error()).isEqualTo("VKN boş olamaz");
    assertThat(validator.validateOrganization(null).error()).isEqualTo("VKN boş olamaz");
  }

  @Test
  void validateOrganization_secondaryLocale_reportsEnglish() {
    var result = validator.validateOrganization("1234567891", MessageLocale.SECONDARY);

    assertThat(result.error()).isEqualTo("VKN check digit is invalid");
  }

  @Test
  void validateOrganization_everySingleDigitMutationIsDetected() {
    for (String vkn : new String[] {VALID_VKN, VALID_VKN_2}) {
      int mutations = 0;
      int detected = 0;
      for (int position = 0; position < vkn.length(); position++) {
        for (char digit = '0'; digit <= '9'; digit++) {
          if (vkn.charAt(position) == digit) {
            continue;
          }
          String mutated = vkn.substring(0, position) + digit + vkn.substring(position + 1);
          mutations++;
          if (!validator.validateOrganization(mutated).valid()) {
            detected++;
          }
        }
      }
      assertThat(detected).as("detected mutations of %s", vkn).isEqualTo(mutations);
    }
  }

  @Test
  void vknCheckDigit_matchesKnownIdentifiers() {
    assertThat(TaxIdentifierValidator.vknCheckDigit(new int[] {1, 2, 3, 4, 5, 6, 7, 8, 9}))
        .isZero();
    assertThat(TaxIdentifierValidator.vknCheckDigit(new int[] {1, 1, 1, 1, 1, 1, 1, 1, 1}))
        .isEqualTo(4);
  }

  // --- TCKN ---

  @ParameterizedTest
  @ValueSource(strings = {VALID_TCKN, VALID_TCKN_2, "98765432150"})
  void validateIndividual_acceptsValidTckn(String tckn) {
    var result = validator.validateIndividual(tckn);

    assertThat(result.valid()).isTrue();
    assertThat(result.kind()).isEqualTo(TaxIdentifierKind.INDIVIDUAL);
  }

  @Test
  void validateIndividual_rejectsLeadingZero() {
    var result = validator.validateIndividual("01234567890");

    assertThat(result.valid()).isFalse();
    assertThat(result.error()).isEqualTo("TCKN 0 ile başlayamaz");
  }

  @Test
  void validateIndividual_rejectsWrongTenthDigit() {
    var result = validator.validateIndividual("10000000156");

    assertThat(result.valid()).isFalse();
    assertThat(result.error()).isEqualTo("TCKN 10. hane kontrol hatası");
  }

  @Test
  void validateIndividual_rejectsWrongEleventhDigit() {
    var result = validator.validateIndividual("10000000147");

    assertThat(result.valid()).isFalse();
    assertThat(result.error()).isEqualTo("TCKN 11. hane kontrol hatası");
  }

  @Test
  void validateIndividual_rejectsNonDigits() {
    assertThat(validator.validateIndividual("1000000014a").error())
        .isEqualTo("TCKN 11 haneli rakam olmalıdır");
  }

  @Test
  void tcknCheckDigits_negativeWeightedDifferenceWrapsIntoRange() {
    // oddSum * 7 - evenSum = 1 * 7 - 36 = -29, so the tenth digit is 1
    int[] digits = {1, 9, 0, 9, 0, 9, 0, 9, 0, 1, 8};

    assertThat(TaxIdentifierValidator.tcknCheckDigits(digits)).containsExactly(1, 8);
    assertThat(validator.validateIndividual("19090909018").valid()).isTrue();
  }

  @Test
  void validateIndividual_everySingleDigitMutationIsMostlyDetected() {
    int mutations = 0;
    int detected = 0;
    for (int position = 0; position < VALID_TCKN_2.length(); position++) {
      for (char digit = '0'; digit <= '9'; digit++) {
        if (VALID_TCKN_2.charAt(position) == digit) {
          continue;
        }
        String mutated =
            VALID_TCKN_2.substring(0, position) + digit + VALID_TCKN_2.substring(position + 1);
        mutations++;
        if (!validator.validateIndividual(mutated).valid()) {
          detected++;
        }
      }
    }
    assertThat(detected * 10).isGreaterThanOrEqualTo(mutations * 9);
  }

  // --- classification ---

  @Test
  void classifyAndValidate_tenDigits_isOrganization() {
    var result = validator.classifyAndValidate(VALID_VKN);

    assertThat(result.valid()).isTrue();
    assertThat(result.kind()).isEqualTo(TaxIdentifierKind.ORGANIZATION);
  }

  @Test
  void classifyAndValidate_elevenDigits_isIndividual() {
    var result = validator.classifyAndValidate("100 000 001 46");

    assertThat(result.valid()).isTrue();
    assertThat(result.kind()).isEqualTo(TaxIdentifierKind.INDIVIDUAL);
  }

  @Test
  void classifyAndValidate_nonBreakingSpaces_areIgnored() {
    var organization = validator.classifyAndValidate("123\u00A0456\u00A07890");
    var individual = validator.classifyAndValidate("100\u2007000\u00A0001\u202F46");

    assertThat(organization.valid()).isTrue();
    assertThat(organization.kind()).isEqualTo(TaxIdentifierKind.ORGANIZATION);
    assertThat(individual.valid()).isTrue();
    assertThat(individual.kind()).isEqualTo(TaxIdentifierKind.INDIVIDUAL);
  }

  @Test
  void classifyAndValidate_invalidChecksum_isUnknown() {
    var result = validator.classifyAndValidate("1234567891");

    assertThat(result.valid()).isFalse();
    assertThat(result.kind()).isEqualTo(TaxIdentifierKind.UNKNOWN);
    assertThat(result.error()).isEqualTo("VKN kontrol hanesi geçersiz");
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "123", "123456789012"})
  void classifyAndValidate_otherLengths_reportLengthError(String taxId) {
    var result = validator.classifyAndValidate(taxId);

    assertThat(result.valid()).isFalse();
    assertThat(result.kind()).isEqualTo(TaxIdentifierKind.UNKNOWN);
    assertThat(result.error()).isEqualTo("Vergi kimlik numarası 10 veya 11 haneli olmalıdır");
  }

  @Test
  void classifyAndValidate_null_reportsLengthErrorInsteadOfThrowing() {
    assertThat(validator.classifyAndValidate(null, MessageLocale.SECONDARY).error())
        .isEqualTo("Tax identifier must be 10 or 11 digits");
  }
}
