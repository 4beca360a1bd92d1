package io.b2mash.einvoice.error;

import io.b2mash.einvoice.i18n.MessageLocale;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Error codes returned by GİB services, with their Turkish and English texts. */
public enum RegulatorErrorCode {
  // Authentication
  GIB_AUTH_001("Kimlik doğrulama başarısız", "Authentication failed", Severity.ERROR),
  GIB_AUTH_002("Oturum süresi doldu", "Session expired", Severity.WARNING),
  GIB_AUTH_003("Yetkisiz erişim", "Unauthorized access", Severity.ERROR),

  // VKN/TCKN
  GIB_VKN_001("Geçersiz VKN formatı", "Invalid VKN format", Severity.ERROR),
  GIB_VKN_002(
      "VKN GİB sisteminde kayıtlı değil", "VKN not registered in GİB system", Severity.ERROR),
  GIB_VKN_003("E-Fatura mükellefi değil", "Not an E-Fatura taxpayer", Severity.WARNING),

  // Invoice
  GIB_INV_001("Fatura formatı geçersiz", "Invalid invoice format", Severity.ERROR),
  GIB_INV_002(
      "Fatura numarası zaten kullanılmış", "Invoice number already used", Severity.ERROR),
  GIB_INV_003("Fatura tutarı hatalı", "Invalid invoice amount", Severity.ERROR),
  GIB_INV_004("KDV hesaplama hatası", "VAT calculation error", Severity.ERROR),
  GIB_INV_005("Zorunlu alan eksik", "Required field missing", Severity.ERROR),
  GIB_INV_006("Fatura iptal edilemez", "Invoice cannot be cancelled", Severity.ERROR),

  // e-Defter
  GIB_DEF_001("Dönem formatı hatalı", "Invalid period format", Severity.ERROR),
  GIB_DEF_002("Borç/Alacak dengesi bozuk", "Debit/Credit imbalance", Severity.ERROR),
  GIB_DEF_003("Önceki dönem eksik", "Previous period missing", Severity.ERROR),
  GIB_DEF_004("Defter zaten gönderilmiş", "Ledger already submitted", Severity.WARNING),

  // Network/system
  GIB_SYS_001(
      "GİB sistemi geçici olarak kullanılamıyor",
      "GİB system temporarily unavailable",
      Severity.WARNING),
  GIB_SYS_002("Bağlantı zaman aşımı", "Connection timeout", Severity.ERROR),
  GIB_SYS_003("Rate limit aşıldı", "Rate limit exceeded", Severity.WARNING);

  private static final Map<String, RegulatorErrorCode> BY_CODE =
      Arrays.stream(values())
          .collect(Collectors.toUnmodifiableMap(Enum::name, Function.identity()));

  private final String primaryMessage;
  private final String secondaryMessage;
  private final Severity severity;

  RegulatorErrorCode(String primaryMessage, String secondaryMessage, Severity severity) {
    this.primaryMessage = primaryMessage;
    this.secondaryMessage = secondaryMessage;
    this.severity = severity;
  }

  public static Optional<RegulatorErrorCode> fromCode(String code) {
    return Optional.ofNullable(code).map(BY_CODE::get);
  }

  public String message(MessageLocale locale) {
    return switch (locale) {
      case PRIMARY -> primaryMessage;
      case SECONDARY -> secondaryMessage;
    };
  }

  public Severity severity() {
    return severity;
  }
}
