package io.b2mash.einvoice.i18n;

import java.util.Locale;

/** The two languages diagnostics are produced in. Turkish is the regulator's language. */
public enum MessageLocale {
  PRIMARY(Locale.forLanguageTag("tr-TR")),
  SECONDARY(Locale.ENGLISH);

  private final Locale locale;

  MessageLocale(Locale locale) {
    this.locale = locale;
  }

  public Locale locale() {
    return locale;
  }
}
