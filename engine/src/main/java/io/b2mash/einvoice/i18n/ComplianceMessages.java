package io.b2mash.einvoice.i18n;

import java.util.Objects;
import org.springframework.context.MessageSource;
import org.springframework.context.support.ResourceBundleMessageSource;
import org.springframework.stereotype.Component;

/**
 * Resolves localized diagnostic texts from the {@code i18n/einvoice-messages} bundle. The base
 * bundle is Turkish; English lives in the {@code _en} variant.
 *
 * <p>The engine keeps its own {@link MessageSource} so that a host application's message bundles
 * never shadow (or get shadowed by) these keys.
 */
@Component
public class ComplianceMessages {

  static final String BASENAME = "i18n/einvoice-messages";

  private final MessageSource messageSource;

  public ComplianceMessages() {
    this(defaultMessageSource());
  }

  ComplianceMessages(MessageSource messageSource) {
    this.messageSource = messageSource;
  }

  public String get(String key, MessageLocale locale, Object... args) {
    Objects.requireNonNull(locale, "locale must not be null");
    return messageSource.getMessage(key, args, locale.locale());
  }

  private static MessageSource defaultMessageSource() {
    var source = new ResourceBundleMessageSource();
    source.setBasename(BASENAME);
    source.setDefaultEncoding("UTF-8");
    // tr-TR must land on the Turkish base bundle, not on the JVM's default locale
    source.setFallbackToSystemLocale(false);
    return source;
  }
}
