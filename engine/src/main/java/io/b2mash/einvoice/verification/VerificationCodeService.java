package io.b2mash.einvoice.verification;

import io.b2mash.einvoice.config.ComplianceProperties;
import io.b2mash.einvoice.money.MoneyRounding;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import org.springframework.stereotype.Service;

/**
 * Builds QR payloads that let a recipient verify a document on the regulator's portal. The
 * payload carries the ETTN plus the first 16 hex characters of a SHA-256 digest over the
 * identifying fields, so tampering with any of them is detectable without the document body.
 */
@Service
public class VerificationCodeService {

  static final int DIGEST_PREFIX_LENGTH = 16;

  /** Millisecond-precision UTC timestamp, e.g. {@code 2024-01-15T10:30:00.000Z}. */
  private static final DateTimeFormatter ISSUED_AT_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  private final ComplianceProperties properties;

  public VerificationCodeService(ComplianceProperties properties) {
    this.properties = properties;
  }

  public String generateArchiveQrPayload(ArchiveQrRequest request) {
    requireTransactionId(request.transactionId());
    String digest =
        digestPrefix(
            request.transactionId()
                + request.taxId()
                + ISSUED_AT_FORMAT.format(request.issuedAt())
                + MoneyRounding.toPlainString(request.amount()));
    return properties.archiveVerificationUrl()
        + "?ettn="
        + request.transactionId()
        + "&hmac="
        + digest;
  }

  public String generateInvoiceQrPayload(InvoiceQrRequest request) {
    requireTransactionId(request.transactionId());
    String digest =
        digestPrefix(
            request.transactionId()
                + request.senderTaxId()
                + request.receiverTaxId()
                + DateTimeFormatter.BASIC_ISO_DATE.format(request.issueDate()));
    return properties.invoiceVerificationUrl()
        + "?ettn="
        + request.transactionId()
        + "&h="
        + digest;
  }

  static String digestPrefix(String input) {
    return sha256Hex(input.getBytes(StandardCharsets.UTF_8)).substring(0, DIGEST_PREFIX_LENGTH);
  }

  private static String sha256Hex(byte[] data) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(data));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  private static void requireTransactionId(String transactionId) {
    if (!TransactionIdGenerator.isValidTransactionId(transactionId)) {
      throw new IllegalArgumentException("Not a valid ETTN: " + transactionId);
    }
  }
}
