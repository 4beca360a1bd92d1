package io.b2mash.einvoice.status;

/** Which regulator vocabulary an internal status is mapped into. */
public enum DocumentKind {
  /** e-Fatura. */
  INVOICE,

  /** e-Arşiv fatura. */
  ARCHIVE,

  /** e-Defter. */
  LEDGER
}
