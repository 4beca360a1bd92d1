package io.b2mash.einvoice.identifier;

/** Which kind of taxpayer a tax identifier belongs to. */
public enum TaxIdentifierKind {
  /** VKN: 10-digit identifier issued to legal entities. */
  ORGANIZATION,

  /** TCKN: 11-digit national identity number, used as tax id by individuals. */
  INDIVIDUAL,

  /** Neither check passed, or the length matches no known identifier. */
  UNKNOWN
}
