package io.b2mash.einvoice.document;

/**
 * Markup fragments a UBL-TR invoice must contain, in the order they are reported. Namespace
 * markers carry their URI as a message argument.
 */
enum RequiredMarker {
  ROOT("<Invoice", "document.root.missing", false),
  ID("<cbc:ID>", "document.id.missing", false),
  ISSUE_DATE("<cbc:IssueDate>", "document.issueDate.missing", false),
  SUPPLIER_PARTY("<cac:AccountingSupplierParty>", "document.supplier.missing", false),
  CUSTOMER_PARTY("<cac:AccountingCustomerParty>", "document.customer.missing", false),
  TAX_TOTAL("<cac:TaxTotal>", "document.taxTotal.missing", false),
  MONETARY_TOTAL("<cac:LegalMonetaryTotal>", "document.monetaryTotal.missing", false),
  INVOICE_NAMESPACE(
      "urn:oasis:names:specification:ubl:schema:xsd:Invoice-2", "document.namespace.missing", true),
  BASIC_COMPONENTS_NAMESPACE(
      "urn:oasis:names:specification:ubl:schema:xsd:CommonBasicComponents-2",
      "document.namespace.missing",
      true),
  AGGREGATE_COMPONENTS_NAMESPACE(
      "urn:oasis:names:specification:ubl:schema:xsd:CommonAggregateComponents-2",
      "document.namespace.missing",
      true);

  private final String marker;
  private final String messageKey;
  private final boolean namespace;

  RequiredMarker(String marker, String messageKey, boolean namespace) {
    this.marker = marker;
    this.messageKey = messageKey;
    this.namespace = namespace;
  }

  String marker() {
    return marker;
  }

  String messageKey() {
    return messageKey;
  }

  Object[] messageArgs() {
    return namespace ? new Object[] {marker} : new Object[0];
  }
}
