package io.b2mash.einvoice.error;

public enum Severity {
  ERROR,
  WARNING,
  INFO
}
