package io.b2mash.einvoice.reporting;

/** Monthly purchase (Ba) and sales (Bs) notification forms. */
public enum BaBsForm {
  BA("Form Ba"),
  BS("Form Bs");

  private final String formCode;

  BaBsForm(String formCode) {
    this.formCode = formCode;
  }

  public String formCode() {
    return formCode;
  }
}
