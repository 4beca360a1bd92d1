package io.b2mash.einvoice.status;

/** A status value in one of the regulator's vocabularies. */
public interface RegulatorStatus {

  /** The status code as the regulator spells it. */
  String code();
}
