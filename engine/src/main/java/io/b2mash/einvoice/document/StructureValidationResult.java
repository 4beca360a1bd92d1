package io.b2mash.einvoice.document;

import java.util.List;

public record StructureValidationResult(boolean valid, List<String> errors) {

  public StructureValidationResult {
    errors = List.copyOf(errors);
  }
}
