package io.b2mash.einvoice.precheck;

import io.b2mash.einvoice.error.Severity;

/** One named pre-check outcome. A failed {@link Severity#ERROR} check blocks submission. */
public record ValidationCheck(String name, Severity severity, boolean passed, String message) {}
