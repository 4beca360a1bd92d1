package io.b2mash.einvoice.error;

public record TranslatedError(String message, Severity severity) {}
