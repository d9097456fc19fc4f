package io.patchbay.details;

/** A background derivation that failed; rendered inline instead of failing the whole snapshot. */
public record DerivationError(String message) {}
