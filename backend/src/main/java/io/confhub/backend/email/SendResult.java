package io.confhub.backend.email;

/** Outcome of a single send. {@code errorMessage} is null on success. */
public record SendResult(boolean success, String providerMessageId, String errorMessage) {}
