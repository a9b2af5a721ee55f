package io.confhub.backend.email;

import java.util.Map;
import java.util.Objects;

/** Provider-agnostic email payload: recipient, subject, plain text body and tracking metadata. */
public record EmailMessage(
    String to, String subject, String plainTextBody, Map<String, String> metadata) {

  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /**
   * Builds a message tagged with the entity it relates to.
   *
   * @param referenceType the type of entity this email relates to (e.g., "CFP")
   * @param referenceId the ID of the referenced entity
   */
  public static EmailMessage withTracking(
      String to, String subject, String plainTextBody, String referenceType, String referenceId) {
    Objects.requireNonNull(referenceType, "referenceType");
    Objects.requireNonNull(referenceId, "referenceId");
    return new EmailMessage(
        to,
        subject,
        plainTextBody,
        Map.of("referenceType", referenceType, "referenceId", referenceId));
  }
}
