package io.confhub.backend.email;

/** Port for sending emails via an external provider (SMTP, SendGrid, ...). */
public interface EmailProvider {

  /** Provider identifier (e.g., "smtp", "noop"). */
  String providerId();

  SendResult sendEmail(EmailMessage message);
}
