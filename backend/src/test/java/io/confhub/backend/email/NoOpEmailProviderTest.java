package io.confhub.backend.email;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class NoOpEmailProviderTest {

  private final NoOpEmailProvider provider = new NoOpEmailProvider();

  @Test
  void sendEmail_reportsSuccessWithoutSending() {
    var result =
        provider.sendEmail(EmailMessage.withTracking("a@example.org", "Hi", "Body", "CFP", "42"));

    assertThat(provider.providerId()).isEqualTo("noop");
    assertThat(result.success()).isTrue();
    assertThat(result.providerMessageId()).startsWith("NOOP-");
    assertThat(result.errorMessage()).isNull();
  }

  @Test
  void emailMessage_requiresRecipientAndSubject() {
    assertThatThrownBy(() -> new EmailMessage(null, "Hi", "Body", null))
        .isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> new EmailMessage("a@example.org", null, "Body", null))
        .isInstanceOf(NullPointerException.class);
    assertThat(new EmailMessage("a@example.org", "Hi", "Body", null).metadata()).isEmpty();
  }
}
