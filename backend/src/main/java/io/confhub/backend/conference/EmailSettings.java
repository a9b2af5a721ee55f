package io.confhub.backend.conference;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.Objects;
import java.util.UUID;

/**
 * Per-conference toggles and texts for automated announcement mails. Only the call for proposals
 * date-change announcement is modelled here.
 */
@Entity
@Table(name = "email_settings")
public class EmailSettings {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "conference_id", nullable = false, unique = true)
  private UUID conferenceId;

  @Column(name = "send_on_cfp_dates_updated", nullable = false)
  private boolean sendOnCfpDatesUpdated;

  @Column(name = "cfp_dates_updated_subject", length = 255)
  private String cfpDatesUpdatedSubject;

  @Column(name = "cfp_dates_updated_body", columnDefinition = "text")
  private String cfpDatesUpdatedBody;

  /** JPA-required no-arg constructor. */
  protected EmailSettings() {}

  public EmailSettings(UUID conferenceId) {
    this.conferenceId = Objects.requireNonNull(conferenceId, "conferenceId must not be null");
  }

  public void setSendOnCfpDatesUpdated(boolean sendOnCfpDatesUpdated) {
    this.sendOnCfpDatesUpdated = sendOnCfpDatesUpdated;
  }

  public void setCfpDatesUpdatedSubject(String cfpDatesUpdatedSubject) {
    this.cfpDatesUpdatedSubject = cfpDatesUpdatedSubject;
  }

  public void setCfpDatesUpdatedBody(String cfpDatesUpdatedBody) {
    this.cfpDatesUpdatedBody = cfpDatesUpdatedBody;
  }

  /** True when the toggle is on and both subject and body have content. */
  public boolean isCfpDatesUpdatedMailConfigured() {
    return sendOnCfpDatesUpdated
        && cfpDatesUpdatedSubject != null
        && !cfpDatesUpdatedSubject.isBlank()
        && cfpDatesUpdatedBody != null
        && !cfpDatesUpdatedBody.isBlank();
  }

  public UUID getId() {
    return id;
  }

  public UUID getConferenceId() {
    return conferenceId;
  }

  public boolean isSendOnCfpDatesUpdated() {
    return sendOnCfpDatesUpdated;
  }

  public String getCfpDatesUpdatedSubject() {
    return cfpDatesUpdatedSubject;
  }

  public String getCfpDatesUpdatedBody() {
    return cfpDatesUpdatedBody;
  }
}
