package io.confhub.backend.conference;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/** A person who asked to receive announcements of a conference. */
@Entity
@Table(name = "subscriptions")
public class Subscription {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "conference_id", nullable = false)
  private UUID conferenceId;

  @Column(name = "email", nullable = false, length = 255)
  private String email;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  /** JPA-required no-arg constructor. */
  protected Subscription() {}

  public Subscription(UUID conferenceId, String email) {
    this.conferenceId = Objects.requireNonNull(conferenceId, "conferenceId must not be null");
    this.email = Objects.requireNonNull(email, "email must not be null");
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getConferenceId() {
    return conferenceId;
  }

  public String getEmail() {
    return email;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
