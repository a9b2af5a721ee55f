package io.confhub.backend.conference;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.Objects;
import java.util.UUID;

/** Content container of a conference. Exactly one per conference; owns the calls for proposals. */
@Entity
@Table(name = "programs")
public class Program {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "conference_id", nullable = false, unique = true)
  private UUID conferenceId;

  /** JPA-required no-arg constructor. */
  protected Program() {}

  public Program(UUID conferenceId) {
    this.conferenceId = Objects.requireNonNull(conferenceId, "conferenceId must not be null");
  }

  public UUID getId() {
    return id;
  }

  public UUID getConferenceId() {
    return conferenceId;
  }
}
