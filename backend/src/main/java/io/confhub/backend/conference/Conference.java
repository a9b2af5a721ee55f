package io.confhub.backend.conference;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;
import java.util.UUID;

/**
 * The top-level event. Its end date bounds every call for proposals of its program, and its
 * timezone decides which calendar day "today" is when checking whether a call is open.
 */
@Entity
@Table(name = "conferences")
public class Conference {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "short_title", nullable = false, length = 100)
  private String shortTitle;

  @Column(name = "start_date", nullable = false)
  private LocalDate startDate;

  @Column(name = "end_date", nullable = false)
  private LocalDate endDate;

  /** IANA zone id, e.g. "Europe/Berlin". */
  @Column(name = "timezone", nullable = false, length = 64)
  private String timezone;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  /** JPA-required no-arg constructor. */
  protected Conference() {}

  public Conference(String shortTitle, LocalDate startDate, LocalDate endDate, String timezone) {
    this.shortTitle = Objects.requireNonNull(shortTitle, "shortTitle must not be null");
    this.startDate = Objects.requireNonNull(startDate, "startDate must not be null");
    this.endDate = Objects.requireNonNull(endDate, "endDate must not be null");
    this.timezone = normalizeZone(timezone);
  }

  @PrePersist
  void onPrePersist() {
    var now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  public void reschedule(LocalDate startDate, LocalDate endDate) {
    this.startDate = Objects.requireNonNull(startDate, "startDate must not be null");
    this.endDate = Objects.requireNonNull(endDate, "endDate must not be null");
  }

  /** Throws {@link java.time.DateTimeException} if the id is not a known zone. */
  public void setTimezone(String timezone) {
    this.timezone = normalizeZone(timezone);
  }

  public UUID getId() {
    return id;
  }

  public String getShortTitle() {
    return shortTitle;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public LocalDate getEndDate() {
    return endDate;
  }

  public String getTimezone() {
    return timezone;
  }

  public ZoneId getZoneId() {
    return ZoneId.of(timezone);
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  private static String normalizeZone(String timezone) {
    return ZoneId.of(Objects.requireNonNull(timezone, "timezone must not be null")).getId();
  }
}
