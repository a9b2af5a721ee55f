package io.confhub.backend.cfp;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;
import java.util.UUID;

/**
 * A call for proposals: the submission window of one {@link CfpType} within a program.
 *
 * <p>The entity carries no validation of its own. Fields are assigned freely and {@link
 * CfpPolicy#validate} decides whether the result may be saved, so an out-of-range or unknown type
 * is representable and reported rather than rejected on assignment.
 */
@Entity
@Table(name = "cfps")
public class Cfp {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "program_id", nullable = false)
  private UUID programId;

  @Column(name = "cfp_type", nullable = false, length = 20)
  private String cfpType;

  @Column(name = "start_date", nullable = false)
  private LocalDate startDate;

  @Column(name = "end_date", nullable = false)
  private LocalDate endDate;

  @Column(name = "description", columnDefinition = "text")
  private String description;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  /** JPA-required no-arg constructor. */
  protected Cfp() {}

  public Cfp(UUID programId, String cfpType, LocalDate startDate, LocalDate endDate) {
    this.programId = Objects.requireNonNull(programId, "programId must not be null");
    this.cfpType = cfpType;
    this.startDate = startDate;
    this.endDate = endDate;
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

  /**
   * Number of calendar weeks (Monday to Sunday) the window touches. A window from a Sunday to the
   * following Monday spans two weeks. Zero when a date is missing or the window is reversed.
   */
  public long weeks() {
    if (startDate == null || endDate == null || endDate.isBefore(startDate)) {
      return 0;
    }
    var firstMonday = startDate.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    var lastMonday = endDate.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    return ChronoUnit.WEEKS.between(firstMonday, lastMonday) + 1;
  }

  /** Days left until the end date as seen from {@code today}; 0 once the end date has passed. */
  public long remainingDays(LocalDate today) {
    if (endDate == null) {
      return 0;
    }
    return Math.max(0, ChronoUnit.DAYS.between(today, endDate));
  }

  public boolean hasType(CfpType type) {
    return cfpType != null && cfpType.equalsIgnoreCase(type.value());
  }

  // --- Setters ---

  public void setCfpType(String cfpType) {
    this.cfpType = cfpType;
  }

  public void setStartDate(LocalDate startDate) {
    this.startDate = startDate;
  }

  public void setEndDate(LocalDate endDate) {
    this.endDate = endDate;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getProgramId() {
    return programId;
  }

  public String getCfpType() {
    return cfpType;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public LocalDate getEndDate() {
    return endDate;
  }

  public String getDescription() {
    return description;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
