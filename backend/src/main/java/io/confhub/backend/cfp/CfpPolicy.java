package io.confhub.backend.cfp;

import io.confhub.backend.cfp.CfpValidationResult.FieldError;
import io.confhub.backend.conference.Conference;
import io.confhub.backend.conference.EmailSettings;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Rules for a call for proposals: whether it may be saved, whether it is open today, and whether a
 * change to its dates should be announced.
 *
 * <p>Stateless apart from the injected clock. "Today" is always the calendar day in the
 * conference's timezone, never the day in the zone of the clock or of the JVM.
 */
@Component
public class CfpPolicy {

  static final String FIELD_CFP_TYPE = "cfp_type";
  static final String FIELD_START_DATE = "start_date";
  static final String FIELD_END_DATE = "end_date";

  static final String REASON_BLANK = "blank";
  static final String REASON_INCLUSION = "inclusion";
  static final String REASON_TAKEN = "taken";
  static final String REASON_AFTER_CONFERENCE_END = "after_conference_end";
  static final String REASON_NOT_BEFORE_END_DATE = "not_before_end_date";

  private final Clock clock;

  public CfpPolicy(Clock clock) {
    this.clock = clock;
  }

  /**
   * Checks {@code cfp} against its conference and the other calls of the same program. Every rule
   * is evaluated; the result lists all failures. {@code programCfps} may contain {@code cfp}
   * itself, which is skipped for the uniqueness check.
   */
  public CfpValidationResult validate(
      Cfp cfp, Conference conference, Collection<Cfp> programCfps) {
    Objects.requireNonNull(cfp, "cfp must not be null");
    var errors = new ArrayList<FieldError>();

    checkType(cfp, programCfps, errors);
    checkDatesPresent(cfp, errors);
    checkBeforeEndOfConference(cfp, conference, errors);
    checkStartBeforeEndDate(cfp, errors);

    return CfpValidationResult.of(errors);
  }

  /**
   * True when the window changed between {@code previous} and {@code proposed} and the conference
   * has the date-change announcement switched on with both subject and body filled in. Missing
   * settings mean the announcement is off.
   */
  public boolean shouldNotifyOnDateUpdate(
      CfpDates previous, CfpDates proposed, EmailSettings emailSettings) {
    if (!proposed.isComplete()) {
      return false;
    }
    boolean datesChanged =
        proposed.startDateChanged(previous) || proposed.endDateChanged(previous);
    return datesChanged
        && emailSettings != null
        && emailSettings.isCfpDatesUpdatedMailConfigured();
  }

  /** Whether the conference's current calendar day lies within the window, bounds included. */
  public boolean isOpen(Cfp cfp, Conference conference) {
    return isOpenOn(cfp, today(conference));
  }

  /** Whether {@code day} lies within the window, bounds included. */
  public boolean isOpenOn(Cfp cfp, LocalDate day) {
    if (cfp.getStartDate() == null || cfp.getEndDate() == null) {
      return false;
    }
    return !day.isBefore(cfp.getStartDate()) && !day.isAfter(cfp.getEndDate());
  }

  /** The current calendar day in the conference's timezone. */
  public LocalDate today(Conference conference) {
    return LocalDate.ofInstant(clock.instant(), conference.getZoneId());
  }

  // --- Private helpers ---

  private void checkType(Cfp cfp, Collection<Cfp> programCfps, List<FieldError> errors) {
    var type = cfp.getCfpType();
    if (type == null || type.isBlank()) {
      errors.add(new FieldError(FIELD_CFP_TYPE, REASON_BLANK, "can't be blank"));
      return;
    }
    if (CfpType.fromValue(type).isEmpty()) {
      errors.add(new FieldError(FIELD_CFP_TYPE, REASON_INCLUSION, "is not included in the list"));
    }
    boolean taken =
        programCfps.stream()
            .filter(other -> !isSameRecord(cfp, other))
            .anyMatch(other -> type.equalsIgnoreCase(other.getCfpType()));
    if (taken) {
      errors.add(new FieldError(FIELD_CFP_TYPE, REASON_TAKEN, "has already been taken"));
    }
  }

  private void checkDatesPresent(Cfp cfp, List<FieldError> errors) {
    if (cfp.getStartDate() == null) {
      errors.add(new FieldError(FIELD_START_DATE, REASON_BLANK, "can't be blank"));
    }
    if (cfp.getEndDate() == null) {
      errors.add(new FieldError(FIELD_END_DATE, REASON_BLANK, "can't be blank"));
    }
  }

  /** Only the conference's end date bounds the window; its start date is not checked. */
  private void checkBeforeEndOfConference(
      Cfp cfp, Conference conference, List<FieldError> errors) {
    if (conference == null || conference.getEndDate() == null) {
      return;
    }
    var conferenceEnd = conference.getEndDate();
    var message = "can't be after the conference end date (" + conferenceEnd + ")";
    if (cfp.getEndDate() != null && cfp.getEndDate().isAfter(conferenceEnd)) {
      errors.add(new FieldError(FIELD_END_DATE, REASON_AFTER_CONFERENCE_END, message));
    }
    if (cfp.getStartDate() != null && cfp.getStartDate().isAfter(conferenceEnd)) {
      errors.add(new FieldError(FIELD_START_DATE, REASON_AFTER_CONFERENCE_END, message));
    }
  }

  /** A window has to last at least one day: a start equal to the end is rejected too. */
  private void checkStartBeforeEndDate(Cfp cfp, List<FieldError> errors) {
    if (cfp.getStartDate() == null || cfp.getEndDate() == null) {
      return;
    }
    if (!cfp.getStartDate().isBefore(cfp.getEndDate())) {
      errors.add(
          new FieldError(
              FIELD_START_DATE, REASON_NOT_BEFORE_END_DATE, "must be before the end date"));
    }
  }

  private static boolean isSameRecord(Cfp cfp, Cfp other) {
    if (cfp == other) {
      return true;
    }
    return cfp.getId() != null && cfp.getId().equals(other.getId());
  }
}
