package io.confhub.backend.cfp;

import java.time.LocalDate;
import java.util.Objects;

/** Snapshot of a call's submission window, used to detect date changes across a save. */
public record CfpDates(LocalDate startDate, LocalDate endDate) {

  public static CfpDates of(Cfp cfp) {
    return new CfpDates(cfp.getStartDate(), cfp.getEndDate());
  }

  public boolean startDateChanged(CfpDates previous) {
    return !Objects.equals(previous.startDate, startDate);
  }

  public boolean endDateChanged(CfpDates previous) {
    return !Objects.equals(previous.endDate, endDate);
  }

  public boolean isComplete() {
    return startDate != null && endDate != null;
  }
}
