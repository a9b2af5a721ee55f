package io.confhub.backend.cfp;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Published after a call's window changed on a conference that announces such changes. Consumed
 * by {@link CfpDatesUpdatedEventHandler} once the saving transaction has committed.
 */
public record CfpDatesUpdatedEvent(
    UUID cfpId, UUID conferenceId, String cfpType, LocalDate startDate, LocalDate endDate) {}
