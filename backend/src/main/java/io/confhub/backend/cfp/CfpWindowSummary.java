package io.confhub.backend.cfp;

import java.util.UUID;

/** Read model of a call's submission window as seen from the conference's current day. */
public record CfpWindowSummary(UUID cfpId, boolean open, long weeks, long remainingDays) {}
