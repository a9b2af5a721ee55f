package io.confhub.backend.cfp;

import java.time.LocalDate;

/** Field values for creating or updating a call for proposals. */
public record CfpCommand(
    String cfpType, LocalDate startDate, LocalDate endDate, String description) {}
