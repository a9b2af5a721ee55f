package io.confhub.backend.cfp;

import java.util.Arrays;
import java.util.Optional;

/** The kinds of call for proposals a program can open. At most one of each per program. */
public enum CfpType {
  EVENTS("events"),
  BOOTHS("booths"),
  TRACKS("tracks");

  private final String value;

  CfpType(String value) {
    this.value = value;
  }

  /** The stored form of the type, always lower case. */
  public String value() {
    return value;
  }

  /** Exact match against the stored form; "Events" is not a known type. */
  public static Optional<CfpType> fromValue(String value) {
    return Arrays.stream(values()).filter(t -> t.value.equals(value)).findFirst();
  }
}
