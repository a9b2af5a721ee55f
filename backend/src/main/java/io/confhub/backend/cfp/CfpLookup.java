package io.confhub.backend.cfp;

import java.util.Collection;
import java.util.Optional;

/** Filter-and-first lookups over the calls of one program. */
public final class CfpLookup {

  private CfpLookup() {}

  public static Optional<Cfp> forEvents(Collection<Cfp> cfps) {
    return forType(cfps, CfpType.EVENTS);
  }

  public static Optional<Cfp> forBooths(Collection<Cfp> cfps) {
    return forType(cfps, CfpType.BOOTHS);
  }

  public static Optional<Cfp> forTracks(Collection<Cfp> cfps) {
    return forType(cfps, CfpType.TRACKS);
  }

  public static Optional<Cfp> forType(Collection<Cfp> cfps, CfpType type) {
    return cfps.stream().filter(c -> c.hasType(type)).findFirst();
  }
}
