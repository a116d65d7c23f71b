package io.b2mash.b2b.checkinmonitor.missedcheckin;

import java.util.Map;
import java.util.Set;

/** Review status of a missed check-in record with validated transitions. */
public enum MissedCheckInStatus {
  OPEN,
  INVESTIGATING,
  EXCUSED,
  RESOLVED;

  private static final Map<MissedCheckInStatus, Set<MissedCheckInStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          OPEN, Set.of(INVESTIGATING, EXCUSED, RESOLVED),
          INVESTIGATING, Set.of(EXCUSED, RESOLVED),
          EXCUSED, Set.of(),
          RESOLVED, Set.of());

  /** Returns the set of statuses this status can transition to. */
  public Set<MissedCheckInStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  /** Returns true if transitioning from this status to the target is allowed. */
  public boolean canTransitionTo(MissedCheckInStatus target) {
    return allowedTransitions().contains(target);
  }

  /** Returns true if this is a terminal state (EXCUSED or RESOLVED). */
  public boolean isTerminal() {
    return this == EXCUSED || this == RESOLVED;
  }
}
