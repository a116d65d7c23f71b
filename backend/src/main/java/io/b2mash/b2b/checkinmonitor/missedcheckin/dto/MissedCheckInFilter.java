package io.b2mash.b2b.checkinmonitor.missedcheckin.dto;

import io.b2mash.b2b.checkinmonitor.missedcheckin.MissedCheckInStatus;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Optional criteria for listing missed check-ins. Null fields do not filter; an empty or null
 * {@code teamIds} means all teams. Date bounds are inclusive.
 */
public record MissedCheckInFilter(
    MissedCheckInStatus status,
    List<UUID> teamIds,
    UUID personId,
    LocalDate fromDate,
    LocalDate toDate) {

  public static MissedCheckInFilter all() {
    return new MissedCheckInFilter(null, null, null, null, null);
  }

  public boolean hasTeams() {
    return teamIds != null && !teamIds.isEmpty();
  }
}
