package io.b2mash.b2b.checkinmonitor.missedcheckin;

import io.b2mash.b2b.checkinmonitor.person.Role;
import java.time.LocalDate;
import java.util.UUID;

/** Row to be written by {@link MissedCheckInInsertRepository#insertIgnoringDuplicates}. */
public record NewMissedCheckIn(
    UUID personId,
    UUID teamId,
    LocalDate missedDate,
    String scheduleWindow,
    UUID teamLeaderId,
    String teamLeaderName,
    Role workerRole,
    MissedCheckInSnapshot snapshot) {}
