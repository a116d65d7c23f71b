package io.b2mash.b2b.checkinmonitor.missedcheckin;

import io.b2mash.b2b.checkinmonitor.person.Role;
import io.b2mash.b2b.checkinmonitor.schedule.EffectiveSchedule;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A worker about to be recorded as missing, with everything the snapshot needs besides history.
 *
 * @param assignedOn tenant-local date of the current team assignment
 */
public record WorkerContext(
    UUID personId, UUID teamId, Role role, LocalDate assignedOn, EffectiveSchedule schedule) {}
