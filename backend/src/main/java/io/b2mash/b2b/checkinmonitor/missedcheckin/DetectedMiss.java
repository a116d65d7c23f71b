package io.b2mash.b2b.checkinmonitor.missedcheckin;

import java.time.LocalDate;
import java.util.UUID;

/** A miss that was newly inserted in this pass (duplicates never show up here). */
public record DetectedMiss(
    UUID recordId,
    UUID personId,
    UUID teamId,
    UUID leaderId,
    LocalDate missedDate,
    String scheduleWindow) {}
