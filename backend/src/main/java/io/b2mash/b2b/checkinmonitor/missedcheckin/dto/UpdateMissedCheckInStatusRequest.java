package io.b2mash.b2b.checkinmonitor.missedcheckin.dto;

import io.b2mash.b2b.checkinmonitor.missedcheckin.MissedCheckInStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record UpdateMissedCheckInStatusRequest(
    @NotNull(message = "status is required") MissedCheckInStatus status,
    @Size(max = 500, message = "notes must be at most 500 characters") String notes) {}
