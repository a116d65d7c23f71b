package io.b2mash.b2b.checkinmonitor.notification;

import java.util.UUID;

/** A notification to be delivered. Delivery and retry belong to {@link NotificationService}. */
public record NotificationIntent(UUID recipientId, String type, String title, String message) {}
