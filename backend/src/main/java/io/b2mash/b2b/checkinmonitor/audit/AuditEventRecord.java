package io.b2mash.b2b.checkinmonitor.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService} for recording audit events. Constructed by {@link
 * AuditEventBuilder}.
 *
 * @param companyId tenant the event belongs to
 * @param eventType free-form event type following {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "missed_check_in")
 * @param entityId ID of the affected entity
 * @param actorId person ID of the acting user; null for system-initiated events
 * @param actorType USER or SYSTEM
 * @param source origin of the action: API, INTERNAL, SCHEDULED
 * @param details key field changes as JSONB; nullable
 */
public record AuditEventRecord(
    UUID companyId,
    String eventType,
    String entityType,
    UUID entityId,
    UUID actorId,
    String actorType,
    String source,
    Map<String, Object> details) {}
