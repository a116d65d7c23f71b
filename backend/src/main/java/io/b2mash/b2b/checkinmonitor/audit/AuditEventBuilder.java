package io.b2mash.b2b.checkinmonitor.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Builder that constructs an {@link AuditEventRecord}.
 *
 * <p>Required fields: {@code companyId}, {@code eventType}, {@code entityType}, {@code entityId}.
 * When not set explicitly, {@code actorType} is "USER" if an actor id was given and "SYSTEM"
 * otherwise, and {@code source} is "INTERNAL".
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .companyId(companyId)
 *     .eventType("missed_check_in.status_changed")
 *     .entityType("missed_check_in")
 *     .entityId(record.getId())
 *     .actorId(reviewerId)
 *     .details(Map.of("from", "OPEN", "to", "RESOLVED"))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private UUID companyId;
  private String eventType;
  private String entityType;
  private UUID entityId;
  private UUID actorId;
  private String actorType;
  private String source;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder companyId(UUID companyId) {
    this.companyId = companyId;
    return this;
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder actorId(UUID actorId) {
    this.actorId = actorId;
    return this;
  }

  public AuditEventBuilder actorType(String actorType) {
    this.actorType = actorType;
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    if (companyId == null || eventType == null || entityType == null || entityId == null) {
      throw new IllegalStateException(
          "companyId, eventType, entityType and entityId are required for an audit event");
    }
    String resolvedActorType = actorType;
    if (resolvedActorType == null) {
      resolvedActorType = actorId != null ? "USER" : "SYSTEM";
    }
    String resolvedSource = source != null ? source : "INTERNAL";
    return new AuditEventRecord(
        companyId,
        eventType,
        entityType,
        entityId,
        actorId,
        resolvedActorType,
        resolvedSource,
        details);
  }
}
