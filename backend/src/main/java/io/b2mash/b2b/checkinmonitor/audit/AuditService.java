package io.b2mash.b2b.checkinmonitor.audit;

import java.util.List;
import java.util.UUID;

/** Records and reads tenant-scoped audit events. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back.
   */
  void log(AuditEventRecord record);

  /** Records several events in one batch write. */
  void logAll(List<AuditEventRecord> records);

  /** Events for one entity within a tenant, newest first. */
  List<AuditEvent> findForEntity(UUID companyId, UUID entityId);
}
