package io.b2mash.taskdesk.audit;

import java.util.List;
import java.util.UUID;

/** Records and reads the audit trail of recurring task changes. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back (no REQUIRES_NEW).
   *
   * @param record the audit event data to persist
   */
  void log(AuditEventRecord record);

  /** Events of one entity, newest first. */
  List<AuditEvent> findEvents(String entityType, UUID entityId);
}
