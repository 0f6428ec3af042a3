package io.b2mash.b2b.contractassembly.audit;

import java.util.List;
import java.util.UUID;

/**
 * Records lifecycle and validation events. Persistence and delivery belong to the implementation;
 * the content and contract services only hand over plain data.
 */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is rolled back with it.
   */
  void log(AuditEventRecord record);

  /** Returns the trail of a single object within the current tenant, oldest first. */
  List<AuditEvent> findByEntity(UUID entityId);
}
