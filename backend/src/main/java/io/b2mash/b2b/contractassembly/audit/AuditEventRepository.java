package io.b2mash.b2b.contractassembly.audit;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

  List<AuditEvent> findByTenantIdAndEntityIdOrderByOccurredAtAsc(String tenantId, UUID entityId);
}
