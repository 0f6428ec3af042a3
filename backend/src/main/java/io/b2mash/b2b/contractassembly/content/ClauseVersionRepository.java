package io.b2mash.b2b.contractassembly.content;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/** Repository for {@link ClauseVersion} entities. */
public interface ClauseVersionRepository extends ContentVersionRepository<ClauseVersion> {

  List<ClauseVersion> findByTenantIdAndStatus(String tenantId, VersionStatus status);

  List<ClauseVersion> findByIdIn(Collection<UUID> ids);
}
