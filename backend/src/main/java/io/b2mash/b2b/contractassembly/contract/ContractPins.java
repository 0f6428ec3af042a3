package io.b2mash.b2b.contractassembly.contract;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Clause versions resolved for one template version.
 *
 * @param clauseVersionIds pinned versions in document order
 * @param versionByClause clause id to its pinned version id
 */
record ContractPins(List<UUID> clauseVersionIds, Map<UUID, UUID> versionByClause) {}
