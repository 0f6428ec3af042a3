package io.b2mash.b2b.contractassembly.contract;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

/** Repository for {@link ContractInstance} entities. */
public interface ContractInstanceRepository extends JpaRepository<ContractInstance, UUID> {

  Optional<ContractInstance> findByIdAndTenantId(UUID id, String tenantId);

  Page<ContractInstance> findByTenantId(String tenantId, Pageable pageable);

  Page<ContractInstance> findByTenantIdAndStatus(
      String tenantId, ContractStatus status, Pageable pageable);
}
