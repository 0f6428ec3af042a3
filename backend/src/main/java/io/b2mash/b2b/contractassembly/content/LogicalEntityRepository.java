package io.b2mash.b2b.contractassembly.content;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.repository.NoRepositoryBean;

/** Queries shared by {@link ClauseRepository} and {@link TemplateRepository}. */
@NoRepositoryBean
public interface LogicalEntityRepository<E extends LogicalEntity> extends JpaRepository<E, UUID> {

  List<E> findByTenantIdOrderByTitleAsc(String tenantId);
}
