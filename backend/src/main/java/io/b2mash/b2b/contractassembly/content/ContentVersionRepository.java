package io.b2mash.b2b.contractassembly.content;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.repository.NoRepositoryBean;

/** Queries shared by {@link ClauseVersionRepository} and {@link TemplateVersionRepository}. */
@NoRepositoryBean
public interface ContentVersionRepository<V extends ContentVersion>
    extends JpaRepository<V, UUID> {

  List<V> findByEntityIdOrderByVersionNumberAsc(UUID entityId);

  Optional<V> findFirstByEntityIdOrderByVersionNumberDesc(UUID entityId);

  List<V> findByEntityIdAndStatus(UUID entityId, VersionStatus status);

  List<V> findByStatusAndReviewerIdAndRejectedAtIsNullOrderBySubmittedAtAsc(
      VersionStatus status, UUID reviewerId);
}
