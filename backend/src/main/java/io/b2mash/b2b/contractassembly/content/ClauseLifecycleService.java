package io.b2mash.b2b.contractassembly.content;

import io.b2mash.b2b.contractassembly.audit.AuditEventBuilder;
import io.b2mash.b2b.contractassembly.audit.AuditService;
import io.b2mash.b2b.contractassembly.config.RetryOnStorageFault;
import io.b2mash.b2b.contractassembly.multitenancy.RequestScopes;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Service for clauses and their versions. */
@Service
public class ClauseLifecycleService
    extends AbstractVersionLifecycleService<Clause, ClauseVersion, ClauseContent> {

  private static final Logger log = LoggerFactory.getLogger(ClauseLifecycleService.class);

  private final ClauseRepository clauseRepository;

  public ClauseLifecycleService(
      ClauseRepository clauseRepository,
      ClauseVersionRepository clauseVersionRepository,
      ClausePublishingGate clausePublishingGate,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher) {
    super(
        clauseRepository,
        clauseVersionRepository,
        clausePublishingGate,
        auditService,
        eventPublisher);
    this.clauseRepository = clauseRepository;
  }

  @Transactional
  @RetryOnStorageFault
  public Clause createClause(
      String title, String jurisdiction, String legalArea, List<String> tags) {
    var clause =
        clauseRepository.save(
            new Clause(RequestScopes.requireTenantId(), title, jurisdiction, legalArea, tags));

    log.info("Created clause {} title={}", clause.getId(), clause.getTitle());

    auditService()
        .log(
            AuditEventBuilder.builder()
                .eventType("clause.created")
                .entityType("clause")
                .entityId(clause.getId())
                .details(Map.of("title", clause.getTitle(), "jurisdiction", jurisdiction))
                .build());
    return clause;
  }

  @Override
  protected String entityType() {
    return "clause";
  }

  @Override
  protected ClauseVersion newDraft(
      Clause clause, int versionNumber, UUID authorId, ClauseContent content) {
    return new ClauseVersion(clause, versionNumber, authorId, content);
  }

  @Override
  protected ClauseVersion reworkOf(ClauseVersion rejected, int versionNumber) {
    return ClauseVersion.reworkOf(rejected, versionNumber);
  }

  @Override
  protected void applyContent(ClauseVersion draft, ClauseContent content) {
    draft.updateContent(content);
  }

  @Override
  protected List<String> shapeProblems(ClauseContent content) {
    return ContentShapeValidator.clauseProblems(content);
  }
}
