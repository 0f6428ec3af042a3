package io.b2mash.b2b.contractassembly.content;

import io.b2mash.b2b.contractassembly.audit.AuditEventBuilder;
import io.b2mash.b2b.contractassembly.audit.AuditService;
import io.b2mash.b2b.contractassembly.config.RetryOnStorageFault;
import io.b2mash.b2b.contractassembly.event.VersionDeprecatedEvent;
import io.b2mash.b2b.contractassembly.event.VersionPublishedEvent;
import io.b2mash.b2b.contractassembly.exception.ConcurrentPublishException;
import io.b2mash.b2b.contractassembly.exception.ContentValidationException;
import io.b2mash.b2b.contractassembly.exception.ForbiddenException;
import io.b2mash.b2b.contractassembly.exception.GateViolationException;
import io.b2mash.b2b.contractassembly.exception.ResourceNotFoundException;
import io.b2mash.b2b.contractassembly.multitenancy.RequestScopes;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.annotation.Transactional;

/**
 * Draft, review, publish and deprecate lifecycle shared by clauses and templates.
 *
 * <p>Approval is the only place a version becomes PUBLISHED. It demotes the previously published
 * sibling, promotes the approved version and moves the entity's published pointer in one
 * transaction, flushing each step under its optimistic lock. Of two concurrent approvals for the
 * same entity exactly one commits; the other fails with {@link ConcurrentPublishException}. The
 * partial unique index on published versions backs this up when there is no sibling to demote.
 *
 * @param <E> logical entity type
 * @param <V> version type
 * @param <C> editable draft content
 */
public abstract class AbstractVersionLifecycleService<
    E extends LogicalEntity, V extends ContentVersion, C> {

  private static final Logger log = LoggerFactory.getLogger(AbstractVersionLifecycleService.class);

  private final LogicalEntityRepository<E> entityRepository;
  private final ContentVersionRepository<V> versionRepository;
  private final PublishingGate<E, V> publishingGate;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;

  protected AbstractVersionLifecycleService(
      LogicalEntityRepository<E> entityRepository,
      ContentVersionRepository<V> versionRepository,
      PublishingGate<E, V> publishingGate,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher) {
    this.entityRepository = entityRepository;
    this.versionRepository = versionRepository;
    this.publishingGate = publishingGate;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
  }

  /** "clause" or "template"; used in messages and audit entity types. */
  protected abstract String entityType();

  protected abstract V newDraft(E entity, int versionNumber, UUID authorId, C content);

  protected abstract V reworkOf(V rejected, int versionNumber);

  protected abstract void applyContent(V draft, C content);

  protected abstract List<String> shapeProblems(C content);

  protected String versionEntityType() {
    return entityType() + "_version";
  }

  // --- Commands ---

  @Transactional
  @RetryOnStorageFault
  public V createDraft(UUID entityId, C content, UUID authorId) {
    E entity = findEntity(entityId);
    requireValidShape(content);

    int versionNumber = nextVersionNumber(entityId);
    V draft = versionRepository.save(newDraft(entity, versionNumber, authorId, content));

    log.info(
        "Created {} version {} (#{}) of {} {}",
        entityType(),
        draft.getId(),
        versionNumber,
        entityType(),
        entityId);
    audit(
        "version.created",
        draft,
        Map.of("entityId", entityId.toString(), "versionNumber", versionNumber));
    return draft;
  }

  @Transactional
  @RetryOnStorageFault
  public V updateDraft(UUID versionId, C content) {
    V draft = findVersion(versionId);
    draft.requireEditable("edit");
    requireValidShape(content);
    applyContent(draft, content);
    draft = versionRepository.save(draft);

    log.info("Updated {} draft {}", entityType(), versionId);
    audit("version.updated", draft, Map.of("versionNumber", draft.getVersionNumber()));
    return draft;
  }

  @Transactional
  @RetryOnStorageFault
  public V addChangelogEntry(
      UUID versionId,
      ChangeType changeType,
      LegalImpact legalImpact,
      String summary,
      String migrationNotes,
      UUID authorId) {
    if (summary == null || summary.isBlank()) {
      throw new ContentValidationException(List.of("changelog summary must not be blank"));
    }
    V draft = findVersion(versionId);
    draft.addChangelogEntry(
        new ChangelogEntry(
            changeType != null ? changeType : ChangeType.CONTENT,
            legalImpact != null ? legalImpact : LegalImpact.NONE,
            summary,
            migrationNotes,
            authorId,
            Instant.now()));
    return versionRepository.save(draft);
  }

  /**
   * Moves a draft into review. Status and the four-eyes principle are checked first, then every
   * publishing gate runs; all failed gates are reported together.
   */
  @Transactional
  @RetryOnStorageFault
  public ReviewSubmission<V> submitForReview(UUID versionId, UUID reviewerId) {
    V version = findVersion(versionId);
    version.requireSubmittable(reviewerId);
    E entity = findEntity(version.getEntityId());

    GateReport report = publishingGate.evaluate(entity, version);
    if (!report.passed()) {
      log.info(
          "{} version {} failed {} publishing gate(s)",
          entityType(),
          versionId,
          report.failures().size());
      throw new GateViolationException(report.failures());
    }

    version.submit(reviewerId);
    version = versionRepository.save(version);

    log.info("Submitted {} version {} for review by {}", entityType(), versionId, reviewerId);
    audit(
        "version.submitted",
        version,
        Map.of(
            "reviewerId", reviewerId.toString(),
            "warnings", report.warnings().stream().map(GateResult::gate).toList()));
    return new ReviewSubmission<>(version, report.warnings());
  }

  /** Runs the publishing gate without transitioning the version. */
  @Transactional(readOnly = true)
  public GateReport checkGates(UUID versionId) {
    V version = findVersion(versionId);
    return publishingGate.evaluate(findEntity(version.getEntityId()), version);
  }

  /**
   * Approves a version under review and publishes it, demoting the previously published sibling.
   *
   * @throws GateViolationException if publishing would break a check that depends on other
   *     published content
   * @throws ConcurrentPublishException if another version of the entity was published
   *     concurrently
   */
  @Transactional
  @RetryOnStorageFault
  public V approve(UUID versionId, UUID reviewerId) {
    V version = findVersion(versionId);
    UUID entityId = version.getEntityId();
    E entity = findEntity(entityId);

    version.approve(reviewerId);
    GateReport publishCheck = publishingGate.evaluateAtPublish(entity, version);
    if (!publishCheck.passed()) {
      throw new GateViolationException(publishCheck.failures());
    }
    List<V> demoted = versionRepository.findByEntityIdAndStatus(entityId, VersionStatus.PUBLISHED);
    try {
      for (V previous : demoted) {
        previous.deprecate(
            reviewerId, "Superseded by version " + version.getVersionNumber());
        versionRepository.saveAndFlush(previous);
      }
      version.publish();
      version = versionRepository.saveAndFlush(version);
      entity.promote(version.getId());
      entityRepository.saveAndFlush(entity);
    } catch (ObjectOptimisticLockingFailureException | DataIntegrityViolationException e) {
      log.warn(
          "Concurrent publish of {} {} lost by version {}: {}",
          entityType(),
          entityId,
          versionId,
          e.getMessage());
      throw new ConcurrentPublishException(entityType(), entityId, e);
    }

    UUID demotedId = demoted.isEmpty() ? null : demoted.get(0).getId();
    log.info(
        "Published {} version {} of {} {}{}",
        entityType(),
        version.getId(),
        entityType(),
        entityId,
        demotedId != null ? ", deprecated " + demotedId : "");

    for (V previous : demoted) {
      eventPublisher.publishEvent(deprecatedEvent(previous, reviewerId));
    }
    Map<String, Object> details = new HashMap<>();
    details.put("logicalEntityId", entityId.toString());
    details.put("versionNumber", version.getVersionNumber());
    if (demotedId != null) {
      details.put("demotedVersionId", demotedId.toString());
    }
    eventPublisher.publishEvent(
        new VersionPublishedEvent(
            VersionPublishedEvent.EVENT_TYPE,
            versionEntityType(),
            version.getId(),
            version.getTenantId(),
            reviewerId,
            Instant.now(),
            details,
            entityId,
            version.getVersionNumber(),
            demotedId));
    return version;
  }

  /**
   * Rejects a version under review. The version stays in REVIEW marked as rejected; a new draft
   * copy is returned for the author to rework.
   */
  @Transactional
  @RetryOnStorageFault
  public V reject(UUID versionId, UUID reviewerId, String comment) {
    if (comment == null || comment.isBlank()) {
      throw new ContentValidationException(List.of("rejection comment must not be blank"));
    }
    V version = findVersion(versionId);
    version.reject(reviewerId, comment);
    versionRepository.save(version);

    V rework = versionRepository.save(reworkOf(version, nextVersionNumber(version.getEntityId())));

    log.info(
        "Rejected {} version {}; new draft {} created", entityType(), versionId, rework.getId());
    audit(
        "version.rejected",
        version,
        Map.of("comment", comment, "newDraftId", rework.getId().toString()));
    return rework;
  }

  /** Deprecates a published version. Admins only. */
  @Transactional
  @RetryOnStorageFault
  public V deprecate(UUID versionId, String reason) {
    if (!RequestScopes.isAdmin()) {
      throw new ForbiddenException(
          RequestScopes.ROLE_ADMIN, "deprecate " + entityType() + " versions");
    }
    if (reason == null || reason.isBlank()) {
      throw new ContentValidationException(List.of("deprecation reason must not be blank"));
    }
    V version = findVersion(versionId);
    E entity = findEntity(version.getEntityId());
    UUID actorId = RequestScopes.getActorIdOrNull();

    version.deprecate(actorId, reason);
    try {
      version = versionRepository.saveAndFlush(version);
      entity.clearPublished(versionId);
      entityRepository.saveAndFlush(entity);
    } catch (ObjectOptimisticLockingFailureException e) {
      log.warn("Concurrent change while deprecating {} version {}", entityType(), versionId);
      throw new ConcurrentPublishException(entityType(), entity.getId(), e);
    }

    log.info("Deprecated {} version {}: {}", entityType(), versionId, reason);
    eventPublisher.publishEvent(deprecatedEvent(version, actorId));
    return version;
  }

  // --- Queries ---

  @Transactional(readOnly = true)
  public E getEntity(UUID entityId) {
    return findEntity(entityId);
  }

  /** Entities published by the current tenant. */
  @Transactional(readOnly = true)
  public List<E> listEntities() {
    return entityRepository.findByTenantIdOrderByTitleAsc(RequestScopes.requireTenantId());
  }

  @Transactional(readOnly = true)
  public V getVersion(UUID versionId) {
    return findVersion(versionId);
  }

  @Transactional(readOnly = true)
  public List<V> listVersions(UUID entityId) {
    findEntity(entityId);
    return versionRepository.findByEntityIdOrderByVersionNumberAsc(entityId);
  }

  @Transactional(readOnly = true)
  public List<ReviewHistoryEntry> getReviewHistory(UUID versionId) {
    return findVersion(versionId).getReviewHistory();
  }

  /** Open reviews assigned to the given reviewer, oldest submission first. */
  @Transactional(readOnly = true)
  public List<V> listReviewQueue(UUID reviewerId) {
    return versionRepository.findByStatusAndReviewerIdAndRejectedAtIsNullOrderBySubmittedAtAsc(
        VersionStatus.REVIEW, reviewerId);
  }

  // --- Helpers ---

  protected E findEntity(UUID entityId) {
    return entityRepository
        .findById(entityId)
        .orElseThrow(() -> new ResourceNotFoundException(capitalized(entityType()), entityId));
  }

  protected V findVersion(UUID versionId) {
    return versionRepository
        .findById(versionId)
        .orElseThrow(
            () -> new ResourceNotFoundException(capitalized(entityType()) + "Version", versionId));
  }

  protected void audit(String eventType, V version, Map<String, Object> details) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType(versionEntityType())
            .entityId(version.getId())
            .details(details)
            .build());
  }

  protected AuditService auditService() {
    return auditService;
  }

  private void requireValidShape(C content) {
    List<String> problems = shapeProblems(content);
    if (!problems.isEmpty()) {
      throw new ContentValidationException(problems);
    }
  }

  private int nextVersionNumber(UUID entityId) {
    return versionRepository
        .findFirstByEntityIdOrderByVersionNumberDesc(entityId)
        .map(v -> v.getVersionNumber() + 1)
        .orElse(1);
  }

  private VersionDeprecatedEvent deprecatedEvent(V version, UUID actorId) {
    return new VersionDeprecatedEvent(
        VersionDeprecatedEvent.EVENT_TYPE,
        versionEntityType(),
        version.getId(),
        version.getTenantId(),
        actorId,
        Instant.now(),
        Map.of(
            "logicalEntityId", version.getEntityId().toString(),
            "reason", version.getDeprecationReason()),
        version.getEntityId(),
        version.getDeprecationReason());
  }

  private static String capitalized(String value) {
    return Character.toUpperCase(value.charAt(0)) + value.substring(1);
  }
}
