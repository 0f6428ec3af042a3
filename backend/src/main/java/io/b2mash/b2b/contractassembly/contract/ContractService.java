package io.b2mash.b2b.contractassembly.contract;

import io.b2mash.b2b.contractassembly.audit.AuditEventBuilder;
import io.b2mash.b2b.contractassembly.audit.AuditService;
import io.b2mash.b2b.contractassembly.config.ContractAssemblyProperties;
import io.b2mash.b2b.contractassembly.config.RetryOnStorageFault;
import io.b2mash.b2b.contractassembly.content.Clause;
import io.b2mash.b2b.contractassembly.content.ClauseRepository;
import io.b2mash.b2b.contractassembly.content.ClauseVersion;
import io.b2mash.b2b.contractassembly.content.ClauseVersionRepository;
import io.b2mash.b2b.contractassembly.content.Template;
import io.b2mash.b2b.contractassembly.content.TemplateRepository;
import io.b2mash.b2b.contractassembly.content.TemplateSlot;
import io.b2mash.b2b.contractassembly.content.TemplateVersion;
import io.b2mash.b2b.contractassembly.content.TemplateVersionRepository;
import io.b2mash.b2b.contractassembly.content.VersionStatus;
import io.b2mash.b2b.contractassembly.event.ContractCompletedEvent;
import io.b2mash.b2b.contractassembly.event.ContractValidatedEvent;
import io.b2mash.b2b.contractassembly.exception.ConcurrentContractModificationException;
import io.b2mash.b2b.contractassembly.exception.ContentValidationException;
import io.b2mash.b2b.contractassembly.exception.LifecycleException;
import io.b2mash.b2b.contractassembly.exception.NoPublishedVersionException;
import io.b2mash.b2b.contractassembly.exception.ResourceNotFoundException;
import io.b2mash.b2b.contractassembly.exception.ValidationConflictException;
import io.b2mash.b2b.contractassembly.multitenancy.RequestScopes;
import io.b2mash.b2b.contractassembly.rule.RuleGraph;
import io.b2mash.b2b.contractassembly.rule.RuleGraphLoader;
import io.b2mash.b2b.contractassembly.validation.RuleValidationEngine;
import io.b2mash.b2b.contractassembly.validation.ValidationResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Assembles contracts from published content and guards their completion.
 *
 * <p>Starting or upgrading a contract resolves the current published version of the template and
 * of every clause its slots reference, and freezes those ids into the contract. Later publisher
 * changes never move the pins. Every change to answers or slot choices re-runs the rule engine
 * over the pinned versions.
 */
@Service
public class ContractService {

  private static final Logger log = LoggerFactory.getLogger(ContractService.class);

  private final ContractInstanceRepository contractRepository;
  private final TemplateRepository templateRepository;
  private final TemplateVersionRepository templateVersionRepository;
  private final ClauseRepository clauseRepository;
  private final ClauseVersionRepository clauseVersionRepository;
  private final RuleGraphLoader ruleGraphLoader;
  private final RuleValidationEngine validationEngine;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final ContractAssemblyProperties properties;

  public ContractService(
      ContractInstanceRepository contractRepository,
      TemplateRepository templateRepository,
      TemplateVersionRepository templateVersionRepository,
      ClauseRepository clauseRepository,
      ClauseVersionRepository clauseVersionRepository,
      RuleGraphLoader ruleGraphLoader,
      RuleValidationEngine validationEngine,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      ContractAssemblyProperties properties) {
    this.contractRepository = contractRepository;
    this.templateRepository = templateRepository;
    this.templateVersionRepository = templateVersionRepository;
    this.clauseRepository = clauseRepository;
    this.clauseVersionRepository = clauseVersionRepository;
    this.ruleGraphLoader = ruleGraphLoader;
    this.validationEngine = validationEngine;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
  }

  /**
   * Starts a contract from the template's current published version. Required and alternative
   * slots are pre-filled with their primary clause.
   *
   * @throws NoPublishedVersionException if the template, or the primary clause of a required or
   *     alternative slot, has no published version
   */
  @Transactional
  @RetryOnStorageFault
  public ContractInstance startContract(
      UUID templateId, String title, String clientReference, List<String> tags) {
    Template template =
        templateRepository
            .findById(templateId)
            .orElseThrow(() -> new ResourceNotFoundException("Template", templateId));
    if (!template.hasPublishedVersion()) {
      throw new NoPublishedVersionException("template", templateId);
    }
    TemplateVersion templateVersion = findTemplateVersion(template.getCurrentPublishedVersionId());
    ContractPins pins = resolvePins(templateVersion);

    Map<String, UUID> selected = new LinkedHashMap<>();
    for (TemplateSlot slot : templateVersion.slots()) {
      if (slot.type().mustBeFilled()) {
        selected.put(slot.slotId(), pins.versionByClause().get(slot.clauseId()));
      }
    }

    var contract =
        new ContractInstance(
            RequestScopes.requireTenantId(),
            RequestScopes.requireActorId(),
            title,
            clientReference,
            tags,
            templateId,
            templateVersion.getId(),
            pins.clauseVersionIds(),
            template.getJurisdiction(),
            selected);
    contract = contractRepository.save(contract);
    revalidate(contract);
    contract = contractRepository.save(contract);

    log.info(
        "Started contract {} from template version {} with {} pinned clause version(s)",
        contract.getId(),
        templateVersion.getId(),
        pins.clauseVersionIds().size());
    audit(
        "contract.created",
        contract,
        Map.of(
            "title", title,
            "templateVersionId", templateVersion.getId().toString(),
            "clauseVersionCount", pins.clauseVersionIds().size()));
    return contract;
  }

  @Transactional
  @RetryOnStorageFault
  public ContractInstance updateAnswers(UUID contractId, Map<String, Object> answers) {
    ContractInstance contract = findContract(contractId);
    contract.mergeAnswers(answers);
    if (properties.validation().revalidateOnChange()) {
      revalidate(contract);
    }
    return contractRepository.save(contract);
  }

  /**
   * Fills a slot with one of its offered clauses, or clears it when {@code clauseVersionId} is
   * null. The chosen version must be one of the contract's pins.
   */
  @Transactional
  @RetryOnStorageFault
  public ContractInstance selectSlot(UUID contractId, String slotId, UUID clauseVersionId) {
    ContractInstance contract = findContract(contractId);
    TemplateVersion templateVersion = findTemplateVersion(contract.getTemplateVersionId());
    TemplateSlot slot =
        templateVersion
            .findSlot(slotId)
            .orElseThrow(() -> new ResourceNotFoundException("Slot", slotId));

    if (clauseVersionId != null) {
      if (!contract.getClauseVersionIds().contains(clauseVersionId)) {
        throw new ContentValidationException(
            List.of("clause version " + clauseVersionId + " is not pinned by this contract"));
      }
      ClauseVersion chosen =
          clauseVersionRepository
              .findById(clauseVersionId)
              .orElseThrow(() -> new ResourceNotFoundException("ClauseVersion", clauseVersionId));
      if (!slot.offeredClauseIds().contains(chosen.getEntityId())) {
        throw new ContentValidationException(
            List.of("clause " + chosen.getEntityId() + " is not offered for slot " + slotId));
      }
    }

    contract.selectSlot(slotId, clauseVersionId);
    if (properties.validation().revalidateOnChange()) {
      revalidate(contract);
    }
    return contractRepository.save(contract);
  }

  @Transactional
  @RetryOnStorageFault
  public ContractInstance updateMetadata(
      UUID contractId, String title, String clientReference, List<String> tags) {
    ContractInstance contract = findContract(contractId);
    contract.updateMetadata(title, clientReference, tags);
    return contractRepository.save(contract);
  }

  /** Re-runs the rule engine over the pinned versions and stores the outcome. */
  @Transactional
  @RetryOnStorageFault
  public ValidationResult validate(UUID contractId) {
    ContractInstance contract = findContract(contractId);
    ValidationResult result = revalidate(contract);
    contractRepository.save(contract);
    return result;
  }

  /**
   * Moves a draft contract to a newer published version of its template. Pins are re-resolved;
   * slot choices whose clause is still offered carry over to that clause's new pin.
   */
  @Transactional
  @RetryOnStorageFault
  public ContractInstance upgrade(UUID contractId, UUID newTemplateVersionId) {
    ContractInstance contract = findContract(contractId);
    TemplateVersion target = findTemplateVersion(newTemplateVersionId);
    if (!target.getEntityId().equals(contract.getTemplateId())) {
      throw new LifecycleException(
          "Wrong template",
          "Template version "
              + newTemplateVersionId
              + " does not belong to template "
              + contract.getTemplateId());
    }
    if (target.getStatus() != VersionStatus.PUBLISHED) {
      throw new LifecycleException(
          "Template version not published",
          "Contracts can only be upgraded to a PUBLISHED template version",
          target.getStatus().name());
    }

    UUID previousTemplateVersionId = contract.getTemplateVersionId();
    ContractPins pins = resolvePins(target);
    Map<String, UUID> selected = carryOverSelections(contract, target, pins);

    contract.repin(target.getId(), pins.clauseVersionIds(), selected);
    revalidate(contract);
    try {
      contract = contractRepository.saveAndFlush(contract);
    } catch (ObjectOptimisticLockingFailureException e) {
      log.warn("Upgrade of contract {} lost against a concurrent change", contractId);
      throw new ConcurrentContractModificationException(contractId, "upgrade", e);
    }

    log.info(
        "Upgraded contract {} from template version {} to {}",
        contractId,
        previousTemplateVersionId,
        target.getId());
    audit(
        "contract.upgraded",
        contract,
        Map.of(
            "fromTemplateVersionId", previousTemplateVersionId.toString(),
            "toTemplateVersionId", target.getId().toString()));
    return contract;
  }

  /**
   * Completes a draft contract and freezes its pins.
   *
   * @throws LifecycleException if the contract is not a draft or required slots are empty
   * @throws ValidationConflictException if hard rule violations remain; nothing is changed
   * @throws ConcurrentContractModificationException if the contract changed concurrently
   */
  @Transactional
  @RetryOnStorageFault
  public ContractInstance complete(UUID contractId) {
    ContractInstance contract = findContract(contractId);
    if (contract.getStatus() != ContractStatus.DRAFT) {
      throw new LifecycleException(
          "Invalid contract state",
          "Contract " + contractId + " is already " + contract.getStatus(),
          contract.getStatus().name());
    }

    TemplateVersion templateVersion = findTemplateVersion(contract.getTemplateVersionId());
    List<String> emptySlots =
        templateVersion.slots().stream()
            .filter(slot -> slot.type().mustBeFilled())
            .map(TemplateSlot::slotId)
            .filter(slotId -> contract.getSelectedSlots().get(slotId) == null)
            .toList();
    if (!emptySlots.isEmpty()) {
      throw new LifecycleException(
          "Required slots empty",
          "Fill the required slots before completing: " + emptySlots,
          contract.getStatus().name());
    }

    ValidationResult result = evaluate(contract);
    if (result.hasConflicts()) {
      log.info(
          "Completion of contract {} blocked by {} violation(s)",
          contractId,
          result.messages().size());
      throw new ValidationConflictException(result.messages());
    }

    contract.recordValidation(result);
    contract.complete();
    ContractInstance completed;
    try {
      completed = contractRepository.saveAndFlush(contract);
    } catch (ObjectOptimisticLockingFailureException e) {
      log.warn("Completion of contract {} lost against a concurrent change", contractId);
      throw new ConcurrentContractModificationException(contractId, "complete", e);
    }

    log.info("Completed contract {}", contractId);
    eventPublisher.publishEvent(
        new ContractCompletedEvent(
            ContractCompletedEvent.EVENT_TYPE,
            "contract",
            completed.getId(),
            completed.getTenantId(),
            RequestScopes.getActorIdOrNull(),
            Instant.now(),
            Map.of(
                "templateVersionId", completed.getTemplateVersionId().toString(),
                "clauseVersionCount", completed.getClauseVersionIds().size()),
            completed.getTemplateVersionId(),
            completed.getClauseVersionIds()));
    return completed;
  }

  @Transactional
  @RetryOnStorageFault
  public ContractInstance archive(UUID contractId) {
    ContractInstance contract = findContract(contractId);
    contract.archive();
    contract = contractRepository.save(contract);
    log.info("Archived contract {}", contractId);
    audit("contract.archived", contract, Map.of());
    return contract;
  }

  /**
   * Returns the frozen content of a completed or archived contract, read by pinned id only.
   *
   * @throws LifecycleException if the contract is still a draft
   */
  @Transactional(readOnly = true)
  public PinnedContent getPinnedContent(UUID contractId) {
    ContractInstance contract = findContract(contractId);
    if (!contract.getStatus().isFrozen()) {
      throw new LifecycleException(
          "Contract not completed",
          "Pinned content is only available for completed contracts",
          contract.getStatus().name());
    }
    TemplateVersion templateVersion = findTemplateVersion(contract.getTemplateVersionId());
    Map<UUID, ClauseVersion> byId =
        clauseVersionRepository.findByIdIn(contract.getClauseVersionIds()).stream()
            .collect(Collectors.toMap(ClauseVersion::getId, Function.identity()));
    List<ClauseVersion> clauseVersions = new ArrayList<>();
    for (UUID pinned : contract.getClauseVersionIds()) {
      ClauseVersion version = byId.get(pinned);
      if (version == null) {
        throw new ResourceNotFoundException("ClauseVersion", pinned);
      }
      clauseVersions.add(version);
    }
    return new PinnedContent(
        contract.getId(),
        templateVersion,
        clauseVersions,
        contract.getSelectedSlots(),
        contract.getAnswers());
  }

  @Transactional(readOnly = true)
  public ContractInstance getContract(UUID contractId) {
    return findContract(contractId);
  }

  @Transactional(readOnly = true)
  public Page<ContractInstance> listContracts(ContractStatus status, Pageable pageable) {
    String tenantId = RequestScopes.requireTenantId();
    if (status == null) {
      return contractRepository.findByTenantId(tenantId, pageable);
    }
    return contractRepository.findByTenantIdAndStatus(tenantId, status, pageable);
  }

  // --- Helpers ---

  /**
   * Resolves the current published version of every clause the template version references.
   * Required and alternative slots must have a published primary clause; other references without
   * one are left unpinned.
   */
  private ContractPins resolvePins(TemplateVersion templateVersion) {
    Map<UUID, Clause> clauses = new HashMap<>();
    clauseRepository
        .findAllById(templateVersion.referencedClauseIds())
        .forEach(c -> clauses.put(c.getId(), c));

    for (TemplateSlot slot : templateVersion.slots()) {
      Clause primary = clauses.get(slot.clauseId());
      if (slot.type().mustBeFilled() && (primary == null || !primary.hasPublishedVersion())) {
        throw new NoPublishedVersionException("clause", slot.clauseId());
      }
    }

    List<UUID> pinned = new ArrayList<>();
    Map<UUID, UUID> versionByClause = new LinkedHashMap<>();
    for (UUID clauseId : templateVersion.referencedClauseIds()) {
      Clause clause = clauses.get(clauseId);
      if (clause != null && clause.hasPublishedVersion()) {
        pinned.add(clause.getCurrentPublishedVersionId());
        versionByClause.put(clauseId, clause.getCurrentPublishedVersionId());
      }
    }
    return new ContractPins(List.copyOf(pinned), versionByClause);
  }

  private Map<String, UUID> carryOverSelections(
      ContractInstance contract, TemplateVersion target, ContractPins pins) {
    Map<UUID, UUID> clauseOfOldVersion = new HashMap<>();
    clauseVersionRepository
        .findByIdIn(contract.selectedClauseVersionIds())
        .forEach(v -> clauseOfOldVersion.put(v.getId(), v.getEntityId()));

    Map<String, UUID> selected = new LinkedHashMap<>();
    for (TemplateSlot slot : target.slots()) {
      UUID previousChoice = contract.getSelectedSlots().get(slot.slotId());
      UUID previousClause = previousChoice != null ? clauseOfOldVersion.get(previousChoice) : null;
      UUID carried =
          previousClause != null && slot.offeredClauseIds().contains(previousClause)
              ? pins.versionByClause().get(previousClause)
              : null;
      if (carried != null) {
        selected.put(slot.slotId(), carried);
      } else if (slot.type().mustBeFilled()) {
        selected.put(slot.slotId(), pins.versionByClause().get(slot.clauseId()));
      }
    }
    return selected;
  }

  private ValidationResult evaluate(ContractInstance contract) {
    RuleGraph graph = ruleGraphLoader.forVersions(contract.getClauseVersionIds());
    return validationEngine.evaluate(
        contract.selectedClauseVersionIds(),
        contract.getAnswers(),
        contract.getJurisdiction(),
        graph);
  }

  private ValidationResult revalidate(ContractInstance contract) {
    ValidationResult result = evaluate(contract);
    contract.recordValidation(result);
    log.debug(
        "Validated contract {}: state={}, messages={}",
        contract.getId(),
        result.validationState(),
        result.messages().size());
    eventPublisher.publishEvent(
        new ContractValidatedEvent(
            ContractValidatedEvent.EVENT_TYPE,
            "contract",
            contract.getId(),
            contract.getTenantId(),
            RequestScopes.getActorIdOrNull(),
            Instant.now(),
            Map.of(
                "validationState", result.validationState().name(),
                "messageCount", result.messages().size()),
            result.validationState().name(),
            result.messages().size()));
    return result;
  }

  private ContractInstance findContract(UUID contractId) {
    return contractRepository
        .findByIdAndTenantId(contractId, RequestScopes.requireTenantId())
        .orElseThrow(() -> new ResourceNotFoundException("Contract", contractId));
  }

  private TemplateVersion findTemplateVersion(UUID templateVersionId) {
    return templateVersionRepository
        .findById(templateVersionId)
        .orElseThrow(() -> new ResourceNotFoundException("TemplateVersion", templateVersionId));
  }

  private void audit(String eventType, ContractInstance contract, Map<String, Object> details) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("contract")
            .entityId(contract.getId())
            .details(details)
            .build());
  }
}
