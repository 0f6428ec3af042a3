package io.b2mash.b2b.contractassembly.content;

import io.b2mash.b2b.contractassembly.audit.AuditEventBuilder;
import io.b2mash.b2b.contractassembly.audit.AuditService;
import io.b2mash.b2b.contractassembly.config.RetryOnStorageFault;
import io.b2mash.b2b.contractassembly.multitenancy.RequestScopes;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Service for templates, their versions and the catalog of published templates. */
@Service
public class TemplateLifecycleService
    extends AbstractVersionLifecycleService<Template, TemplateVersion, TemplateContent> {

  private static final Logger log = LoggerFactory.getLogger(TemplateLifecycleService.class);

  private final TemplateRepository templateRepository;

  public TemplateLifecycleService(
      TemplateRepository templateRepository,
      TemplateVersionRepository templateVersionRepository,
      TemplatePublishingGate templatePublishingGate,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher) {
    super(
        templateRepository,
        templateVersionRepository,
        templatePublishingGate,
        auditService,
        eventPublisher);
    this.templateRepository = templateRepository;
  }

  @Transactional
  @RetryOnStorageFault
  public Template createTemplate(
      String title,
      String jurisdiction,
      String legalArea,
      List<String> tags,
      String description,
      String category) {
    var template =
        templateRepository.save(
            new Template(
                RequestScopes.requireTenantId(),
                title,
                jurisdiction,
                legalArea,
                tags,
                description,
                category));

    log.info("Created template {} title={}", template.getId(), template.getTitle());

    var details = new HashMap<String, Object>();
    details.put("title", template.getTitle());
    details.put("jurisdiction", jurisdiction);
    if (category != null) {
      details.put("category", category);
    }
    auditService()
        .log(
            AuditEventBuilder.builder()
                .eventType("template.created")
                .entityType("template")
                .entityId(template.getId())
                .details(details)
                .build());
    return template;
  }

  /** Templates that currently have a published version, optionally for one jurisdiction. */
  @Transactional(readOnly = true)
  public List<Template> listCatalog(String jurisdiction) {
    if (jurisdiction == null || jurisdiction.isBlank()) {
      return templateRepository.findByCurrentPublishedVersionIdIsNotNullOrderByTitleAsc();
    }
    return templateRepository
        .findByCurrentPublishedVersionIdIsNotNullAndJurisdictionOrderByTitleAsc(jurisdiction);
  }

  @Override
  protected String entityType() {
    return "template";
  }

  @Override
  protected TemplateVersion newDraft(
      Template template, int versionNumber, UUID authorId, TemplateContent content) {
    return new TemplateVersion(template, versionNumber, authorId, content);
  }

  @Override
  protected TemplateVersion reworkOf(TemplateVersion rejected, int versionNumber) {
    return TemplateVersion.reworkOf(rejected, versionNumber);
  }

  @Override
  protected void applyContent(TemplateVersion draft, TemplateContent content) {
    draft.updateContent(content);
  }

  @Override
  protected List<String> shapeProblems(TemplateContent content) {
    return ContentShapeValidator.templateProblems(content);
  }
}
