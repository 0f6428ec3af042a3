package io.b2mash.b2b.contractassembly.content;

import io.b2mash.b2b.contractassembly.content.dto.CreateTemplateRequest;
import io.b2mash.b2b.contractassembly.content.dto.TemplateDraftRequest;
import io.b2mash.b2b.contractassembly.content.dto.TemplateResponse;
import io.b2mash.b2b.contractassembly.content.dto.TemplateVersionResponse;
import io.b2mash.b2b.contractassembly.multitenancy.RequestScopes;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for templates of the calling publisher and the published catalog. */
@RestController
@RequestMapping("/api")
public class TemplateController {

  private final TemplateLifecycleService templateService;

  public TemplateController(TemplateLifecycleService templateService) {
    this.templateService = templateService;
  }

  @GetMapping("/templates")
  public ResponseEntity<List<TemplateResponse>> listTemplates() {
    return ResponseEntity.ok(
        templateService.listEntities().stream().map(TemplateResponse::from).toList());
  }

  @GetMapping("/templates/{id}")
  public ResponseEntity<TemplateResponse> getTemplate(@PathVariable UUID id) {
    return ResponseEntity.ok(TemplateResponse.from(templateService.getEntity(id)));
  }

  @PostMapping("/templates")
  public ResponseEntity<TemplateResponse> createTemplate(
      @Valid @RequestBody CreateTemplateRequest request) {
    var template =
        templateService.createTemplate(
            request.title(),
            request.jurisdiction(),
            request.legalArea(),
            request.tags(),
            request.description(),
            request.category());
    return ResponseEntity.created(URI.create("/api/templates/" + template.getId()))
        .body(TemplateResponse.from(template));
  }

  @GetMapping("/templates/{id}/versions")
  public ResponseEntity<List<TemplateVersionResponse>> listVersions(@PathVariable UUID id) {
    return ResponseEntity.ok(
        templateService.listVersions(id).stream().map(TemplateVersionResponse::from).toList());
  }

  @PostMapping("/templates/{id}/versions")
  public ResponseEntity<TemplateVersionResponse> createDraft(
      @PathVariable UUID id, @RequestBody TemplateDraftRequest request) {
    var draft =
        templateService.createDraft(id, request.toContent(), RequestScopes.requireActorId());
    return ResponseEntity.created(URI.create("/api/template-versions/" + draft.getId()))
        .body(TemplateVersionResponse.from(draft));
  }

  /** Templates that can be used to start a contract. */
  @GetMapping("/catalog/templates")
  public ResponseEntity<List<TemplateResponse>> catalog(
      @RequestParam(required = false) String jurisdiction) {
    return ResponseEntity.ok(
        templateService.listCatalog(jurisdiction).stream().map(TemplateResponse::from).toList());
  }
}
