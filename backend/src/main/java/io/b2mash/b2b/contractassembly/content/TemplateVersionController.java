package io.b2mash.b2b.contractassembly.content;

import io.b2mash.b2b.contractassembly.content.dto.ChangelogEntryRequest;
import io.b2mash.b2b.contractassembly.content.dto.TemplateDraftRequest;
import io.b2mash.b2b.contractassembly.content.dto.TemplateVersionResponse;
import io.b2mash.b2b.contractassembly.content.dto.DeprecateVersionRequest;
import io.b2mash.b2b.contractassembly.content.dto.RejectVersionRequest;
import io.b2mash.b2b.contractassembly.content.dto.SubmissionResponse;
import io.b2mash.b2b.contractassembly.content.dto.SubmitForReviewRequest;
import io.b2mash.b2b.contractassembly.multitenancy.RequestScopes;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the lifecycle of individual template versions. */
@RestController
@RequestMapping("/api/template-versions")
public class TemplateVersionController {

  private final TemplateLifecycleService templateService;

  public TemplateVersionController(TemplateLifecycleService templateService) {
    this.templateService = templateService;
  }

  @GetMapping("/{id}")
  public ResponseEntity<TemplateVersionResponse> getVersion(@PathVariable UUID id) {
    return ResponseEntity.ok(TemplateVersionResponse.from(templateService.getVersion(id)));
  }

  @PutMapping("/{id}")
  public ResponseEntity<TemplateVersionResponse> updateDraft(
      @PathVariable UUID id, @RequestBody TemplateDraftRequest request) {
    return ResponseEntity.ok(
        TemplateVersionResponse.from(templateService.updateDraft(id, request.toContent())));
  }

  @PostMapping("/{id}/changelog")
  public ResponseEntity<TemplateVersionResponse> addChangelogEntry(
      @PathVariable UUID id, @Valid @RequestBody ChangelogEntryRequest request) {
    var version =
        templateService.addChangelogEntry(
            id,
            request.changeType(),
            request.legalImpact(),
            request.summary(),
            request.migrationNotes(),
            RequestScopes.requireActorId());
    return ResponseEntity.status(HttpStatus.CREATED).body(TemplateVersionResponse.from(version));
  }

  @GetMapping("/{id}/gates")
  public ResponseEntity<GateReport> checkGates(@PathVariable UUID id) {
    return ResponseEntity.ok(templateService.checkGates(id));
  }

  @PostMapping("/{id}/submit")
  public ResponseEntity<SubmissionResponse<TemplateVersionResponse>> submitForReview(
      @PathVariable UUID id, @Valid @RequestBody SubmitForReviewRequest request) {
    var submission = templateService.submitForReview(id, request.reviewerId());
    return ResponseEntity.ok(
        new SubmissionResponse<>(
            TemplateVersionResponse.from(submission.version()), submission.warnings()));
  }

  @PostMapping("/{id}/approve")
  public ResponseEntity<TemplateVersionResponse> approve(@PathVariable UUID id) {
    return ResponseEntity.ok(
        TemplateVersionResponse.from(templateService.approve(id, RequestScopes.requireActorId())));
  }

  /** Returns the new draft created for rework. */
  @PostMapping("/{id}/reject")
  public ResponseEntity<TemplateVersionResponse> reject(
      @PathVariable UUID id, @Valid @RequestBody RejectVersionRequest request) {
    var rework = templateService.reject(id, RequestScopes.requireActorId(), request.comment());
    return ResponseEntity.status(HttpStatus.CREATED).body(TemplateVersionResponse.from(rework));
  }

  @PostMapping("/{id}/deprecate")
  public ResponseEntity<TemplateVersionResponse> deprecate(
      @PathVariable UUID id, @Valid @RequestBody DeprecateVersionRequest request) {
    return ResponseEntity.ok(
        TemplateVersionResponse.from(templateService.deprecate(id, request.reason())));
  }

  @GetMapping("/{id}/review-history")
  public ResponseEntity<List<ReviewHistoryEntry>> reviewHistory(@PathVariable UUID id) {
    return ResponseEntity.ok(templateService.getReviewHistory(id));
  }

  @GetMapping("/review-queue")
  public ResponseEntity<List<TemplateVersionResponse>> reviewQueue() {
    return ResponseEntity.ok(
        templateService.listReviewQueue(RequestScopes.requireActorId()).stream()
            .map(TemplateVersionResponse::from)
            .toList());
  }
}
