package io.b2mash.b2b.contractassembly.content;

import io.b2mash.b2b.contractassembly.content.dto.ChangelogEntryRequest;
import io.b2mash.b2b.contractassembly.content.dto.ClauseDraftRequest;
import io.b2mash.b2b.contractassembly.content.dto.ClauseVersionResponse;
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

/** REST controller for the lifecycle of individual clause versions. */
@RestController
@RequestMapping("/api/clause-versions")
public class ClauseVersionController {

  private final ClauseLifecycleService clauseService;

  public ClauseVersionController(ClauseLifecycleService clauseService) {
    this.clauseService = clauseService;
  }

  @GetMapping("/{id}")
  public ResponseEntity<ClauseVersionResponse> getVersion(@PathVariable UUID id) {
    return ResponseEntity.ok(ClauseVersionResponse.from(clauseService.getVersion(id)));
  }

  @PutMapping("/{id}")
  public ResponseEntity<ClauseVersionResponse> updateDraft(
      @PathVariable UUID id, @RequestBody ClauseDraftRequest request) {
    return ResponseEntity.ok(
        ClauseVersionResponse.from(clauseService.updateDraft(id, request.toContent())));
  }

  @PostMapping("/{id}/changelog")
  public ResponseEntity<ClauseVersionResponse> addChangelogEntry(
      @PathVariable UUID id, @Valid @RequestBody ChangelogEntryRequest request) {
    var version =
        clauseService.addChangelogEntry(
            id,
            request.changeType(),
            request.legalImpact(),
            request.summary(),
            request.migrationNotes(),
            RequestScopes.requireActorId());
    return ResponseEntity.status(HttpStatus.CREATED).body(ClauseVersionResponse.from(version));
  }

  @GetMapping("/{id}/gates")
  public ResponseEntity<GateReport> checkGates(@PathVariable UUID id) {
    return ResponseEntity.ok(clauseService.checkGates(id));
  }

  @PostMapping("/{id}/submit")
  public ResponseEntity<SubmissionResponse<ClauseVersionResponse>> submitForReview(
      @PathVariable UUID id, @Valid @RequestBody SubmitForReviewRequest request) {
    var submission = clauseService.submitForReview(id, request.reviewerId());
    return ResponseEntity.ok(
        new SubmissionResponse<>(
            ClauseVersionResponse.from(submission.version()), submission.warnings()));
  }

  @PostMapping("/{id}/approve")
  public ResponseEntity<ClauseVersionResponse> approve(@PathVariable UUID id) {
    return ResponseEntity.ok(
        ClauseVersionResponse.from(clauseService.approve(id, RequestScopes.requireActorId())));
  }

  /** Returns the new draft created for rework. */
  @PostMapping("/{id}/reject")
  public ResponseEntity<ClauseVersionResponse> reject(
      @PathVariable UUID id, @Valid @RequestBody RejectVersionRequest request) {
    var rework = clauseService.reject(id, RequestScopes.requireActorId(), request.comment());
    return ResponseEntity.status(HttpStatus.CREATED).body(ClauseVersionResponse.from(rework));
  }

  @PostMapping("/{id}/deprecate")
  public ResponseEntity<ClauseVersionResponse> deprecate(
      @PathVariable UUID id, @Valid @RequestBody DeprecateVersionRequest request) {
    return ResponseEntity.ok(
        ClauseVersionResponse.from(clauseService.deprecate(id, request.reason())));
  }

  @GetMapping("/{id}/review-history")
  public ResponseEntity<List<ReviewHistoryEntry>> reviewHistory(@PathVariable UUID id) {
    return ResponseEntity.ok(clauseService.getReviewHistory(id));
  }

  @GetMapping("/review-queue")
  public ResponseEntity<List<ClauseVersionResponse>> reviewQueue() {
    return ResponseEntity.ok(
        clauseService.listReviewQueue(RequestScopes.requireActorId()).stream()
            .map(ClauseVersionResponse::from)
            .toList());
  }
}
