package io.b2mash.b2b.contractassembly.content;

import io.b2mash.b2b.contractassembly.content.dto.ClauseDraftRequest;
import io.b2mash.b2b.contractassembly.content.dto.ClauseResponse;
import io.b2mash.b2b.contractassembly.content.dto.ClauseVersionResponse;
import io.b2mash.b2b.contractassembly.content.dto.CreateClauseRequest;
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
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the clause library of the calling publisher. */
@RestController
@RequestMapping("/api/clauses")
public class ClauseController {

  private final ClauseLifecycleService clauseService;

  public ClauseController(ClauseLifecycleService clauseService) {
    this.clauseService = clauseService;
  }

  @GetMapping
  public ResponseEntity<List<ClauseResponse>> listClauses() {
    return ResponseEntity.ok(
        clauseService.listEntities().stream().map(ClauseResponse::from).toList());
  }

  @GetMapping("/{id}")
  public ResponseEntity<ClauseResponse> getClause(@PathVariable UUID id) {
    return ResponseEntity.ok(ClauseResponse.from(clauseService.getEntity(id)));
  }

  @PostMapping
  public ResponseEntity<ClauseResponse> createClause(
      @Valid @RequestBody CreateClauseRequest request) {
    var clause =
        clauseService.createClause(
            request.title(), request.jurisdiction(), request.legalArea(), request.tags());
    return ResponseEntity.created(URI.create("/api/clauses/" + clause.getId()))
        .body(ClauseResponse.from(clause));
  }

  @GetMapping("/{id}/versions")
  public ResponseEntity<List<ClauseVersionResponse>> listVersions(@PathVariable UUID id) {
    return ResponseEntity.ok(
        clauseService.listVersions(id).stream().map(ClauseVersionResponse::from).toList());
  }

  @PostMapping("/{id}/versions")
  public ResponseEntity<ClauseVersionResponse> createDraft(
      @PathVariable UUID id, @RequestBody ClauseDraftRequest request) {
    var draft = clauseService.createDraft(id, request.toContent(), RequestScopes.requireActorId());
    return ResponseEntity.created(URI.create("/api/clause-versions/" + draft.getId()))
        .body(ClauseVersionResponse.from(draft));
  }
}
