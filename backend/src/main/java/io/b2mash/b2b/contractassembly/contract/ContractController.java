package io.b2mash.b2b.contractassembly.contract;

import io.b2mash.b2b.contractassembly.contract.dto.ContractResponse;
import io.b2mash.b2b.contractassembly.contract.dto.PinnedContentResponse;
import io.b2mash.b2b.contractassembly.contract.dto.SelectSlotRequest;
import io.b2mash.b2b.contractassembly.contract.dto.StartContractRequest;
import io.b2mash.b2b.contractassembly.contract.dto.UpdateAnswersRequest;
import io.b2mash.b2b.contractassembly.contract.dto.UpdateContractRequest;
import io.b2mash.b2b.contractassembly.contract.dto.UpgradeContractRequest;
import io.b2mash.b2b.contractassembly.contract.dto.ValidationResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/contracts")
public class ContractController {

  private final ContractService contractService;

  public ContractController(ContractService contractService) {
    this.contractService = contractService;
  }

  @GetMapping
  public ResponseEntity<Page<ContractResponse>> listContracts(
      @RequestParam(required = false) ContractStatus status,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size) {
    var pageable =
        PageRequest.of(page, Math.min(size, 100), Sort.by(Sort.Direction.DESC, "updatedAt"));
    return ResponseEntity.ok(
        contractService.listContracts(status, pageable).map(ContractResponse::from));
  }

  @GetMapping("/{id}")
  public ResponseEntity<ContractResponse> getContract(@PathVariable UUID id) {
    return ResponseEntity.ok(ContractResponse.from(contractService.getContract(id)));
  }

  @PostMapping
  public ResponseEntity<ContractResponse> startContract(
      @Valid @RequestBody StartContractRequest request) {
    var contract =
        contractService.startContract(
            request.templateId(), request.title(), request.clientReference(), request.tags());
    return ResponseEntity.created(URI.create("/api/contracts/" + contract.getId()))
        .body(ContractResponse.from(contract));
  }

  @PutMapping("/{id}")
  public ResponseEntity<ContractResponse> updateContract(
      @PathVariable UUID id, @Valid @RequestBody UpdateContractRequest request) {
    var contract =
        contractService.updateMetadata(
            id, request.title(), request.clientReference(), request.tags());
    return ResponseEntity.ok(ContractResponse.from(contract));
  }

  @PatchMapping("/{id}/answers")
  public ResponseEntity<ContractResponse> updateAnswers(
      @PathVariable UUID id, @Valid @RequestBody UpdateAnswersRequest request) {
    return ResponseEntity.ok(
        ContractResponse.from(contractService.updateAnswers(id, request.answers())));
  }

  @PutMapping("/{id}/slots/{slotId}")
  public ResponseEntity<ContractResponse> selectSlot(
      @PathVariable UUID id,
      @PathVariable String slotId,
      @RequestBody SelectSlotRequest request) {
    return ResponseEntity.ok(
        ContractResponse.from(contractService.selectSlot(id, slotId, request.clauseVersionId())));
  }

  @PostMapping("/{id}/validate")
  public ResponseEntity<ValidationResponse> validate(@PathVariable UUID id) {
    return ResponseEntity.ok(ValidationResponse.from(contractService.validate(id)));
  }

  @PostMapping("/{id}/upgrade")
  public ResponseEntity<ContractResponse> upgrade(
      @PathVariable UUID id, @Valid @RequestBody UpgradeContractRequest request) {
    return ResponseEntity.ok(
        ContractResponse.from(contractService.upgrade(id, request.templateVersionId())));
  }

  @PostMapping("/{id}/complete")
  public ResponseEntity<ContractResponse> complete(@PathVariable UUID id) {
    return ResponseEntity.ok(ContractResponse.from(contractService.complete(id)));
  }

  @PostMapping("/{id}/archive")
  public ResponseEntity<ContractResponse> archive(@PathVariable UUID id) {
    return ResponseEntity.ok(ContractResponse.from(contractService.archive(id)));
  }

  /** Frozen template and clause versions of a completed contract. */
  @GetMapping("/{id}/pinned-content")
  public ResponseEntity<PinnedContentResponse> pinnedContent(@PathVariable UUID id) {
    return ResponseEntity.ok(PinnedContentResponse.from(contractService.getPinnedContent(id)));
  }
}
