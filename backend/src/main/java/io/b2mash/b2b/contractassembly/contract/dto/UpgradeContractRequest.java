package io.b2mash.b2b.contractassembly.contract.dto;

import jakarta.validation.constraints.NotNull;
import java.util.UUID;

public record UpgradeContractRequest(
    @NotNull(message = "templateVersionId is required") UUID templateVersionId) {}
