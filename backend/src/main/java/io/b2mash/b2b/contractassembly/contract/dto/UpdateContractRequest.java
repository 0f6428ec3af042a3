package io.b2mash.b2b.contractassembly.contract.dto;

import jakarta.validation.constraints.Size;
import java.util.List;

public record UpdateContractRequest(
    @Size(max = 500, message = "title must not exceed 500 characters") String title,
    @Size(max = 255, message = "clientReference must not exceed 255 characters")
        String clientReference,
    List<String> tags) {}
