package io.b2mash.b2b.contractassembly.contract.dto;

import jakarta.validation.constraints.NotNull;
import java.util.Map;

/** Answers to merge into the contract. A null value removes that answer. */
public record UpdateAnswersRequest(
    @NotNull(message = "answers is required") Map<String, Object> answers) {}
