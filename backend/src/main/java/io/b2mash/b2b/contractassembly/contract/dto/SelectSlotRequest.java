package io.b2mash.b2b.contractassembly.contract.dto;

import java.util.UUID;

/** Pinned clause version to place in the slot; null clears the slot. */
public record SelectSlotRequest(UUID clauseVersionId) {}
