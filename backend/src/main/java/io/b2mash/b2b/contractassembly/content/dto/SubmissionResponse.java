package io.b2mash.b2b.contractassembly.content.dto;

import io.b2mash.b2b.contractassembly.content.GateResult;
import java.util.List;

/** Version that entered review plus the gate warnings that did not block it. */
public record SubmissionResponse<T>(T version, List<GateResult> warnings) {}
