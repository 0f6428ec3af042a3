package io.b2mash.b2b.contractassembly.content;

import java.util.Map;
import java.util.Set;

/**
 * Version lifecycle status with validated, forward-only transitions. Rejection does not move a
 * version back to DRAFT; it spawns a new draft copy instead.
 */
public enum VersionStatus {
  DRAFT,
  REVIEW,
  APPROVED,
  PUBLISHED,
  DEPRECATED;

  private static final Map<VersionStatus, Set<VersionStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          DRAFT, Set.of(REVIEW),
          REVIEW, Set.of(APPROVED),
          APPROVED, Set.of(PUBLISHED),
          PUBLISHED, Set.of(DEPRECATED));

  /** Returns the set of statuses this status can transition to. */
  public Set<VersionStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  /** Returns true if transitioning from this status to the target is allowed. */
  public boolean canTransitionTo(VersionStatus target) {
    return allowedTransitions().contains(target);
  }

  /** Returns true if content may still be edited. */
  public boolean isEditable() {
    return this == DRAFT;
  }
}
