package io.b2mash.b2b.contractassembly.content;

import java.util.List;

/**
 * Checks a version must pass before it may enter review.
 *
 * @param <E> logical entity type
 * @param <V> version type
 */
public interface PublishingGate<E extends LogicalEntity, V extends ContentVersion> {

  GateReport evaluate(E entity, V version);

  /**
   * Checks that depend on what else is published, repeated inside the approving transaction. The
   * published state may have moved since the version entered review.
   */
  default GateReport evaluateAtPublish(E entity, V version) {
    return new GateReport(version.getId(), List.of());
  }
}
