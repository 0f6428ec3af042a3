package io.b2mash.b2b.contractassembly.content;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import java.util.List;

/** A legal clause maintained by a publisher; its text and rules live in {@link ClauseVersion}s. */
@Entity
@Table(name = "clauses")
public class Clause extends LogicalEntity {

  /** JPA-required no-arg constructor. */
  protected Clause() {}

  public Clause(
      String tenantId, String title, String jurisdiction, String legalArea, List<String> tags) {
    super(tenantId, title, jurisdiction, legalArea, tags);
  }
}
