package io.b2mash.b2b.contractassembly.content;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import java.util.List;

/** A contract template; its slot structure lives in {@link TemplateVersion}s. */
@Entity
@Table(name = "templates")
public class Template extends LogicalEntity {

  @Column(name = "description", length = 2000)
  private String description;

  @Column(name = "category", length = 100)
  private String category;

  /** JPA-required no-arg constructor. */
  protected Template() {}

  public Template(
      String tenantId,
      String title,
      String jurisdiction,
      String legalArea,
      List<String> tags,
      String description,
      String category) {
    super(tenantId, title, jurisdiction, legalArea, tags);
    this.description = description;
    this.category = category;
  }

  public String getDescription() {
    return description;
  }

  public String getCategory() {
    return category;
  }
}
