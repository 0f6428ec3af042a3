package io.b2mash.b2b.contractassembly.content;

import java.util.List;

/** Repository for {@link Template} entities. */
public interface TemplateRepository extends LogicalEntityRepository<Template> {

  List<Template> findByCurrentPublishedVersionIdIsNotNullOrderByTitleAsc();

  List<Template> findByCurrentPublishedVersionIdIsNotNullAndJurisdictionOrderByTitleAsc(
      String jurisdiction);
}
