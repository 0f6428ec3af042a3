package io.b2mash.b2b.contractassembly.content;

/** Repository for {@link TemplateVersion} entities. */
public interface TemplateVersionRepository extends ContentVersionRepository<TemplateVersion> {}
