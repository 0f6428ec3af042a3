package io.b2mash.b2b.contractassembly.content;

/** Repository for {@link Clause} entities. */
public interface ClauseRepository extends LogicalEntityRepository<Clause> {}
