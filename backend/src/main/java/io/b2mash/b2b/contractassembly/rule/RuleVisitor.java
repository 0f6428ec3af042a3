package io.b2mash.b2b.contractassembly.rule;

/** Exhaustive dispatch over the five rule variants. */
public interface RuleVisitor<R> {

  R visitRequires(Rule.Requires rule);

  R visitForbids(Rule.Forbids rule);

  R visitIncompatibleWith(Rule.IncompatibleWith rule);

  R visitScopedTo(Rule.ScopedTo rule);

  R visitRequiresAnswer(Rule.RequiresAnswer rule);
}
