package io.b2mash.b2b.contractassembly.content;

import java.util.List;

/** Editable payload of a template draft. */
public record TemplateContent(List<TemplateSection> structure, List<TemplateQuestion> questions) {

  public TemplateContent {
    structure = structure == null ? List.of() : List.copyOf(structure);
    questions = questions == null ? List.of() : List.copyOf(questions);
  }
}
