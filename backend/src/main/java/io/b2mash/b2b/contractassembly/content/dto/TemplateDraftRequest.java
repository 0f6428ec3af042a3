package io.b2mash.b2b.contractassembly.content.dto;

import io.b2mash.b2b.contractassembly.content.TemplateContent;
import io.b2mash.b2b.contractassembly.content.TemplateQuestion;
import io.b2mash.b2b.contractassembly.content.TemplateSection;
import java.util.List;

/** Body of create-draft and update-draft for templates. Shape is checked by the service. */
public record TemplateDraftRequest(
    List<TemplateSection> structure, List<TemplateQuestion> questions) {

  public TemplateContent toContent() {
    return new TemplateContent(structure, questions);
  }
}
