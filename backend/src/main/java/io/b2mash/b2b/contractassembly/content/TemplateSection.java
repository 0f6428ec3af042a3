package io.b2mash.b2b.contractassembly.content;

import java.util.List;

public record TemplateSection(String title, List<TemplateSlot> slots) {

  public TemplateSection {
    slots = slots == null ? List.of() : List.copyOf(slots);
  }
}
