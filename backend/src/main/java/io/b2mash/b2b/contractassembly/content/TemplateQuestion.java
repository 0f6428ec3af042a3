package io.b2mash.b2b.contractassembly.content;

import java.util.List;

/**
 * An interview question whose answer feeds rule conditions.
 *
 * @param questionId identifier referenced by conditions
 * @param label text shown to the user
 * @param type answer type hint ("text", "number", "boolean", "choice", ...)
 * @param options allowed values for choice questions; empty otherwise
 */
public record TemplateQuestion(String questionId, String label, String type, List<String> options) {

  public TemplateQuestion {
    options = options == null ? List.of() : List.copyOf(options);
  }
}
