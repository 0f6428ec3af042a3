package io.b2mash.b2b.contractassembly.content;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of a bulk content import, item by item. An import with any {@link Status#ERROR} item
 * writes nothing.
 */
public record ImportReport(Summary summary, List<Item> items) {

  public ImportReport {
    items = List.copyOf(items);
  }

  public static ImportReport of(List<Item> items, int questionsCreated, int questionsSkipped) {
    return new ImportReport(
        new Summary(
            Counts.of(items, Kind.CLAUSE),
            Counts.of(items, Kind.TEMPLATE),
            new Counts(questionsCreated, questionsSkipped, 0)),
        items);
  }

  @JsonIgnore
  public boolean hasErrors() {
    return items.stream().anyMatch(item -> item.status() == Status.ERROR);
  }

  @JsonIgnore
  public List<Item> errors() {
    return items.stream().filter(item -> item.status() == Status.ERROR).toList();
  }

  public record Summary(Counts clauses, Counts templates, Counts questions) {}

  public record Counts(int created, int skipped, int errors) {

    static Counts of(List<Item> items, Kind kind) {
      int created = 0;
      int skipped = 0;
      int errors = 0;
      for (Item item : items) {
        if (item.kind() != kind) {
          continue;
        }
        switch (item.status()) {
          case CREATED -> created++;
          case SKIPPED -> skipped++;
          case ERROR -> errors++;
        }
      }
      return new Counts(created, skipped, errors);
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Item(Kind kind, String title, Status status, String reason, UUID id) {

    static Item created(Kind kind, String title, UUID id) {
      return new Item(kind, title, Status.CREATED, null, id);
    }

    static Item skipped(Kind kind, String title, String reason) {
      return new Item(kind, title, Status.SKIPPED, reason, null);
    }

    static Item error(Kind kind, String title, String reason) {
      return new Item(kind, title, Status.ERROR, reason, null);
    }
  }

  public enum Kind {
    @JsonProperty("clause")
    CLAUSE,
    @JsonProperty("template")
    TEMPLATE
  }

  public enum Status {
    @JsonProperty("created")
    CREATED,
    @JsonProperty("skipped")
    SKIPPED,
    @JsonProperty("error")
    ERROR
  }
}
