package io.b2mash.b2b.contractassembly.content;

import static io.b2mash.b2b.contractassembly.testutil.TestContentFactory.TENANT;
import static io.b2mash.b2b.contractassembly.testutil.TestContentFactory.clause;
import static io.b2mash.b2b.contractassembly.testutil.TestContentFactory.template;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.contractassembly.content.dto.ContentImportRequest;
import io.b2mash.b2b.contractassembly.content.dto.ContentImportRequest.ClauseDefinition;
import io.b2mash.b2b.contractassembly.content.dto.ContentImportRequest.RuleDefinition;
import io.b2mash.b2b.contractassembly.content.dto.ContentImportRequest.SectionDefinition;
import io.b2mash.b2b.contractassembly.content.dto.ContentImportRequest.SlotDefinition;
import io.b2mash.b2b.contractassembly.content.dto.ContentImportRequest.TemplateDefinition;
import io.b2mash.b2b.contractassembly.content.dto.ContentImportRequest.VersionDefinition;
import io.b2mash.b2b.contractassembly.exception.ContentImportRejectedException;
import io.b2mash.b2b.contractassembly.multitenancy.RequestScopes;
import io.b2mash.b2b.contractassembly.rule.Rule;
import io.b2mash.b2b.contractassembly.rule.RuleType;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ContentImportServiceTest {

  private static final UUID EDITOR = UUID.randomUUID();

  @Mock private ClauseRepository clauseRepository;
  @Mock private TemplateRepository templateRepository;
  @Mock private ClauseLifecycleService clauseService;
  @Mock private TemplateLifecycleService templateService;

  private ContentImportService service;
  private final Clause venue = clause("Gerichtsstand");
  private final Map<String, Clause> createdClauses = new HashMap<>();

  @BeforeEach
  void setUp() {
    service =
        new ContentImportService(
            clauseRepository, templateRepository, clauseService, templateService);
    when(clauseRepository.findByTenantIdOrderByTitleAsc(TENANT)).thenReturn(List.of(venue));
    when(templateRepository.findByTenantIdOrderByTitleAsc(TENANT)).thenReturn(List.of());
  }

  @Test
  void importsClausesAndTemplatesResolvingTitlesWithinTheBatch() {
    stubCreation();
    var request =
        new ContentImportRequest(
            List.of(
                clauseDef("Honorar", rule(RuleType.REQUIRES, "Haftung")),
                clauseDef("Haftung", scopedToGermany()),
                clauseDef("Gerichtsstand", scopedToGermany())),
            List.of(
                templateDef(
                    "Beratungsvertrag",
                    new SlotDefinition("fee", "Honorar", SlotType.REQUIRED, null),
                    new SlotDefinition(null, "Gerichtsstand", SlotType.OPTIONAL, null))));

    var report = asEditor(() -> service.importContent(request));

    assertThat(report.hasErrors()).isFalse();
    assertThat(report.summary().clauses()).isEqualTo(new ImportReport.Counts(2, 1, 0));
    assertThat(report.summary().templates()).isEqualTo(new ImportReport.Counts(1, 0, 0));
    assertThat(report.summary().questions()).isEqualTo(new ImportReport.Counts(1, 0, 0));
    assertThat(report.items())
        .filteredOn(item -> item.status() == ImportReport.Status.CREATED)
        .allSatisfy(item -> assertThat(item.id()).isNotNull());

    UUID feeId = createdClauses.get("Honorar").getId();
    UUID liabilityId = createdClauses.get("Haftung").getId();
    var feeContent = ArgumentCaptor.forClass(ClauseContent.class);
    verify(clauseService).createDraft(eq(feeId), feeContent.capture(), eq(EDITOR));
    assertThat(feeContent.getValue().rules())
        .singleElement()
        .isInstanceOfSatisfying(
            Rule.Requires.class, rule -> assertThat(rule.targets()).containsExactly(liabilityId));

    var templateContent = ArgumentCaptor.forClass(TemplateContent.class);
    verify(templateService).createDraft(any(UUID.class), templateContent.capture(), eq(EDITOR));
    assertThat(templateContent.getValue().structure().get(0).slots())
        .extracting(TemplateSlot::slotId, TemplateSlot::clauseId)
        .containsExactly(
            tuple("fee", feeId),
            tuple("slot-2", venue.getId()));
    verify(clauseService, never()).createClause(eq("Gerichtsstand"), anyString(), any(), any());
  }

  @Test
  void unknownClauseTitleRejectsTheWholeBatch() {
    var request =
        new ContentImportRequest(
            List.of(clauseDef("Honorar", scopedToGermany())),
            List.of(
                templateDef(
                    "Beratungsvertrag",
                    new SlotDefinition("fee", "Unbekannt", SlotType.REQUIRED, null))));

    assertThatThrownBy(() -> asEditor(() -> service.importContent(request)))
        .isInstanceOfSatisfying(
            ContentImportRejectedException.class,
            e -> {
              assertThat(e.getReport().errors())
                  .singleElement()
                  .satisfies(
                      item -> {
                        assertThat(item.kind()).isEqualTo(ImportReport.Kind.TEMPLATE);
                        assertThat(item.reason()).contains("Unbekannt");
                      });
              assertThat(e.getReport().summary().clauses().errors()).isZero();
            });
    verify(clauseService, never()).createClause(any(), any(), any(), any());
    verify(templateService, never()).createTemplate(any(), any(), any(), any(), any(), any());
  }

  @Test
  void repeatedTitleAndMalformedRuleAreBothReported() {
    var request =
        new ContentImportRequest(
            List.of(
                clauseDef("Honorar", scopedToGermany()),
                clauseDef("Honorar", scopedToGermany()),
                clauseDef("Haftung", rule(RuleType.FORBIDS))),
            List.of());

    assertThatThrownBy(() -> asEditor(() -> service.importContent(request)))
        .isInstanceOfSatisfying(
            ContentImportRejectedException.class,
            e ->
                assertThat(e.getReport().errors())
                    .extracting(ImportReport.Item::title)
                    .containsExactlyInAnyOrder("Honorar", "Haftung"));
    verify(clauseService, never()).createDraft(any(), any(), any());
  }

  private void stubCreation() {
    when(clauseService.createClause(anyString(), anyString(), any(), any()))
        .thenAnswer(
            invocation -> {
              var created = clause(invocation.getArgument(0));
              createdClauses.put(created.getTitle(), created);
              return created;
            });
    when(templateService.createTemplate(anyString(), anyString(), any(), any(), any(), any()))
        .thenAnswer(invocation -> template(invocation.getArgument(0)));
  }

  private static ClauseDefinition clauseDef(String title, RuleDefinition... rules) {
    return new ClauseDefinition(
        title,
        "DE",
        "civil",
        List.of(),
        List.of(new VersionDefinition("Text of " + title, null, List.of(rules), null, null)));
  }

  private static TemplateDefinition templateDef(String title, SlotDefinition... slots) {
    return new TemplateDefinition(
        title,
        null,
        null,
        "DE",
        "civil",
        List.of(),
        List.of(new SectionDefinition("Main", List.of(slots))),
        List.of(new TemplateQuestion("billing", "Billing model", "single_choice", null)));
  }

  private static RuleDefinition rule(RuleType type, String... targetTitles) {
    return new RuleDefinition(type, List.of(targetTitles), null, null, null, null, null, null);
  }

  private static RuleDefinition scopedToGermany() {
    return new RuleDefinition(
        RuleType.SCOPED_TO, null, List.of("DE"), null, null, null, null, null);
  }

  private static <T> T asEditor(Supplier<T> action) {
    return RequestScopes.call(new RequestScopes.Scope(TENANT, EDITOR, "editor"), action);
  }
}
