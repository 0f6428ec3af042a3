package io.b2mash.b2b.contractassembly.content;

import static io.b2mash.b2b.contractassembly.testutil.TestContentFactory.clause;
import static io.b2mash.b2b.contractassembly.testutil.TestContentFactory.clauseVersion;
import static io.b2mash.b2b.contractassembly.testutil.TestContentFactory.published;
import static io.b2mash.b2b.contractassembly.testutil.TestContentFactory.template;
import static io.b2mash.b2b.contractassembly.testutil.TestContentFactory.templateVersion;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.contractassembly.rule.Condition;
import io.b2mash.b2b.contractassembly.rule.Rule;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TemplatePublishingGateTest {

  private static final UUID AUTHOR = UUID.randomUUID();

  @Mock private ClauseRepository clauseRepository;
  @Mock private ClauseVersionRepository clauseVersionRepository;
  @InjectMocks private TemplatePublishingGate gate;

  private final Template template = template("Steuerberatungsvertrag");

  @Test
  void requiredSlotWithPublishedClause_passes() {
    var fee = clause("Pauschalhonorar");
    var feeVersion = published(clauseVersion(fee, 1, AUTHOR));
    fee.promote(feeVersion.getId());
    when(clauseRepository.findAllById(any())).thenReturn(List.of(fee));
    when(clauseVersionRepository.findByIdIn(any())).thenReturn(List.of(feeVersion));
    var version =
        templateVersion(
            template, 1, AUTHOR, new TemplateSlot("fee", fee.getId(), SlotType.REQUIRED, null));

    var report = gate.evaluate(template, version);

    assertThat(report.passed()).isTrue();
    assertThat(report.warnings()).isEmpty();
  }

  @Test
  void requiredSlotWithUnpublishedClause_fails() {
    var fee = clause("Pauschalhonorar");
    when(clauseRepository.findAllById(any())).thenReturn(List.of(fee));
    var version =
        templateVersion(
            template, 1, AUTHOR, new TemplateSlot("fee", fee.getId(), SlotType.REQUIRED, null));

    var report = gate.evaluate(template, version);

    assertThat(report.failures())
        .singleElement()
        .satisfies(
            result -> {
              assertThat(result.gate()).isEqualTo(TemplatePublishingGate.REQUIRED_SLOTS_PUBLISHED);
              assertThat(result.message()).contains("fee");
            });
  }

  @Test
  void unknownClauseAndDuplicateOptionalSlots_reportEveryFailure() {
    var unknown = UUID.randomUUID();
    when(clauseRepository.findAllById(any())).thenReturn(List.of());
    var version =
        templateVersion(
            template,
            1,
            AUTHOR,
            new TemplateSlot("extra", unknown, SlotType.OPTIONAL, null),
            new TemplateSlot("extra", unknown, SlotType.OPTIONAL, null));

    var report = gate.evaluate(template, version);

    assertThat(report.failures())
        .extracting(GateResult::gate)
        .containsExactly(
            TemplatePublishingGate.SLOTS_RESOLVABLE,
            TemplatePublishingGate.NO_DUPLICATE_SLOTS,
            TemplatePublishingGate.HAS_REQUIRED_SLOT);
  }

  @Test
  void clauseRuleAskingUndefinedQuestion_warns() {
    var fee = clause("Pauschalhonorar");
    var onlyForFixed = Condition.equalTo("billing_model", "fixed");
    var feeVersion =
        published(
            clauseVersion(
                fee,
                1,
                AUTHOR,
                new Rule.ScopedTo(List.of("DE"), null, onlyForFixed, null, null)));
    fee.promote(feeVersion.getId());
    when(clauseRepository.findAllById(any())).thenReturn(List.of(fee));
    when(clauseVersionRepository.findByIdIn(any())).thenReturn(List.of(feeVersion));
    var version =
        templateVersion(
            template, 1, AUTHOR, new TemplateSlot("fee", fee.getId(), SlotType.REQUIRED, null));

    var report = gate.evaluate(template, version);

    assertThat(report.passed()).isTrue();
    assertThat(report.warnings())
        .singleElement()
        .satisfies(
            result -> {
              assertThat(result.gate()).isEqualTo(TemplatePublishingGate.QUESTIONS_DEFINED);
              assertThat(result.message()).contains("billing_model");
            });
  }
}
