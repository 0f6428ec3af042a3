package io.b2mash.b2b.contractassembly.content;

import static io.b2mash.b2b.contractassembly.testutil.TestContentFactory.TENANT;
import static io.b2mash.b2b.contractassembly.testutil.TestContentFactory.clause;
import static io.b2mash.b2b.contractassembly.testutil.TestContentFactory.clauseVersion;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.contractassembly.audit.AuditService;
import io.b2mash.b2b.contractassembly.config.ContractAssemblyProperties;
import io.b2mash.b2b.contractassembly.exception.GateViolationException;
import io.b2mash.b2b.contractassembly.rule.Rule;
import io.b2mash.b2b.contractassembly.rule.RuleGraphLoader;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Two clauses whose drafts require each other both pass review while neither is published. The
 * second approval has to notice the loop the first one left half-closed.
 */
@ExtendWith(MockitoExtension.class)
class ClauseApprovalCycleTest {

  private static final UUID AUTHOR = UUID.randomUUID();
  private static final UUID REVIEWER = UUID.randomUUID();

  @Mock private ClauseRepository clauseRepository;
  @Mock private ClauseVersionRepository clauseVersionRepository;
  @Mock private AuditService auditService;
  @Mock private ApplicationEventPublisher eventPublisher;

  private ClausePublishingGate gate;
  private ClauseLifecycleService service;

  private final Clause payment = clause("Zahlungsbedingungen");
  private final Clause interest = clause("Verzugszinsen");
  private ClauseVersion paymentDraft;
  private ClauseVersion interestDraft;

  @BeforeEach
  void setUp() {
    gate =
        new ClausePublishingGate(
            clauseRepository,
            new RuleGraphLoader(clauseVersionRepository),
            ContractAssemblyProperties.defaults());
    service =
        new ClauseLifecycleService(
            clauseRepository, clauseVersionRepository, gate, auditService, eventPublisher);

    paymentDraft = clauseVersion(payment, 1, AUTHOR, requires(interest.getId()));
    interestDraft = clauseVersion(interest, 1, AUTHOR, requires(payment.getId()));
    var stored = List.of(paymentDraft, interestDraft);

    when(clauseVersionRepository.findByTenantIdAndStatus(TENANT, VersionStatus.PUBLISHED))
        .thenAnswer(
            invocation ->
                stored.stream().filter(v -> v.getStatus() == VersionStatus.PUBLISHED).toList());
  }

  @Test
  void bothDraftsPassReviewWhileNothingIsPublished() {
    when(clauseRepository.findAllById(anyIterable())).thenReturn(List.of(payment, interest));

    assertThat(gate.evaluate(payment, paymentDraft).passed()).isTrue();
    assertThat(gate.evaluate(interest, interestDraft).passed()).isTrue();
  }

  @Test
  void secondApprovalClosingTheLoopIsRejected() {
    paymentDraft.submit(REVIEWER);
    interestDraft.submit(REVIEWER);
    stubApproval(payment, paymentDraft);
    stubApproval(interest, interestDraft);
    when(clauseVersionRepository.saveAndFlush(any(ClauseVersion.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));
    when(clauseRepository.saveAndFlush(payment)).thenReturn(payment);

    service.approve(paymentDraft.getId(), REVIEWER);

    assertThatThrownBy(() -> service.approve(interestDraft.getId(), REVIEWER))
        .isInstanceOfSatisfying(
            GateViolationException.class,
            e ->
                assertThat(e.getFailedGates())
                    .singleElement()
                    .satisfies(
                        failure -> {
                          assertThat(failure.gate())
                              .isEqualTo(ClausePublishingGate.REQUIRES_ACYCLIC);
                          assertThat(failure.message())
                              .contains(payment.getId().toString(), interest.getId().toString());
                        }));
    assertThat(paymentDraft.getStatus()).isEqualTo(VersionStatus.PUBLISHED);
    assertThat(interestDraft.getStatus()).isNotEqualTo(VersionStatus.PUBLISHED);
    assertThat(interest.hasPublishedVersion()).isFalse();
    verify(clauseVersionRepository, never()).saveAndFlush(interestDraft);
  }

  private void stubApproval(Clause clause, ClauseVersion version) {
    when(clauseVersionRepository.findById(version.getId())).thenReturn(Optional.of(version));
    when(clauseRepository.findById(clause.getId())).thenReturn(Optional.of(clause));
  }

  private static Rule requires(UUID target) {
    return new Rule.Requires(List.of(target), null, null, null, null);
  }
}
