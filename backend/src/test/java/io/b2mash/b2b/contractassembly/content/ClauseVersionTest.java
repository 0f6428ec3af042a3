package io.b2mash.b2b.contractassembly.content;

import static io.b2mash.b2b.contractassembly.testutil.TestContentFactory.clause;
import static io.b2mash.b2b.contractassembly.testutil.TestContentFactory.clauseVersion;
import static io.b2mash.b2b.contractassembly.testutil.TestContentFactory.published;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.contractassembly.exception.ImmutabilityViolationException;
import io.b2mash.b2b.contractassembly.exception.LifecycleException;
import io.b2mash.b2b.contractassembly.rule.Rule;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ClauseVersionTest {

  private static final UUID AUTHOR = UUID.randomUUID();
  private static final UUID REVIEWER = UUID.randomUUID();

  private final Clause clause = clause("Pauschalhonorar");

  @Test
  void newVersion_startsAsDraft() {
    var version = clauseVersion(clause, 1, AUTHOR);

    assertThat(version.getStatus()).isEqualTo(VersionStatus.DRAFT);
    assertThat(version.getEntityId()).isEqualTo(clause.getId());
    assertThat(version.getTenantId()).isEqualTo(clause.getTenantId());
  }

  @Test
  void submit_rejectsAuthorAsReviewer() {
    var version = clauseVersion(clause, 1, AUTHOR);

    assertThatThrownBy(() -> version.submit(AUTHOR))
        .isInstanceOf(LifecycleException.class)
        .hasMessageContaining("Four-eyes");
    assertThat(version.getStatus()).isEqualTo(VersionStatus.DRAFT);
  }

  @Test
  void fullLifecycle_recordsReviewHistory() {
    var version = clauseVersion(clause, 1, AUTHOR);

    version.submit(REVIEWER);
    version.approve(REVIEWER);
    version.publish();
    version.deprecate(AUTHOR, "superseded");

    assertThat(version.getStatus()).isEqualTo(VersionStatus.DEPRECATED);
    assertThat(version.getPublishedAt()).isNotNull();
    assertThat(version.getDeprecationReason()).isEqualTo("superseded");
    assertThat(version.getReviewHistory())
        .extracting(ReviewHistoryEntry::action)
        .containsExactly("submitted", "approved", "published", "deprecated");
  }

  @Test
  void approve_onlyByAssignedReviewer() {
    var version = clauseVersion(clause, 1, AUTHOR);
    version.submit(REVIEWER);

    assertThatThrownBy(() -> version.approve(UUID.randomUUID()))
        .isInstanceOf(LifecycleException.class);
    assertThat(version.getStatus()).isEqualTo(VersionStatus.REVIEW);
  }

  @Test
  void rejectedVersion_cannotBeApproved() {
    var version = clauseVersion(clause, 1, AUTHOR);
    version.submit(REVIEWER);
    version.reject(REVIEWER, "Wording unclear");

    assertThat(version.isRejected()).isTrue();
    assertThat(version.getStatus()).isEqualTo(VersionStatus.REVIEW);
    assertThatThrownBy(() -> version.approve(REVIEWER)).isInstanceOf(LifecycleException.class);
    assertThatThrownBy(() -> version.reject(REVIEWER, "again"))
        .isInstanceOf(LifecycleException.class);
  }

  @Test
  void publish_requiresApproval() {
    var version = clauseVersion(clause, 1, AUTHOR);

    assertThatThrownBy(version::publish).isInstanceOf(LifecycleException.class);
  }

  @Test
  void updateContent_refusedOutsideDraft() {
    var version = published(clauseVersion(clause, 1, AUTHOR));
    var content = new ClauseContent("changed", Map.of(), List.of(), null, null);

    assertThatThrownBy(() -> version.updateContent(content))
        .isInstanceOf(ImmutabilityViolationException.class);
    assertThat(version.getContent()).isEqualTo("Text of Pauschalhonorar");
  }

  @Test
  void addChangelogEntry_refusedOutsideDraft() {
    var version = published(clauseVersion(clause, 1, AUTHOR));
    var entry =
        new ChangelogEntry(
            ChangeType.EDITORIAL, LegalImpact.NONE, "typo", null, AUTHOR, Instant.now());

    assertThatThrownBy(() -> version.addChangelogEntry(entry))
        .isInstanceOf(ImmutabilityViolationException.class);
  }

  @Test
  void reworkOf_copiesContentAndChangelogIntoNewDraft() {
    var target = UUID.randomUUID();
    var rejected =
        clauseVersion(
            clause, 2, AUTHOR, new Rule.Requires(List.of(target), null, null, null, null));
    rejected.addChangelogEntry(
        new ChangelogEntry(
            ChangeType.LEGAL, LegalImpact.MINOR, "cap raised", null, AUTHOR, Instant.now()));
    rejected.submit(REVIEWER);
    rejected.reject(REVIEWER, "needs citation");

    var rework = ClauseVersion.reworkOf(rejected, 3);

    assertThat(rework.getStatus()).isEqualTo(VersionStatus.DRAFT);
    assertThat(rework.getVersionNumber()).isEqualTo(3);
    assertThat(rework.getAuthorId()).isEqualTo(AUTHOR);
    assertThat(rework.getDerivedFromVersionId()).isEqualTo(rejected.getId());
    assertThat(rework.toContent()).isEqualTo(rejected.toContent());
    assertThat(rework.getChangelog()).hasSize(1);
  }

  @Test
  void toRuleGraphNode_exposesVersionAndEntity() {
    var rule = new Rule.ScopedTo(List.of("DE"), null, null, null, null);
    var version = clauseVersion(clause, 1, AUTHOR, rule);

    var node = version.toRuleGraphNode();

    assertThat(node.versionId()).isEqualTo(version.getId());
    assertThat(node.entityId()).isEqualTo(clause.getId());
    assertThat(node.rules()).containsExactly(rule);
  }
}
