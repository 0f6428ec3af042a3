package io.b2mash.b2b.contractassembly.content;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class VersionStatusTest {

  @Test
  void allowedTransitions_draft() {
    assertThat(VersionStatus.DRAFT.allowedTransitions()).containsExactly(VersionStatus.REVIEW);
  }

  @Test
  void allowedTransitions_review() {
    assertThat(VersionStatus.REVIEW.allowedTransitions()).containsExactly(VersionStatus.APPROVED);
  }

  @Test
  void allowedTransitions_published() {
    assertThat(VersionStatus.PUBLISHED.allowedTransitions())
        .containsExactly(VersionStatus.DEPRECATED);
  }

  @Test
  void deprecated_isTerminal() {
    assertThat(VersionStatus.DEPRECATED.allowedTransitions()).isEmpty();
  }

  @Test
  void review_cannotReturnToDraft() {
    assertThat(VersionStatus.REVIEW.canTransitionTo(VersionStatus.DRAFT)).isFalse();
  }

  @Test
  void onlyDraftIsEditable() {
    for (VersionStatus status : VersionStatus.values()) {
      assertThat(status.isEditable())
          .as("editable %s", status)
          .isEqualTo(status == VersionStatus.DRAFT);
    }
  }
}
