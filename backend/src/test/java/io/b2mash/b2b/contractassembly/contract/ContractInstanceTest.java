package io.b2mash.b2b.contractassembly.contract;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.contractassembly.exception.ImmutabilityViolationException;
import io.b2mash.b2b.contractassembly.exception.LifecycleException;
import io.b2mash.b2b.contractassembly.validation.ValidationResult;
import io.b2mash.b2b.contractassembly.validation.ValidationState;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ContractInstanceTest {

  private final UUID pinnedVersion = UUID.randomUUID();
  private final UUID otherPinnedVersion = UUID.randomUUID();

  @Test
  void newContract_isValidDraft() {
    var contract = contract();

    assertThat(contract.getStatus()).isEqualTo(ContractStatus.DRAFT);
    assertThat(contract.getValidationState()).isEqualTo(ValidationState.VALID);
    assertThat(contract.selectedClauseVersionIds()).containsExactly(pinnedVersion);
  }

  @Test
  void mergeAnswers_nullValueRemovesAnswer() {
    var contract = contract();
    contract.mergeAnswers(Map.of("fee_amount", 1000, "billing_model", "fixed"));

    var changes = new HashMap<String, Object>();
    changes.put("fee_amount", null);
    changes.put("billing_model", "hourly");
    contract.mergeAnswers(changes);

    assertThat(contract.getAnswers()).containsExactly(Map.entry("billing_model", "hourly"));
  }

  @Test
  void selectSlot_rejectsUnpinnedVersion() {
    var contract = contract();

    assertThatThrownBy(() -> contract.selectSlot("fee", UUID.randomUUID()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void selectSlot_nullClearsSlot() {
    var contract = contract();
    contract.selectSlot("extra", otherPinnedVersion);
    contract.selectSlot("fee", null);

    assertThat(contract.getSelectedSlots()).containsOnlyKeys("extra");
    assertThat(contract.selectedClauseVersionIds()).containsExactly(otherPinnedVersion);
  }

  @Test
  void complete_freezesPinsAndAnswers() {
    var contract = contract();
    contract.complete();

    assertThat(contract.getStatus()).isEqualTo(ContractStatus.COMPLETED);
    assertThat(contract.getCompletedAt()).isNotNull();
    assertThatThrownBy(() -> contract.mergeAnswers(Map.of("x", 1)))
        .isInstanceOf(ImmutabilityViolationException.class);
    assertThatThrownBy(() -> contract.selectSlot("fee", otherPinnedVersion))
        .isInstanceOf(ImmutabilityViolationException.class);
    assertThatThrownBy(() -> contract.repin(UUID.randomUUID(), List.of(), Map.of()))
        .isInstanceOf(ImmutabilityViolationException.class);
    assertThat(contract.getClauseVersionIds()).containsExactly(pinnedVersion, otherPinnedVersion);
  }

  @Test
  void complete_twiceIsLifecycleError() {
    var contract = contract();
    contract.complete();

    assertThatThrownBy(contract::complete).isInstanceOf(LifecycleException.class);
  }

  @Test
  void archive_onlyFromCompleted() {
    var contract = contract();

    assertThatThrownBy(contract::archive).isInstanceOf(LifecycleException.class);

    contract.complete();
    contract.archive();
    assertThat(contract.getStatus()).isEqualTo(ContractStatus.ARCHIVED);
    assertThat(contract.getStatus().isFrozen()).isTrue();
  }

  @Test
  void recordValidation_storesStateAndMessages() {
    var contract = contract();

    contract.recordValidation(ValidationResult.of(List.of()));

    assertThat(contract.getValidationState()).isEqualTo(ValidationState.VALID);
    assertThat(contract.getValidationMessages()).isEmpty();
  }

  private ContractInstance contract() {
    return new ContractInstance(
        "tenant_unit",
        UUID.randomUUID(),
        "Retainer ACME",
        "ACME-42",
        List.of(),
        UUID.randomUUID(),
        UUID.randomUUID(),
        List.of(pinnedVersion, otherPinnedVersion),
        "DE",
        Map.of("fee", pinnedVersion));
  }
}
