package io.b2mash.b2b.contractassembly.rule;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConditionEvaluatorTest {

  @Test
  void equals_matchesStringAnswer() {
    var condition = Condition.equalTo("billing_model", "fixed");

    assertThat(ConditionEvaluator.isSatisfied(condition, Map.of("billing_model", "fixed")))
        .isTrue();
    assertThat(ConditionEvaluator.isSatisfied(condition, Map.of("billing_model", "hourly")))
        .isFalse();
  }

  @Test
  void equals_comparesNumbersNumerically() {
    var condition = Condition.equalTo("fee", 100);

    assertThat(ConditionEvaluator.isSatisfied(condition, Map.of("fee", 100.0))).isTrue();
    assertThat(ConditionEvaluator.isSatisfied(condition, Map.of("fee", "100"))).isTrue();
  }

  @Test
  void missingAnswer_neverSatisfies() {
    for (ConditionOperator operator : ConditionOperator.values()) {
      var condition = new Condition("unanswered", operator, "x");
      assertThat(ConditionEvaluator.isSatisfied(condition, Map.of()))
          .as("operator %s", operator)
          .isFalse();
    }
  }

  @Test
  void notEquals_isFalseForMatchingAnswer() {
    var condition = new Condition("party", ConditionOperator.NOT_EQUALS, "consumer");

    assertThat(ConditionEvaluator.isSatisfied(condition, Map.of("party", "consumer"))).isFalse();
    assertThat(ConditionEvaluator.isSatisfied(condition, Map.of("party", "business"))).isTrue();
  }

  @Test
  void greaterThanAndLessThan_compareNumbers() {
    var greater = new Condition("amount", ConditionOperator.GREATER_THAN, 5000);
    var less = new Condition("amount", ConditionOperator.LESS_THAN, 5000);

    assertThat(ConditionEvaluator.isSatisfied(greater, Map.of("amount", 7500))).isTrue();
    assertThat(ConditionEvaluator.isSatisfied(less, Map.of("amount", 7500))).isFalse();
    assertThat(ConditionEvaluator.isSatisfied(less, Map.of("amount", "1200.50"))).isTrue();
  }

  @Test
  void ordering_isFalseForNonNumericValues() {
    var greater = new Condition("amount", ConditionOperator.GREATER_THAN, 10);
    var less = new Condition("amount", ConditionOperator.LESS_THAN, 10);

    assertThat(ConditionEvaluator.isSatisfied(greater, Map.of("amount", "many"))).isFalse();
    assertThat(ConditionEvaluator.isSatisfied(less, Map.of("amount", "many"))).isFalse();
  }

  @Test
  void contains_checksListMembershipAndSubstring() {
    var condition = new Condition("services", ConditionOperator.CONTAINS, "audit");

    assertThat(
            ConditionEvaluator.isSatisfied(condition, Map.of("services", List.of("tax", "audit"))))
        .isTrue();
    assertThat(ConditionEvaluator.isSatisfied(condition, Map.of("services", "annual audit")))
        .isTrue();
    assertThat(ConditionEvaluator.isSatisfied(condition, Map.of("services", List.of("tax"))))
        .isFalse();
  }

  @Test
  void in_requiresListOperand() {
    var inList = new Condition("state", ConditionOperator.IN, List.of("BY", "BW"));
    var notAList = new Condition("state", ConditionOperator.IN, "BY");

    assertThat(ConditionEvaluator.isSatisfied(inList, Map.of("state", "BY"))).isTrue();
    assertThat(ConditionEvaluator.isSatisfied(inList, Map.of("state", "NW"))).isFalse();
    assertThat(ConditionEvaluator.isSatisfied(notAList, Map.of("state", "BY"))).isFalse();
  }
}
