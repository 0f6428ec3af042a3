package io.b2mash.b2b.contractassembly.rule;

/**
 * A test of one interview answer, kept as data so rules stay serializable. Evaluated by {@link
 * ConditionEvaluator}.
 *
 * @param questionId the interview question whose answer is tested
 * @param operator comparison to apply
 * @param value operand; a list for {@link ConditionOperator#IN}
 */
public record Condition(String questionId, ConditionOperator operator, Object value) {

  public static Condition equalTo(String questionId, Object value) {
    return new Condition(questionId, ConditionOperator.EQUALS, value);
  }
}
