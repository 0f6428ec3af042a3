package io.b2mash.b2b.contractassembly.rule;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Closed interpreter for {@link Condition}. Numbers compare numerically, everything else by string
 * form. A missing answer never satisfies a condition, whatever the operator.
 */
public final class ConditionEvaluator {

  private ConditionEvaluator() {}

  public static boolean isSatisfied(Condition condition, Map<String, Object> answers) {
    Objects.requireNonNull(condition, "condition");
    if (answers == null || condition.questionId() == null || condition.operator() == null) {
      return false;
    }
    Object answer = answers.get(condition.questionId());
    if (answer == null) {
      return false;
    }
    Object expected = condition.value();
    return switch (condition.operator()) {
      case EQUALS -> valuesEqual(answer, expected);
      case NOT_EQUALS -> !valuesEqual(answer, expected);
      case GREATER_THAN -> compare(answer, expected) > 0;
      case LESS_THAN -> {
        int cmp = compare(answer, expected);
        yield cmp != Integer.MIN_VALUE && cmp < 0;
      }
      case CONTAINS -> contains(answer, expected);
      case IN -> expected instanceof Collection<?> options && anyEqual(options, answer);
    };
  }

  private static boolean valuesEqual(Object left, Object right) {
    if (right == null) {
      return false;
    }
    BigDecimal l = toNumber(left);
    BigDecimal r = toNumber(right);
    if (l != null && r != null) {
      return l.compareTo(r) == 0;
    }
    return String.valueOf(left).equals(String.valueOf(right));
  }

  /** Returns {@link Integer#MIN_VALUE} when either side is not numeric. */
  private static int compare(Object left, Object right) {
    BigDecimal l = toNumber(left);
    BigDecimal r = toNumber(right);
    if (l == null || r == null) {
      return Integer.MIN_VALUE;
    }
    return l.compareTo(r);
  }

  private static boolean contains(Object answer, Object expected) {
    if (expected == null) {
      return false;
    }
    if (answer instanceof Collection<?> items) {
      return anyEqual(items, expected);
    }
    return String.valueOf(answer).contains(String.valueOf(expected));
  }

  private static boolean anyEqual(Collection<?> items, Object candidate) {
    for (Object item : items) {
      if (item != null && valuesEqual(item, candidate)) {
        return true;
      }
    }
    return false;
  }

  private static BigDecimal toNumber(Object value) {
    if (value instanceof BigDecimal decimal) {
      return decimal;
    }
    String text;
    if (value instanceof Number number) {
      text = number.toString();
    } else if (value instanceof String string && !string.isBlank()) {
      text = string.trim();
    } else {
      return null;
    }
    try {
      return new BigDecimal(text);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
