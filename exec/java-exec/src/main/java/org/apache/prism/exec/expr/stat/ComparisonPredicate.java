/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.prism.exec.expr.stat;

import java.util.Arrays;

import org.apache.prism.common.expression.ComparisonOperator;
import org.apache.prism.exec.expr.StatisticsProvider;

/**
 * Comparison predicates for statistics-based pruning.
 * <p>
 * Both sides are value ranges. A constant is a range whose min and max coincide, and a
 * column compared with another column of the same type uses the ranges of both. A unit
 * where either side holds only nulls never matches, since a comparison with null is never true.
 */
public class ComparisonPredicate implements FilterPredicate {

  /**
   * Matches one unit given the statistics of both sides. Neither side is all-null.
   */
  @FunctionalInterface
  interface UnitComparison {
    RowsMatch apply(StatisticsBatch left, StatisticsBatch right, int unit);
  }

  private final ComparisonOperator operator;
  private final StatOperand left;
  private final StatOperand right;
  private final UnitComparison predicate;

  private ComparisonPredicate(ComparisonOperator operator, StatOperand left, StatOperand right,
                              UnitComparison predicate) {
    this.operator = operator;
    this.left = left;
    this.right = right;
    this.predicate = predicate;
  }

  public ComparisonOperator getOperator() {
    return operator;
  }

  public StatOperand getLeft() {
    return left;
  }

  public StatOperand getRight() {
    return right;
  }

  @Override
  public RowsMatch[] matches(StatisticsProvider provider) {
    int unitCount = provider.getUnitCount();
    RowsMatch[] result = new RowsMatch[unitCount];
    StatisticsBatch leftStat = left.evaluate(provider);
    StatisticsBatch rightStat = right.evaluate(provider);
    if (leftStat == null || rightStat == null) {
      Arrays.fill(result, RowsMatch.UNKNOWN);
      return result;
    }
    for (int i = 0; i < unitCount; i++) {
      if (leftStat.isAllNulls(i) || rightStat.isAllNulls(i)) {
        result[i] = RowsMatch.NONE;
      } else {
        result[i] = predicate.apply(leftStat, rightStat, i);
      }
    }
    return result;
  }

  /**
   * EQ (=) predicate. Each bound is checked on its own so that a unit with a single known
   * bound can still be pruned.
   */
  private static ComparisonPredicate createEqualPredicate(StatOperand left, StatOperand right) {
    return new ComparisonPredicate(ComparisonOperator.EQUAL, left, right, (leftStat, rightStat, i) -> {
      Object leftMin = leftStat.getMin(i);
      Object leftMax = leftStat.getMax(i);
      Object rightMin = rightStat.getMin(i);
      Object rightMax = rightStat.getMax(i);
      boolean leftMaxKnown = leftMax != null && rightMin != null;
      boolean rightMaxKnown = rightMax != null && leftMin != null;
      if (leftMaxKnown && leftStat.compare(leftMax, rightMin) < 0) {
        return RowsMatch.NONE;
      }
      if (rightMaxKnown && leftStat.compare(rightMax, leftMin) < 0) {
        return RowsMatch.NONE;
      }
      return leftMaxKnown && rightMaxKnown ? RowsMatch.SOME : RowsMatch.UNKNOWN;
    });
  }

  /**
   * GT (>) predicate.
   */
  private static ComparisonPredicate createGTPredicate(StatOperand left, StatOperand right) {
    return new ComparisonPredicate(ComparisonOperator.GREATER_THAN, left, right, (leftStat, rightStat, i) -> {
      Object leftMax = leftStat.getMax(i);
      Object rightMin = rightStat.getMin(i);
      if (leftMax == null || rightMin == null) {
        return RowsMatch.UNKNOWN;
      }
      return leftStat.compare(leftMax, rightMin) <= 0 ? RowsMatch.NONE : RowsMatch.SOME;
    });
  }

  /**
   * GE (>=) predicate.
   */
  private static ComparisonPredicate createGEPredicate(StatOperand left, StatOperand right) {
    return new ComparisonPredicate(ComparisonOperator.GREATER_THAN_OR_EQUAL, left, right, (leftStat, rightStat, i) -> {
      Object leftMax = leftStat.getMax(i);
      Object rightMin = rightStat.getMin(i);
      if (leftMax == null || rightMin == null) {
        return RowsMatch.UNKNOWN;
      }
      return leftStat.compare(leftMax, rightMin) < 0 ? RowsMatch.NONE : RowsMatch.SOME;
    });
  }

  /**
   * LT (<) predicate.
   */
  private static ComparisonPredicate createLTPredicate(StatOperand left, StatOperand right) {
    return new ComparisonPredicate(ComparisonOperator.LESS_THAN, left, right, (leftStat, rightStat, i) -> {
      Object leftMin = leftStat.getMin(i);
      Object rightMax = rightStat.getMax(i);
      if (leftMin == null || rightMax == null) {
        return RowsMatch.UNKNOWN;
      }
      return leftStat.compare(rightMax, leftMin) <= 0 ? RowsMatch.NONE : RowsMatch.SOME;
    });
  }

  /**
   * LE (<=) predicate.
   */
  private static ComparisonPredicate createLEPredicate(StatOperand left, StatOperand right) {
    return new ComparisonPredicate(ComparisonOperator.LESS_THAN_OR_EQUAL, left, right, (leftStat, rightStat, i) -> {
      Object leftMin = leftStat.getMin(i);
      Object rightMax = rightStat.getMax(i);
      if (leftMin == null || rightMax == null) {
        return RowsMatch.UNKNOWN;
      }
      return leftStat.compare(rightMax, leftMin) < 0 ? RowsMatch.NONE : RowsMatch.SOME;
    });
  }

  /**
   * NE (<>) predicate. Prunes only a unit where both sides are the same single value.
   * Floating point columns are never pruned: NaN values are not reflected in the bounds
   * and are not equal to anything.
   */
  private static ComparisonPredicate createNEPredicate(StatOperand left, StatOperand right) {
    boolean floatingPoint = left.getType().getMinorType().isFloatingPoint();
    return new ComparisonPredicate(ComparisonOperator.NOT_EQUAL, left, right, (leftStat, rightStat, i) -> {
      if (floatingPoint) {
        return RowsMatch.UNKNOWN;
      }
      Object leftMin = leftStat.getMin(i);
      Object leftMax = leftStat.getMax(i);
      Object rightMin = rightStat.getMin(i);
      Object rightMax = rightStat.getMax(i);
      if (leftMin == null || leftMax == null || rightMin == null || rightMax == null) {
        return RowsMatch.UNKNOWN;
      }
      boolean singleValue = leftStat.compare(leftMin, leftMax) == 0
          && leftStat.compare(rightMin, rightMax) == 0
          && leftStat.compare(leftMin, rightMin) == 0;
      return singleValue ? RowsMatch.NONE : RowsMatch.SOME;
    });
  }

  /**
   * Creates the comparison predicate for the operator. Both operands must belong to the
   * same value domain.
   */
  public static ComparisonPredicate createComparisonPredicate(ComparisonOperator operator,
                                                              StatOperand left,
                                                              StatOperand right) {
    switch (operator) {
      case EQUAL:
        return createEqualPredicate(left, right);
      case GREATER_THAN:
        return createGTPredicate(left, right);
      case GREATER_THAN_OR_EQUAL:
        return createGEPredicate(left, right);
      case LESS_THAN:
        return createLTPredicate(left, right);
      case LESS_THAN_OR_EQUAL:
        return createLEPredicate(left, right);
      case NOT_EQUAL:
        return createNEPredicate(left, right);
      default:
        throw new IllegalArgumentException("Unknown comparison operator " + operator);
    }
  }

  @Override
  public String toString() {
    return left + " " + operator.getSymbol() + " " + right;
  }
}
