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
import java.util.function.BiFunction;

import org.apache.prism.exec.expr.StatisticsProvider;

/**
 * IS predicates for statistics-based pruning.
 */
public class IsPredicate implements FilterPredicate {

  public enum Kind {
    IS_NULL("IS NULL"),
    IS_NOT_NULL("IS NOT NULL"),
    IS_TRUE("IS TRUE"),
    IS_FALSE("IS FALSE"),
    IS_NOT_TRUE("IS NOT TRUE"),
    IS_NOT_FALSE("IS NOT FALSE");

    private final String sql;

    Kind(String sql) {
      this.sql = sql;
    }
  }

  private final Kind kind;
  private final StatOperand expr;
  private final BiFunction<StatisticsBatch, Integer, RowsMatch> predicate;

  private IsPredicate(Kind kind, StatOperand expr, BiFunction<StatisticsBatch, Integer, RowsMatch> predicate) {
    this.kind = kind;
    this.expr = expr;
    this.predicate = predicate;
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * Apply the filter condition against the statistics of every unit.
   */
  @Override
  public RowsMatch[] matches(StatisticsProvider provider) {
    RowsMatch[] result = new RowsMatch[provider.getUnitCount()];
    StatisticsBatch exprStat = expr.evaluate(provider);
    if (exprStat == null) {
      Arrays.fill(result, RowsMatch.UNKNOWN);
      return result;
    }
    for (int i = 0; i < result.length; i++) {
      result[i] = predicate.apply(exprStat, i);
    }
    return result;
  }

  private static RowsMatch knownNulls(StatisticsBatch exprStat, int i) {
    return exprStat.hasNullCount(i) ? RowsMatch.SOME : RowsMatch.UNKNOWN;
  }

  /**
   * IS NULL predicate.
   */
  private static IsPredicate createIsNullPredicate(StatOperand expr) {
    return new IsPredicate(Kind.IS_NULL, expr,
        (exprStat, i) -> exprStat.hasNoNulls(i) ? RowsMatch.NONE : knownNulls(exprStat, i));
  }

  /**
   * IS NOT NULL predicate.
   */
  private static IsPredicate createIsNotNullPredicate(StatOperand expr) {
    return new IsPredicate(Kind.IS_NOT_NULL, expr,
        (exprStat, i) -> exprStat.isAllNulls(i) ? RowsMatch.NONE : knownNulls(exprStat, i));
  }

  /**
   * IS TRUE predicate.
   */
  private static IsPredicate createIsTruePredicate(StatOperand expr) {
    return new IsPredicate(Kind.IS_TRUE, expr, (exprStat, i) -> {
      if (exprStat.isAllNulls(i)) {
        return RowsMatch.NONE;
      }
      Boolean max = (Boolean) exprStat.getMax(i);
      if (max == null) {
        return RowsMatch.UNKNOWN;
      }
      return max ? RowsMatch.SOME : RowsMatch.NONE;
    });
  }

  /**
   * IS FALSE predicate.
   */
  private static IsPredicate createIsFalsePredicate(StatOperand expr) {
    return new IsPredicate(Kind.IS_FALSE, expr, (exprStat, i) -> {
      if (exprStat.isAllNulls(i)) {
        return RowsMatch.NONE;
      }
      Boolean min = (Boolean) exprStat.getMin(i);
      if (min == null) {
        return RowsMatch.UNKNOWN;
      }
      return min ? RowsMatch.NONE : RowsMatch.SOME;
    });
  }

  /**
   * IS NOT TRUE predicate. Nulls satisfy it.
   */
  private static IsPredicate createIsNotTruePredicate(StatOperand expr) {
    return new IsPredicate(Kind.IS_NOT_TRUE, expr, (exprStat, i) -> {
      Boolean min = (Boolean) exprStat.getMin(i);
      if (min == null || !exprStat.hasNullCount(i)) {
        return exprStat.isAllNulls(i) ? RowsMatch.SOME : RowsMatch.UNKNOWN;
      }
      return min && exprStat.hasNoNulls(i) ? RowsMatch.NONE : RowsMatch.SOME;
    });
  }

  /**
   * IS NOT FALSE predicate. Nulls satisfy it.
   */
  private static IsPredicate createIsNotFalsePredicate(StatOperand expr) {
    return new IsPredicate(Kind.IS_NOT_FALSE, expr, (exprStat, i) -> {
      Boolean max = (Boolean) exprStat.getMax(i);
      if (max == null || !exprStat.hasNullCount(i)) {
        return exprStat.isAllNulls(i) ? RowsMatch.SOME : RowsMatch.UNKNOWN;
      }
      return !max && exprStat.hasNoNulls(i) ? RowsMatch.NONE : RowsMatch.SOME;
    });
  }

  public static IsPredicate createIsPredicate(Kind kind, StatOperand expr) {
    switch (kind) {
      case IS_NULL:
        return createIsNullPredicate(expr);
      case IS_NOT_NULL:
        return createIsNotNullPredicate(expr);
      case IS_TRUE:
        return createIsTruePredicate(expr);
      case IS_FALSE:
        return createIsFalsePredicate(expr);
      case IS_NOT_TRUE:
        return createIsNotTruePredicate(expr);
      case IS_NOT_FALSE:
        return createIsNotFalsePredicate(expr);
      default:
        throw new IllegalArgumentException("Unhandled IS predicate " + kind);
    }
  }

  @Override
  public String toString() {
    return expr + " " + kind.sql;
  }
}
