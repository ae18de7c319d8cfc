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
package org.apache.prism.exec.expr;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.apache.prism.categories.PlannerTest;
import org.apache.prism.common.expression.BooleanOperator;
import org.apache.prism.common.expression.ComparisonExpression;
import org.apache.prism.common.expression.ComparisonOperator;
import org.apache.prism.common.expression.InListExpression;
import org.apache.prism.common.expression.IsNullExpression;
import org.apache.prism.common.expression.LogicalExpression;
import org.apache.prism.common.expression.NotExpression;
import org.apache.prism.common.expression.SchemaPath;
import org.apache.prism.common.expression.ValueExpressions;
import org.apache.prism.common.expression.ValueExpressions.Literal;
import org.apache.prism.common.types.MajorType;
import org.apache.prism.common.types.MinorType;
import org.apache.prism.common.types.Types;
import org.apache.prism.exec.expr.guarantee.LiteralGuarantee;
import org.apache.prism.exec.expr.guarantee.LiteralGuaranteeAnalyzer;
import org.apache.prism.exec.expr.stat.RowsMatch;
import org.apache.prism.exec.expr.stat.StatisticsBatch;
import org.apache.prism.exec.record.metadata.TupleSchema;
import org.apache.prism.test.PrismTest;
import org.junit.Test;
import org.junit.experimental.categories.Category;

/**
 * Checks pruning decisions for random filters against the rows the statistics were computed
 * from: a unit holding a row that satisfies the filter is never skipped.
 */
@Category(PlannerTest.class)
public class TestPruningSoundness extends PrismTest {

  private static final SchemaPath A = SchemaPath.getSimplePath("a");
  private static final SchemaPath B = SchemaPath.getSimplePath("b");
  private static final MajorType A_TYPE = Types.optional(MinorType.INT);
  private static final MajorType B_TYPE = Types.optional(MinorType.BIGINT);
  private static final int UNITS = 8;
  private static final int ITERATIONS = 500;

  private final TupleSchema schema = new TupleSchema().add(A, A_TYPE).add(B, B_TYPE);
  private final PruningPredicateCompiler compiler = new PruningPredicateCompiler();
  private final LiteralGuaranteeAnalyzer analyzer = new LiteralGuaranteeAnalyzer();

  @Test
  public void testSkippedUnitsHoldNoMatchingRow() {
    Random random = new Random(20240611L);
    for (int iteration = 0; iteration < ITERATIONS; iteration++) {
      List<List<Long[]>> units = randomUnits(random);
      LogicalExpression filter = randomFilter(random, 3);
      Decision[] decisions = PruningEvaluator.decide(compiler.compile(filter, schema), provider(units, random, false));
      for (int unit = 0; unit < units.size(); unit++) {
        if (!decisions[unit].isKeep()) {
          assertFalse(String.format("Unit %d skipped for %s although a row matches: %s", unit, filter, describe(units.get(unit))),
              anyRowMatches(filter, units.get(unit)));
        }
      }
    }
  }

  @Test
  public void testGuaranteesNeverExcludeMatchingUnits() {
    Random random = new Random(7L);
    for (int iteration = 0; iteration < ITERATIONS; iteration++) {
      List<List<Long[]>> units = randomUnits(random);
      LogicalExpression filter = randomFilter(random, 3);
      for (LiteralGuarantee guarantee : analyzer.analyze(filter, schema)) {
        int column = guarantee.getColumn().equals(A) ? 0 : 1;
        for (List<Long[]> rows : units) {
          if (anyRowMatches(filter, rows)) {
            assertFalse(String.format("%s of %s excludes %s", guarantee, filter, describe(rows)),
                guarantee.excludes(distinctValues(rows, column)));
          }
        }
      }
    }
  }

  @Test
  public void testLessStatisticsNeverSkipMore() {
    Random random = new Random(42L);
    for (int iteration = 0; iteration < ITERATIONS; iteration++) {
      List<List<Long[]>> units = randomUnits(random);
      LogicalExpression filter = randomFilter(random, 3);
      PruningPredicate predicate = compiler.compile(filter, schema);
      long seed = random.nextLong();
      Decision[] exact = PruningEvaluator.decide(predicate, provider(units, new Random(seed), false));
      Decision[] erased = PruningEvaluator.decide(predicate, provider(units, new Random(seed), true));
      for (int unit = 0; unit < units.size(); unit++) {
        if (!erased[unit].isKeep()) {
          assertFalse("Erasing statistics skipped unit " + unit + " for " + filter, exact[unit].isKeep());
        }
      }
    }
  }

  @Test
  public void testEvaluationIsIdempotent() {
    Random random = new Random(99L);
    for (int iteration = 0; iteration < 100; iteration++) {
      List<List<Long[]>> units = randomUnits(random);
      LogicalExpression filter = randomFilter(random, 4);
      PruningPredicate predicate = compiler.compile(filter, schema);
      StatisticsProvider provider = provider(units, random, false);
      RowsMatch[] first = PruningEvaluator.evaluate(predicate, provider);
      RowsMatch[] second = PruningEvaluator.evaluate(predicate, provider);
      RowsMatch[] recompiled = PruningEvaluator.evaluate(compiler.compile(filter, schema), provider(units, new Random(0), false));
      assertArrayEquals(first, second);
      assertArrayEquals(first, recompiled);
    }
  }

  @Test
  public void testEmptyUnitsAreSkipped() {
    List<List<Long[]>> units = new ArrayList<>();
    units.add(new ArrayList<>());
    LogicalExpression filter = IsNullExpression.isNull(A);
    Decision[] decisions = PruningEvaluator.decide(compiler.compile(filter, schema), provider(units, new Random(0), false));
    assertFalse(decisions[0].isKeep());
  }

  // rows hold {a, b}, either may be null
  private static List<List<Long[]>> randomUnits(Random random) {
    List<List<Long[]>> units = new ArrayList<>();
    for (int unit = 0; unit < UNITS; unit++) {
      List<Long[]> rows = new ArrayList<>();
      int rowCount = random.nextInt(7);
      for (int row = 0; row < rowCount; row++) {
        rows.add(new Long[] {randomValue(random), randomValue(random)});
      }
      units.add(rows);
    }
    return units;
  }

  private static Long randomValue(Random random) {
    return random.nextInt(5) == 0 ? null : (long) (random.nextInt(7) - 3);
  }

  /**
   * Exact statistics of the units. With {@code erase} set, each bound and null count is
   * dropped with some probability.
   */
  private static StatisticsProvider provider(List<List<Long[]>> units, Random random, boolean erase) {
    long[] rowCounts = new long[units.size()];
    StatisticsBatch.Builder a = StatisticsBatch.builder(A_TYPE, units.size());
    StatisticsBatch.Builder b = StatisticsBatch.builder(B_TYPE, units.size());
    for (int unit = 0; unit < units.size(); unit++) {
      List<Long[]> rows = units.get(unit);
      rowCounts[unit] = rows.size();
      setColumn(a, unit, rows, 0, random, erase);
      setColumn(b, unit, rows, 1, random, erase);
    }
    Map<SchemaPath, StatisticsBatch> statistics = new HashMap<>();
    statistics.put(A, a.build());
    statistics.put(B, b.build());
    return StatisticsProvider.of(statistics, rowCounts);
  }

  private static void setColumn(StatisticsBatch.Builder builder, int unit, List<Long[]> rows, int column,
                                Random random, boolean erase) {
    Long min = null;
    Long max = null;
    long nullCount = 0;
    for (Long[] row : rows) {
      Long value = row[column];
      if (value == null) {
        nullCount++;
      } else {
        min = min == null ? value : Math.min(min, value);
        max = max == null ? value : Math.max(max, value);
      }
    }
    boolean eraseMin = random.nextInt(3) == 0;
    boolean eraseMax = random.nextInt(3) == 0;
    boolean eraseNulls = random.nextInt(3) == 0;
    builder.set(unit,
        erase && eraseMin ? null : min,
        erase && eraseMax ? null : max,
        erase && eraseNulls ? null : nullCount,
        rows.size());
  }

  private static LogicalExpression randomFilter(Random random, int depth) {
    int choice = random.nextInt(depth > 0 ? 9 : 5);
    switch (choice) {
      case 0:
      case 1:
        return new ComparisonExpression(randomOperator(random), randomColumn(random), randomLiteral(random));
      case 2:
        return random.nextBoolean()
            ? new ComparisonExpression(randomOperator(random), randomLiteral(random), randomColumn(random))
            : new ComparisonExpression(randomOperator(random), A, B);
      case 3:
        return random.nextBoolean() ? IsNullExpression.isNull(randomColumn(random)) : IsNullExpression.isNotNull(randomColumn(random));
      case 4:
        List<LogicalExpression> values = new ArrayList<>();
        int count = 1 + random.nextInt(3);
        for (int i = 0; i < count; i++) {
          values.add(random.nextInt(6) == 0 ? ValueExpressions.getNull() : randomLiteral(random));
        }
        return new InListExpression(randomColumn(random), values, random.nextBoolean());
      case 5:
        return new NotExpression(randomFilter(random, depth - 1));
      case 6:
      case 7:
        return BooleanOperator.and(randomFilter(random, depth - 1), randomFilter(random, depth - 1));
      default:
        return BooleanOperator.or(randomFilter(random, depth - 1), randomFilter(random, depth - 1));
    }
  }

  private static ComparisonOperator randomOperator(Random random) {
    ComparisonOperator[] operators = ComparisonOperator.values();
    return operators[random.nextInt(operators.length)];
  }

  private static SchemaPath randomColumn(Random random) {
    return random.nextBoolean() ? A : B;
  }

  private static Literal randomLiteral(Random random) {
    int value = random.nextInt(9) - 4;
    return random.nextBoolean() ? ValueExpressions.getInt(value) : ValueExpressions.getBigInt(value);
  }

  private static boolean anyRowMatches(LogicalExpression filter, List<Long[]> rows) {
    for (Long[] row : rows) {
      if (Boolean.TRUE.equals(evaluate(filter, row))) {
        return true;
      }
    }
    return false;
  }

  /**
   * SQL evaluation of the filter for one row, {@code null} standing for UNKNOWN.
   */
  private static Boolean evaluate(LogicalExpression expr, Long[] row) {
    if (expr instanceof ComparisonExpression) {
      ComparisonExpression comparison = (ComparisonExpression) expr;
      Long left = value(comparison.getLeft(), row);
      Long right = value(comparison.getRight(), row);
      if (left == null || right == null) {
        return null;
      }
      int result = Long.compare(left, right);
      switch (comparison.getOperator()) {
        case EQUAL:
          return result == 0;
        case NOT_EQUAL:
          return result != 0;
        case LESS_THAN:
          return result < 0;
        case LESS_THAN_OR_EQUAL:
          return result <= 0;
        case GREATER_THAN:
          return result > 0;
        default:
          return result >= 0;
      }
    }
    if (expr instanceof IsNullExpression) {
      IsNullExpression isNull = (IsNullExpression) expr;
      return (value(isNull.getInput(), row) == null) != isNull.isNegated();
    }
    if (expr instanceof InListExpression) {
      InListExpression in = (InListExpression) expr;
      Long input = value(in.getInput(), row);
      Boolean member = Boolean.FALSE;
      if (input == null) {
        member = null;
      } else {
        for (LogicalExpression candidate : in.getValues()) {
          Long value = value(candidate, row);
          if (value == null) {
            member = null;
          } else if (value.equals(input)) {
            member = Boolean.TRUE;
            break;
          }
        }
      }
      return in.isNegated() ? not(member) : member;
    }
    if (expr instanceof NotExpression) {
      return not(evaluate(((NotExpression) expr).getInput(), row));
    }
    BooleanOperator op = (BooleanOperator) expr;
    Boolean result = op.isAnd();
    for (LogicalExpression arg : op.getArgs()) {
      Boolean value = evaluate(arg, row);
      if (op.isAnd()) {
        if (Boolean.FALSE.equals(value)) {
          return false;
        }
        result = value == null ? null : result;
      } else {
        if (Boolean.TRUE.equals(value)) {
          return true;
        }
        result = value == null ? null : result;
      }
    }
    return result;
  }

  private static Boolean not(Boolean value) {
    return value == null ? null : !value;
  }

  private static Long value(LogicalExpression expr, Long[] row) {
    if (expr.equals(A)) {
      return row[0];
    }
    if (expr.equals(B)) {
      return row[1];
    }
    return (Long) ((Literal) expr).getValue();
  }

  private static List<Object> distinctValues(List<Long[]> rows, int column) {
    Set<Object> values = new LinkedHashSet<>();
    for (Long[] row : rows) {
      if (row[column] != null) {
        values.add(row[column]);
      }
    }
    return new ArrayList<>(values);
  }

  private static String describe(List<Long[]> rows) {
    StringBuilder sb = new StringBuilder("[");
    for (Long[] row : rows) {
      sb.append('(').append(row[0]).append(", ").append(row[1]).append(')');
    }
    return sb.append(']').toString();
  }

  @Test
  public void testRowEvaluatorFollowsSqlNulls() {
    Long[] row = {null, 1L};
    assertTrue(evaluate(new InListExpression(B, Arrays.asList(ValueExpressions.getInt(1), ValueExpressions.getNull()), false), row));
    assertFalse(Boolean.TRUE.equals(evaluate(new InListExpression(B, Arrays.asList(ValueExpressions.getInt(2), ValueExpressions.getNull()), true), row)));
    assertFalse(Boolean.TRUE.equals(evaluate(BooleanOperator.or(IsNullExpression.isNotNull(A), new ComparisonExpression(ComparisonOperator.EQUAL, A, B)), row)));
  }
}
