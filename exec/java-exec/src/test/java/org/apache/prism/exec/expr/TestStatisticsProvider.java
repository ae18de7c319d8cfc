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
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Collections;
import java.util.function.Function;

import org.apache.prism.categories.PlannerTest;
import org.apache.prism.common.expression.SchemaPath;
import org.apache.prism.common.types.MajorType;
import org.apache.prism.common.types.MinorType;
import org.apache.prism.common.types.Types;
import org.apache.prism.exec.expr.stat.FilterPredicate;
import org.apache.prism.exec.expr.stat.RowsMatch;
import org.apache.prism.exec.expr.stat.StatisticsBatch;
import org.apache.prism.test.PrismTest;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(PlannerTest.class)
public class TestStatisticsProvider extends PrismTest {

  private static final SchemaPath A = SchemaPath.getSimplePath("a");
  private static final MajorType INT = Types.optional(MinorType.INT);

  @Test
  public void testRowCountsCannotBeChanged() {
    long[] rowCounts = {3, 0};
    StatisticsProvider provider = StatisticsProvider.of(Collections.emptyMap(), rowCounts);
    rowCounts[0] = 7;
    provider.getRowCounts()[1] = 9;

    assertEquals(2, provider.getUnitCount());
    assertEquals(3, provider.getRowCount(0));
    assertEquals(0, provider.getRowCount(1));
    assertArrayEquals(new long[] {3, 0}, provider.getRowCounts());
  }

  @Test
  @SuppressWarnings("unchecked")
  public void testColumnFetchedOnce() {
    Function<SchemaPath, StatisticsBatch> columns = mock(Function.class);
    StatisticsBatch batch = StatisticsBatch.unknown(INT, new long[] {3, 4});
    when(columns.apply(A)).thenReturn(batch);
    StatisticsProvider provider = new StatisticsProvider(columns, new long[] {3, 4});

    assertSame(batch, provider.getColumnStatistics(A));
    assertSame(batch, provider.getColumnStatistics(A));
    assertNull(provider.getColumnStatistics(SchemaPath.getSimplePath("b")));
    verify(columns, times(1)).apply(A);
  }

  @Test(expected = IllegalStateException.class)
  public void testColumnWithOtherUnitCount() {
    StatisticsProvider provider = new StatisticsProvider(path -> StatisticsBatch.unknown(INT, new long[] {3}), new long[] {3, 4});
    provider.getColumnStatistics(A);
  }

  @Test
  public void testPredicateEvaluatedOnce() {
    FilterPredicate predicate = mock(FilterPredicate.class);
    when(predicate.matches(any())).thenReturn(new RowsMatch[] {RowsMatch.NONE, RowsMatch.SOME});
    StatisticsProvider provider = StatisticsProvider.of(Collections.emptyMap(), new long[] {3, 4});

    RowsMatch[] first = provider.evaluate(predicate);
    assertSame(first, provider.evaluate(predicate));
    verify(predicate, times(1)).matches(provider);
  }
}
