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

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.function.Function;

import org.apache.prism.common.expression.SchemaPath;
import org.apache.prism.exec.expr.stat.FilterPredicate;
import org.apache.prism.exec.expr.stat.RowsMatch;
import org.apache.prism.exec.expr.stat.StatisticsBatch;

import com.google.common.base.Preconditions;

/**
 * Gives filter predicates access to the statistics of one scan level: all row groups of a
 * file, all pages of a row group, or all files of a table.
 * <p>
 * Column statistics are fetched at most once and results of predicates shared by several
 * parents are remembered, so a provider belongs to a single evaluation and is not thread safe.
 */
public class StatisticsProvider {

  private final Function<SchemaPath, StatisticsBatch> columnStatistics;
  private final long[] rowCounts;
  private final Map<SchemaPath, StatisticsBatch> columns = new HashMap<>();
  private final Map<FilterPredicate, RowsMatch[]> results = new IdentityHashMap<>();

  /**
   * @param columnStatistics returns the statistics of a column over all units,
   *                         or {@code null} when the column has none
   * @param rowCounts row count of every unit, in unit order
   */
  public StatisticsProvider(Function<SchemaPath, StatisticsBatch> columnStatistics, long[] rowCounts) {
    this.columnStatistics = Preconditions.checkNotNull(columnStatistics);
    this.rowCounts = rowCounts.clone();
  }

  /**
   * Provider over already extracted column statistics.
   */
  public static StatisticsProvider of(Map<SchemaPath, StatisticsBatch> statistics, long[] rowCounts) {
    for (Map.Entry<SchemaPath, StatisticsBatch> entry : statistics.entrySet()) {
      Preconditions.checkArgument(entry.getValue().size() == rowCounts.length,
          "Statistics of %s cover %s units instead of %s", entry.getKey(), entry.getValue().size(), rowCounts.length);
    }
    return new StatisticsProvider(statistics::get, rowCounts);
  }

  public int getUnitCount() {
    return rowCounts.length;
  }

  public long getRowCount(int unit) {
    return rowCounts[unit];
  }

  public long[] getRowCounts() {
    return rowCounts.clone();
  }

  public StatisticsBatch getColumnStatistics(SchemaPath path) {
    if (columns.containsKey(path)) {
      return columns.get(path);
    }
    StatisticsBatch statistics = columnStatistics.apply(path);
    Preconditions.checkState(statistics == null || statistics.size() == rowCounts.length,
        "Statistics of %s cover %s units instead of %s", path, statistics == null ? 0 : statistics.size(),
        rowCounts.length);
    columns.put(path, statistics);
    return statistics;
  }

  /**
   * Matches the predicate against all units, reusing the result of an earlier call
   * with the same predicate instance.
   */
  public RowsMatch[] evaluate(FilterPredicate predicate) {
    RowsMatch[] result = results.get(predicate);
    if (result == null) {
      result = predicate.matches(this);
      results.put(predicate, result);
    }
    return result;
  }
}
