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
package org.apache.prism.exec.store.parquet.metadata;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;

import org.apache.parquet.internal.column.columnindex.ColumnIndex;
import org.apache.parquet.internal.column.columnindex.OffsetIndex;
import org.apache.prism.common.expression.SchemaPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Longs;

/**
 * Page level statistics of a row group.
 * <p>
 * Every column chunk is split into pages at its own row boundaries, given by its offset
 * index. The row group is divided into row ranges at the first row of every page of every
 * indexed column, so each range lies within exactly one page of each column. These ranges
 * are the units page pruning decides on; when all columns share their page boundaries the
 * ranges are the pages.
 */
public class PageIndex {
  private static final Logger logger = LoggerFactory.getLogger(PageIndex.class);

  private final long[] rangeRowCounts;
  private final Map<SchemaPath, ColumnIndex> columnIndexes;
  private final Map<SchemaPath, ColumnPages> columnPages;

  /**
   * Index of a row group whose columns are all split into pages at the same rows.
   *
   * @param pageRowCounts row count of every page, shared by all columns
   */
  public PageIndex(long[] pageRowCounts, Map<SchemaPath, ColumnIndex> columnIndexes) {
    for (long rowCount : pageRowCounts) {
      Preconditions.checkArgument(rowCount >= 0, "negative page row count %s", rowCount);
    }
    this.rangeRowCounts = pageRowCounts.clone();
    ImmutableMap.Builder<SchemaPath, ColumnIndex> indexes = ImmutableMap.builder();
    Map<SchemaPath, ColumnPages> pages = new HashMap<>();
    int[] identity = new int[pageRowCounts.length];
    for (int i = 0; i < identity.length; i++) {
      identity[i] = i;
    }
    for (Map.Entry<SchemaPath, ColumnIndex> entry : columnIndexes.entrySet()) {
      int pageCount = entry.getValue().getNullPages().size();
      if (pageCount != pageRowCounts.length) {
        logger.debug("Column index of {} describes {} pages instead of {}", entry.getKey(), pageCount, pageRowCounts.length);
        continue;
      }
      indexes.put(entry.getKey(), entry.getValue());
      pages.put(entry.getKey(), new ColumnPages(rangeRowCounts, identity));
    }
    this.columnIndexes = indexes.build();
    this.columnPages = ImmutableMap.copyOf(pages);
  }

  /**
   * Index of a row group whose columns may be split into pages at different rows. Columns
   * whose offset index is missing, inconsistent with the row count or with their column
   * index have no page statistics.
   *
   * @param rowCount row count of the row group
   */
  public PageIndex(long rowCount, Map<SchemaPath, ColumnIndex> columnIndexes,
                   Map<SchemaPath, OffsetIndex> offsetIndexes) {
    Preconditions.checkArgument(rowCount >= 0, "negative row count %s", rowCount);
    Map<SchemaPath, long[]> firstRows = new HashMap<>();
    TreeSet<Long> rangeStarts = new TreeSet<>();
    if (rowCount > 0) {
      rangeStarts.add(0L);
    }
    for (Map.Entry<SchemaPath, ColumnIndex> entry : columnIndexes.entrySet()) {
      long[] starts = firstRows(entry.getKey(), entry.getValue(), offsetIndexes.get(entry.getKey()), rowCount);
      if (starts != null) {
        firstRows.put(entry.getKey(), starts);
        rangeStarts.addAll(Longs.asList(starts));
      }
    }
    long[] starts = Longs.toArray(rangeStarts);
    this.rangeRowCounts = rowCounts(starts, rowCount);

    ImmutableMap.Builder<SchemaPath, ColumnIndex> indexes = ImmutableMap.builder();
    Map<SchemaPath, ColumnPages> pages = new HashMap<>();
    for (Map.Entry<SchemaPath, long[]> entry : firstRows.entrySet()) {
      long[] pageStarts = entry.getValue();
      int[] pageOfRange = new int[starts.length];
      for (int range = 0; range < starts.length; range++) {
        pageOfRange[range] = lastPageStartingAtOrBefore(pageStarts, starts[range]);
      }
      indexes.put(entry.getKey(), columnIndexes.get(entry.getKey()));
      pages.put(entry.getKey(), new ColumnPages(rowCounts(pageStarts, rowCount), pageOfRange));
    }
    this.columnIndexes = indexes.build();
    this.columnPages = ImmutableMap.copyOf(pages);
  }

  private static long[] firstRows(SchemaPath column, ColumnIndex columnIndex, OffsetIndex offsetIndex, long rowCount) {
    if (offsetIndex == null) {
      logger.debug("Column {} has no offset index", column);
      return null;
    }
    int pageCount = offsetIndex.getPageCount();
    if (pageCount == 0 || pageCount != columnIndex.getNullPages().size()) {
      logger.debug("Offset index of {} describes {} pages, its column index {}",
          column, pageCount, columnIndex.getNullPages().size());
      return null;
    }
    long[] starts = new long[pageCount];
    for (int page = 0; page < pageCount; page++) {
      starts[page] = offsetIndex.getFirstRowIndex(page);
      boolean ordered = page == 0 ? starts[page] == 0 : starts[page] >= starts[page - 1];
      if (!ordered || starts[page] >= Math.max(rowCount, 1)) {
        logger.debug("Offset index of {} has page {} starting at row {} of {}", column, page, starts[page], rowCount);
        return null;
      }
    }
    return starts;
  }

  private static long[] rowCounts(long[] starts, long rowCount) {
    long[] rowCounts = new long[starts.length];
    for (int i = 0; i < starts.length; i++) {
      long end = i + 1 < starts.length ? starts[i + 1] : rowCount;
      rowCounts[i] = end - starts[i];
    }
    return rowCounts;
  }

  // pages without rows share their first row with the next page
  private static int lastPageStartingAtOrBefore(long[] pageStarts, long row) {
    int low = 0;
    int high = pageStarts.length - 1;
    while (low < high) {
      int middle = (low + high + 1) >>> 1;
      if (pageStarts[middle] <= row) {
        low = middle;
      } else {
        high = middle - 1;
      }
    }
    return low;
  }

  /**
   * Number of row ranges the row group is divided into.
   */
  public int getPageCount() {
    return rangeRowCounts.length;
  }

  /**
   * Row counts of the row ranges, in row order.
   */
  public long[] getPageRowCounts() {
    return rangeRowCounts.clone();
  }

  public long getRowCount() {
    return Arrays.stream(rangeRowCounts).sum();
  }

  /**
   * @return column index of the column, or {@code null} when it was not written or its
   *         pages are unknown
   */
  public ColumnIndex getColumnIndex(SchemaPath path) {
    return columnIndexes.get(path);
  }

  /**
   * Page of the column holding the rows of a range.
   *
   * @return page index within the column index, or {@code -1} for a column without page statistics
   */
  public int getColumnPage(SchemaPath path, int range) {
    ColumnPages pages = columnPages.get(path);
    return pages == null ? -1 : pages.pageOfRange[range];
  }

  /**
   * Whether the range holds all rows of its page of the column.
   */
  public boolean coversColumnPage(SchemaPath path, int range) {
    ColumnPages pages = columnPages.get(path);
    return pages != null && pages.rowCounts[pages.pageOfRange[range]] == rangeRowCounts[range];
  }

  /**
   * Row count of a page of the column.
   */
  public long getColumnPageRowCount(SchemaPath path, int page) {
    return columnPages.get(path).rowCounts[page];
  }

  private static class ColumnPages {
    private final long[] rowCounts;
    private final int[] pageOfRange;

    ColumnPages(long[] rowCounts, int[] pageOfRange) {
      this.rowCounts = rowCounts;
      this.pageOfRange = pageOfRange;
    }
  }
}
