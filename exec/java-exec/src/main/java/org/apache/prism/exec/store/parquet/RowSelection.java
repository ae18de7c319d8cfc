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
package org.apache.prism.exec.store.parquet;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.apache.prism.exec.expr.Decision;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Rows of a row group to read, as alternating runs of selected and skipped rows.
 * Adjacent runs with the same decision are merged.
 */
public class RowSelection {

  private final List<RowRun> runs;

  @JsonCreator
  public RowSelection(@JsonProperty("runs") List<RowRun> runs) {
    this.runs = ImmutableList.copyOf(runs);
  }

  public static RowSelection all(long rowCount) {
    return of(new Decision[] {Decision.KEEP}, new long[] {rowCount});
  }

  public static RowSelection none(long rowCount) {
    return of(new Decision[] {Decision.SKIP}, new long[] {rowCount});
  }

  /**
   * Selection reading the pages whose decision is {@link Decision#KEEP}.
   */
  public static RowSelection of(Decision[] pages, long[] pageRowCounts) {
    Preconditions.checkArgument(pages.length == pageRowCounts.length,
        "%s page decisions for %s pages", pages.length, pageRowCounts.length);
    List<RowRun> runs = new ArrayList<>();
    for (int i = 0; i < pages.length; i++) {
      if (pageRowCounts[i] == 0) {
        continue;
      }
      boolean select = pages[i].isKeep();
      int last = runs.size() - 1;
      if (last >= 0 && runs.get(last).isSelect() == select) {
        runs.set(last, new RowRun(select, runs.get(last).getRowCount() + pageRowCounts[i]));
      } else {
        runs.add(new RowRun(select, pageRowCounts[i]));
      }
    }
    return new RowSelection(runs);
  }

  @JsonProperty("runs")
  public List<RowRun> getRuns() {
    return runs;
  }

  @JsonIgnore
  public long getSelectedRowCount() {
    return count(true);
  }

  @JsonIgnore
  public long getSkippedRowCount() {
    return count(false);
  }

  @JsonIgnore
  public long getRowCount() {
    return count(true) + count(false);
  }

  @JsonIgnore
  public boolean selectsNothing() {
    return getSelectedRowCount() == 0;
  }

  private long count(boolean select) {
    long count = 0;
    for (RowRun run : runs) {
      if (run.isSelect() == select) {
        count += run.getRowCount();
      }
    }
    return count;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return runs.equals(((RowSelection) o).runs);
  }

  @Override
  public int hashCode() {
    return runs.hashCode();
  }

  @Override
  public String toString() {
    return "RowSelection" + runs;
  }

  /**
   * Consecutive rows that are either all read or all skipped.
   */
  public static class RowRun {
    private final boolean select;
    private final long rowCount;

    @JsonCreator
    public RowRun(@JsonProperty("select") boolean select, @JsonProperty("rowCount") long rowCount) {
      Preconditions.checkArgument(rowCount > 0, "empty run");
      this.select = select;
      this.rowCount = rowCount;
    }

    public static RowRun select(long rowCount) {
      return new RowRun(true, rowCount);
    }

    public static RowRun skip(long rowCount) {
      return new RowRun(false, rowCount);
    }

    @JsonProperty("select")
    public boolean isSelect() {
      return select;
    }

    @JsonProperty("rowCount")
    public long getRowCount() {
      return rowCount;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      RowRun that = (RowRun) o;
      return select == that.select && rowCount == that.rowCount;
    }

    @Override
    public int hashCode() {
      return Objects.hash(select, rowCount);
    }

    @Override
    public String toString() {
      return (select ? "select(" : "skip(") + rowCount + ")";
    }
  }
}
