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
import java.util.BitSet;
import java.util.Comparator;

import org.apache.prism.common.types.MajorType;
import org.apache.prism.metastore.util.ValueComparators;

import com.google.common.base.Preconditions;

/**
 * Statistics of one column over all units of a scan level, stored column-wise.
 * A {@code null} bound or an unset null-count bit means the value is unknown.
 */
public class StatisticsBatch {

  private final MajorType type;
  private final Comparator<Object> comparator;
  private final Object[] minValues;
  private final Object[] maxValues;
  private final long[] nullCounts;
  private final BitSet nullCountKnown;
  private final long[] rowCounts;

  private StatisticsBatch(MajorType type, Object[] minValues, Object[] maxValues,
                          long[] nullCounts, BitSet nullCountKnown, long[] rowCounts) {
    this.type = type;
    this.comparator = ValueComparators.forType(type.getMinorType());
    this.minValues = minValues;
    this.maxValues = maxValues;
    this.nullCounts = nullCounts;
    this.nullCountKnown = nullCountKnown;
    this.rowCounts = rowCounts;
  }

  public static Builder builder(MajorType type, int size) {
    return new Builder(type, size);
  }

  /**
   * Batch describing a non-null constant in every unit.
   */
  public static StatisticsBatch constant(MajorType type, Object value, long[] rowCounts) {
    Preconditions.checkNotNull(value);
    int size = rowCounts.length;
    Object[] values = new Object[size];
    Arrays.fill(values, value);
    BitSet known = new BitSet(size);
    known.set(0, size);
    return new StatisticsBatch(type, values, values, new long[size], known, rowCounts);
  }

  /**
   * Batch with nothing known except row counts.
   */
  public static StatisticsBatch unknown(MajorType type, long[] rowCounts) {
    int size = rowCounts.length;
    return new StatisticsBatch(type, new Object[size], new Object[size], new long[size], new BitSet(size), rowCounts);
  }

  public MajorType getType() {
    return type;
  }

  public int size() {
    return rowCounts.length;
  }

  public Object getMin(int unit) {
    return minValues[unit];
  }

  public Object getMax(int unit) {
    return maxValues[unit];
  }

  public boolean hasNullCount(int unit) {
    return nullCountKnown.get(unit);
  }

  /**
   * @return the null count or {@code null} when unknown
   */
  public Long getNullCount(int unit) {
    return nullCountKnown.get(unit) ? nullCounts[unit] : null;
  }

  public long getRowCount(int unit) {
    return rowCounts[unit];
  }

  /**
   * Checks that the unit is known to hold only nulls in this column.
   */
  public boolean isAllNulls(int unit) {
    return nullCountKnown.get(unit) && nullCounts[unit] == rowCounts[unit];
  }

  /**
   * Checks that the unit is known to hold no nulls in this column.
   */
  public boolean hasNoNulls(int unit) {
    return nullCountKnown.get(unit) && nullCounts[unit] == 0;
  }

  public int compare(Object left, Object right) {
    return comparator.compare(left, right);
  }

  public Comparator<Object> getComparator() {
    return comparator;
  }

  /**
   * Returns a batch of another type with the same null and row counts and the given bounds.
   */
  public StatisticsBatch withBounds(MajorType newType, Object[] newMinValues, Object[] newMaxValues) {
    Preconditions.checkArgument(newMinValues.length == size() && newMaxValues.length == size());
    return new StatisticsBatch(newType, newMinValues, newMaxValues, nullCounts, nullCountKnown, rowCounts);
  }

  /**
   * Folds all units into a single unit covering all of them. A bound is known only when
   * it is known for every unit holding non-null values.
   */
  public StatisticsBatch summarize() {
    long rowCount = 0;
    long nullCount = 0;
    boolean nullCountsKnown = true;
    boolean boundsKnown = true;
    Object min = null;
    Object max = null;
    for (int i = 0; i < size(); i++) {
      rowCount += rowCounts[i];
      if (nullCountKnown.get(i)) {
        nullCount += nullCounts[i];
      } else {
        nullCountsKnown = false;
      }
      if (rowCounts[i] == 0 || isAllNulls(i)) {
        continue;
      }
      if (minValues[i] == null || maxValues[i] == null) {
        boundsKnown = false;
        continue;
      }
      min = min == null || compare(minValues[i], min) < 0 ? minValues[i] : min;
      max = max == null || compare(maxValues[i], max) > 0 ? maxValues[i] : max;
    }
    Builder builder = builder(type, 1);
    builder.set(0, boundsKnown ? min : null, boundsKnown ? max : null,
        nullCountsKnown ? nullCount : null, rowCount);
    return builder.build();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("StatisticsBatch[").append(type.getMinorType());
    for (int i = 0; i < size(); i++) {
      sb.append(", {min=").append(format(minValues[i]))
          .append(", max=").append(format(maxValues[i]))
          .append(", nulls=").append(getNullCount(i))
          .append(", rows=").append(rowCounts[i]).append('}');
    }
    return sb.append(']').toString();
  }

  private static String format(Object value) {
    return value instanceof byte[] ? Arrays.toString((byte[]) value) : String.valueOf(value);
  }

  public static class Builder {
    private final MajorType type;
    private final Object[] minValues;
    private final Object[] maxValues;
    private final long[] nullCounts;
    private final BitSet nullCountKnown;
    private final long[] rowCounts;

    private Builder(MajorType type, int size) {
      this.type = Preconditions.checkNotNull(type);
      this.minValues = new Object[size];
      this.maxValues = new Object[size];
      this.nullCounts = new long[size];
      this.nullCountKnown = new BitSet(size);
      this.rowCounts = new long[size];
    }

    public Builder set(int unit, Object min, Object max, Long nullCount, long rowCount) {
      Preconditions.checkArgument(rowCount >= 0, "negative rowCount %s is not valid", rowCount);
      minValues[unit] = min;
      maxValues[unit] = max;
      rowCounts[unit] = rowCount;
      if (nullCount != null) {
        nullCounts[unit] = nullCount;
        nullCountKnown.set(unit);
      } else {
        nullCountKnown.clear(unit);
      }
      return this;
    }

    public StatisticsBatch build() {
      return new StatisticsBatch(type, minValues, maxValues, nullCounts, nullCountKnown, rowCounts);
    }
  }
}
