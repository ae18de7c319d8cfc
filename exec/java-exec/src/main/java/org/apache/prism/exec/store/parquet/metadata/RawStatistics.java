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

import java.util.Objects;

import org.apache.parquet.column.Dictionary;
import org.apache.parquet.schema.PrimitiveType;

/**
 * Statistics of one column in one storage unit as found in the file footer or column index.
 * Bounds are plain encoded (little-endian for numeric types), or dictionary ids when
 * {@link #isDictionaryBounds()} is set. Any part may be missing.
 */
public class RawStatistics {

  private final PrimitiveType primitiveType;
  private final byte[] min;
  private final byte[] max;
  private final Long nullCount;
  private final Dictionary dictionary;
  private final boolean dictionaryBounds;
  private final boolean sortedDictionary;

  private RawStatistics(RawStatisticsBuilder builder) {
    this.primitiveType = builder.primitiveType;
    this.min = builder.min;
    this.max = builder.max;
    this.nullCount = builder.nullCount;
    this.dictionary = builder.dictionary;
    this.dictionaryBounds = builder.dictionaryBounds;
    this.sortedDictionary = builder.sortedDictionary;
  }

  /**
   * Statistics of a column that is present in the unit but has nothing recorded.
   */
  public static RawStatistics empty(PrimitiveType primitiveType) {
    return builder().primitiveType(primitiveType).build();
  }

  public PrimitiveType getPrimitiveType() {
    return primitiveType;
  }

  public byte[] getMin() {
    return min;
  }

  public byte[] getMax() {
    return max;
  }

  public Long getNullCount() {
    return nullCount;
  }

  public Dictionary getDictionary() {
    return dictionary;
  }

  public boolean isDictionaryBounds() {
    return dictionaryBounds;
  }

  /**
   * Whether dictionary ids follow the order of the values they stand for.
   */
  public boolean isSortedDictionary() {
    return sortedDictionary;
  }

  public static RawStatisticsBuilder builder() {
    return new RawStatisticsBuilder();
  }

  public static class RawStatisticsBuilder {
    private PrimitiveType primitiveType;
    private byte[] min;
    private byte[] max;
    private Long nullCount;
    private Dictionary dictionary;
    private boolean dictionaryBounds;
    private boolean sortedDictionary;

    public RawStatisticsBuilder primitiveType(PrimitiveType primitiveType) {
      this.primitiveType = primitiveType;
      return this;
    }

    public RawStatisticsBuilder min(byte[] min) {
      this.min = min;
      return this;
    }

    public RawStatisticsBuilder max(byte[] max) {
      this.max = max;
      return this;
    }

    public RawStatisticsBuilder nullCount(Long nullCount) {
      this.nullCount = nullCount;
      return this;
    }

    /**
     * Bounds are ids into {@code dictionary}.
     */
    public RawStatisticsBuilder dictionaryBounds(Dictionary dictionary, boolean sorted) {
      this.dictionary = dictionary;
      this.dictionaryBounds = true;
      this.sortedDictionary = sorted;
      return this;
    }

    public RawStatistics build() {
      Objects.requireNonNull(primitiveType, "primitiveType was not set");
      if (dictionaryBounds) {
        Objects.requireNonNull(dictionary, "dictionary was not set");
      }
      return new RawStatistics(this);
    }
  }
}
