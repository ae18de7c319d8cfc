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
package org.apache.prism.metastore.util;

import java.util.Comparator;

import org.apache.prism.common.types.MinorType;

import com.google.common.primitives.UnsignedBytes;

/**
 * Orderings of normalized statistics values.
 */
public final class ValueComparators {

  /**
   * Orders doubles as {@link Double#compare} does except that -0.0 and 0.0 are equal.
   */
  private static final Comparator<Double> FLOATING_POINT =
      (left, right) -> left.doubleValue() == right.doubleValue() ? 0 : Double.compare(left, right);

  private ValueComparators() {
  }

  /**
   * Returns the comparator for normalized values of the given type. Byte strings are ordered
   * unsigned-lexicographically, which is the order Parquet writers use for min/max of
   * binary columns. Floating point zeros of either sign are equal. Returns {@code null} for types without an ordering.
   */
  @SuppressWarnings("unchecked")
  public static <T> Comparator<T> forType(MinorType type) {
    if (type == null) {
      return null;
    }
    switch (type) {
      case VARCHAR:
      case VARBINARY:
        return (Comparator<T>) UnsignedBytes.lexicographicalComparator();
      case FLOAT4:
      case FLOAT8:
        return (Comparator<T>) FLOATING_POINT;
      case NULL:
      case LATE:
        return null;
      default:
        return (Comparator<T>) Comparator.naturalOrder();
    }
  }
}
