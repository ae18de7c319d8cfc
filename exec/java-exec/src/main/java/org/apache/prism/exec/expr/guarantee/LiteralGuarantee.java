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
package org.apache.prism.exec.expr.guarantee;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Comparator;
import java.util.NavigableSet;
import java.util.TreeSet;

import org.apache.prism.common.expression.SchemaPath;
import org.apache.prism.common.types.MajorType;
import org.apache.prism.metastore.util.ValueComparators;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;

/**
 * Exact value set that a column is known to take, or to avoid, in every row satisfying a filter.
 * Values are normalized to the domain of the column.
 */
public class LiteralGuarantee {

  public enum Kind {
    /**
     * Every matching row holds one of the values.
     */
    MUST_BE_ONE_OF,

    /**
     * No matching row holds any of the values.
     */
    MUST_NOT_BE_ONE_OF
  }

  private final SchemaPath column;
  private final MajorType columnType;
  private final Kind kind;
  private final ImmutableSortedSet<Object> values;

  LiteralGuarantee(SchemaPath column, MajorType columnType, Kind kind, Collection<Object> values) {
    this.column = Preconditions.checkNotNull(column);
    this.columnType = Preconditions.checkNotNull(columnType);
    this.kind = Preconditions.checkNotNull(kind);
    Comparator<Object> comparator = ValueComparators.forType(columnType.getMinorType());
    Preconditions.checkArgument(comparator != null, "Column %s of type %s has no value order", column, columnType);
    ImmutableSortedSet.Builder<Object> builder = ImmutableSortedSet.orderedBy(comparator);
    for (Object value : values) {
      builder.add(value);
    }
    this.values = builder.build();
  }

  public SchemaPath getColumn() {
    return column;
  }

  public MajorType getColumnType() {
    return columnType;
  }

  public Kind getKind() {
    return kind;
  }

  public NavigableSet<Object> getValues() {
    return values;
  }

  /**
   * Checks whether a unit whose complete set of non-null values in the column is
   * {@code unitValues} contains no row satisfying the filter. Null rows never satisfy an
   * equality or membership test, so a unit without non-null values is always excluded.
   *
   * @param unitValues all distinct non-null values of the column in the unit, normalized
   *                   to the domain of the column
   */
  public boolean excludes(Collection<Object> unitValues) {
    for (Object value : unitValues) {
      boolean member = values.contains(value);
      if (member == (kind == Kind.MUST_BE_ONE_OF)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Intersects or unions the value sets of two guarantees of the same column and kind.
   */
  LiteralGuarantee merge(LiteralGuarantee other, boolean intersect) {
    Preconditions.checkArgument(column.equals(other.column) && kind == other.kind);
    NavigableSet<Object> merged = new TreeSet<>(values.comparator());
    merged.addAll(values);
    if (intersect) {
      merged.retainAll(other.values);
    } else {
      merged.addAll(other.values);
    }
    return new LiteralGuarantee(column, columnType, kind, merged);
  }

  /**
   * Removes the values of a must-not guarantee from this must-be guarantee.
   */
  LiteralGuarantee exclude(LiteralGuarantee mustNot) {
    Preconditions.checkArgument(kind == Kind.MUST_BE_ONE_OF && mustNot.kind == Kind.MUST_NOT_BE_ONE_OF);
    NavigableSet<Object> remaining = new TreeSet<>(values.comparator());
    remaining.addAll(values);
    remaining.removeAll(mustNot.values);
    return new LiteralGuarantee(column, columnType, kind, remaining);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(column.getPath()).append(' ').append(kind).append(" [");
    boolean first = true;
    for (Object value : values) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(value instanceof byte[] ? new String((byte[]) value, StandardCharsets.UTF_8) : value);
    }
    return sb.append(']').toString();
  }
}
