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
package org.apache.prism.common.types;

import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Full type of a column or literal: minor type, cardinality mode and the
 * type parameters relevant to statistics comparison.
 */
public final class MajorType {

  private final MinorType minorType;
  private final DataMode mode;
  private final int precision;
  private final int scale;
  private final TimestampUnit unit;

  MajorType(MinorType minorType, DataMode mode, int precision, int scale, TimestampUnit unit) {
    this.minorType = Preconditions.checkNotNull(minorType);
    this.mode = Preconditions.checkNotNull(mode);
    this.precision = precision;
    this.scale = scale;
    this.unit = unit;
  }

  public MinorType getMinorType() {
    return minorType;
  }

  public DataMode getMode() {
    return mode;
  }

  public int getPrecision() {
    return precision;
  }

  public int getScale() {
    return scale;
  }

  /**
   * Storage resolution of {@code TIME}, {@code TIMESTAMP} and {@code TIMESTAMPTZ} values,
   * {@code null} for other types.
   */
  public TimestampUnit getUnit() {
    return unit;
  }

  public boolean isRepeated() {
    return mode == DataMode.REPEATED;
  }

  public MajorType withMode(DataMode newMode) {
    return new MajorType(minorType, newMode, precision, scale, unit);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    MajorType that = (MajorType) o;
    return precision == that.precision
        && scale == that.scale
        && minorType == that.minorType
        && mode == that.mode
        && unit == that.unit;
  }

  @Override
  public int hashCode() {
    return Objects.hash(minorType, mode, precision, scale, unit);
  }

  @Override
  public String toString() {
    MoreObjects.ToStringHelper helper = MoreObjects.toStringHelper(this)
        .add("minorType", minorType)
        .add("mode", mode);
    if (minorType == MinorType.VARDECIMAL) {
      helper.add("precision", precision).add("scale", scale);
    }
    if (unit != null) {
      helper.add("unit", unit);
    }
    return helper.toString();
  }
}
