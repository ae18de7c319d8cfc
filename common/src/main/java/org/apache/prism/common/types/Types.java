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

import com.google.common.base.Preconditions;

/**
 * Factory methods for {@link MajorType}.
 */
public final class Types {

  public static final MajorType NULL = optional(MinorType.NULL);
  public static final MajorType LATE_BIND_TYPE = optional(MinorType.LATE);

  private Types() {
  }

  public static MajorType required(MinorType type) {
    return withMode(type, DataMode.REQUIRED);
  }

  public static MajorType optional(MinorType type) {
    return withMode(type, DataMode.OPTIONAL);
  }

  public static MajorType repeated(MinorType type) {
    return withMode(type, DataMode.REPEATED);
  }

  public static MajorType withMode(MinorType type, DataMode mode) {
    Preconditions.checkArgument(type != MinorType.VARDECIMAL, "Decimal types require precision and scale");
    TimestampUnit unit = null;
    if (type == MinorType.TIMESTAMP || type == MinorType.TIMESTAMPTZ) {
      unit = TimestampUnit.MICROS;
    } else if (type == MinorType.TIME) {
      unit = TimestampUnit.NANOS;
    }
    return new MajorType(type, mode, 0, 0, unit);
  }

  public static MajorType withPrecisionAndScale(MinorType type, DataMode mode, int precision, int scale) {
    Preconditions.checkArgument(scale >= 0 && scale <= precision,
        "Invalid scale %s for precision %s", scale, precision);
    return new MajorType(type, mode, precision, scale, null);
  }

  public static MajorType decimal(DataMode mode, int precision, int scale) {
    return withPrecisionAndScale(MinorType.VARDECIMAL, mode, precision, scale);
  }

  /**
   * Timestamp, time or zoned timestamp type stored with the given resolution.
   */
  public static MajorType withUnit(MinorType type, DataMode mode, TimestampUnit unit) {
    Preconditions.checkArgument(type == MinorType.TIME || type == MinorType.TIMESTAMP || type == MinorType.TIMESTAMPTZ,
        "Type %s does not carry a time unit", type);
    return new MajorType(type, mode, 0, 0, Preconditions.checkNotNull(unit));
  }

  public static boolean isNumericType(MajorType type) {
    return type.getMinorType().isNumeric();
  }

  /**
   * Returns true when values of both types can be compared through the same
   * normalized domain without coercion. Decimals compare by value whatever their scale.
   */
  public static boolean isSameComparisonDomain(MajorType left, MajorType right) {
    MinorType l = left.getMinorType();
    MinorType r = right.getMinorType();
    if (l.isIntegral() && r.isIntegral()) {
      return true;
    }
    if (l.isFloatingPoint() && r.isFloatingPoint()) {
      return true;
    }
    if (l == MinorType.VARDECIMAL && r == MinorType.VARDECIMAL) {
      return true;
    }
    if (l.isBytes() && r.isBytes()) {
      return l == r;
    }
    if (l == r && left.getUnit() == right.getUnit()) {
      return true;
    }
    return false;
  }
}
