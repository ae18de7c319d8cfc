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
package org.apache.prism.exec.store.parquet.stat;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.Map;

import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.DateLogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.DecimalLogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.IntLogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.TimeLogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.TimestampLogicalTypeAnnotation;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.prism.common.types.MajorType;
import org.apache.prism.common.types.MinorType;
import org.apache.prism.common.types.TimestampUnit;
import org.apache.prism.exec.store.parquet.ParquetTypeHelper;

import com.google.common.base.Preconditions;

/**
 * Table of statistics decoders keyed by the type of the column the filter refers to.
 */
public class StatisticsDecoders {

  private final Map<MinorType, StatisticsDecoder> decoders;

  private StatisticsDecoders(Map<MinorType, StatisticsDecoder> decoders) {
    this.decoders = new EnumMap<>(decoders);
  }

  public static StatisticsDecoders defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return decoder for the column type, or {@code null} when statistics of such columns
   *         are not used
   */
  public StatisticsDecoder forType(MinorType type) {
    return decoders.get(type);
  }

  static Object decodeIntegral(Object physical, PrimitiveType fileType, MajorType columnType, Bound bound) {
    LogicalTypeAnnotation annotation = fileType.getLogicalTypeAnnotation();
    if (annotation != null && !(annotation instanceof IntLogicalTypeAnnotation)
        && !(annotation instanceof DecimalLogicalTypeAnnotation && ((DecimalLogicalTypeAnnotation) annotation).getScale() == 0)) {
      return null;
    }
    boolean unsigned = annotation instanceof IntLogicalTypeAnnotation && !((IntLogicalTypeAnnotation) annotation).isSigned();
    long value;
    if (physical instanceof Integer) {
      value = unsigned ? Integer.toUnsignedLong((Integer) physical) : (Integer) physical;
    } else if (physical instanceof Long) {
      value = (Long) physical;
      if (unsigned && value < 0) {
        // above Long.MAX_VALUE
        return null;
      }
    } else {
      return null;
    }
    MinorType minorType = columnType.getMinorType();
    if (value < minorType.minIntegralValue() || value > minorType.maxIntegralValue()) {
      return null;
    }
    return value;
  }

  static Object decodeFloatingPoint(Object physical, PrimitiveType fileType, MajorType columnType, Bound bound) {
    double value;
    if (physical instanceof Float) {
      value = (Float) physical;
    } else if (physical instanceof Double && columnType.getMinorType() == MinorType.FLOAT8) {
      value = (Double) physical;
    } else {
      return null;
    }
    if (Double.isNaN(value)) {
      return bound == Bound.EXACT ? value : null;
    }
    // a zero bound may have been written for either signed zero
    if (value == 0.0d) {
      if (bound == Bound.MIN) {
        return -0.0d;
      } else if (bound == Bound.MAX) {
        return 0.0d;
      }
    }
    return value;
  }

  static Object decodeDecimal(Object physical, PrimitiveType fileType, MajorType columnType, Bound bound)
      throws CorruptStatisticsException {
    LogicalTypeAnnotation annotation = fileType.getLogicalTypeAnnotation();
    int fileScale;
    if (annotation instanceof DecimalLogicalTypeAnnotation) {
      fileScale = ((DecimalLogicalTypeAnnotation) annotation).getScale();
    } else if (annotation == null || annotation instanceof IntLogicalTypeAnnotation) {
      fileScale = 0;
    } else {
      return null;
    }
    BigInteger unscaled;
    if (physical instanceof Integer) {
      if (annotation instanceof IntLogicalTypeAnnotation && !((IntLogicalTypeAnnotation) annotation).isSigned()) {
        unscaled = BigInteger.valueOf(Integer.toUnsignedLong((Integer) physical));
      } else {
        unscaled = BigInteger.valueOf((Integer) physical);
      }
    } else if (physical instanceof Long) {
      unscaled = BigInteger.valueOf((Long) physical);
      if (annotation instanceof IntLogicalTypeAnnotation && !((IntLogicalTypeAnnotation) annotation).isSigned()
          && unscaled.signum() < 0) {
        unscaled = unscaled.add(BigInteger.ONE.shiftLeft(Long.SIZE));
      }
    } else if (physical instanceof byte[] && fileType.getPrimitiveTypeName() != PrimitiveTypeName.INT96) {
      byte[] bytes = (byte[]) physical;
      if (bytes.length == 0) {
        throw new CorruptStatisticsException("Empty decimal value of " + fileType.getName());
      }
      unscaled = new BigInteger(bytes);
    } else {
      return null;
    }
    BigDecimal value = new BigDecimal(unscaled, fileScale);
    switch (bound) {
      case MIN:
        return value.setScale(columnType.getScale(), RoundingMode.FLOOR);
      case MAX:
        return value.setScale(columnType.getScale(), RoundingMode.CEILING);
      default:
        return value;
    }
  }

  static Object decodeBytes(Object physical, PrimitiveType fileType, MajorType columnType, Bound bound) {
    PrimitiveTypeName typeName = fileType.getPrimitiveTypeName();
    if (!(physical instanceof byte[])
        || (typeName != PrimitiveTypeName.BINARY && typeName != PrimitiveTypeName.FIXED_LEN_BYTE_ARRAY)
        || fileType.getLogicalTypeAnnotation() instanceof DecimalLogicalTypeAnnotation) {
      return null;
    }
    return physical;
  }

  static Object decodeBoolean(Object physical, PrimitiveType fileType, MajorType columnType, Bound bound) {
    return physical instanceof Boolean ? physical : null;
  }

  static Object decodeDate(Object physical, PrimitiveType fileType, MajorType columnType, Bound bound) {
    if (!(physical instanceof Integer) || !(fileType.getLogicalTypeAnnotation() instanceof DateLogicalTypeAnnotation)) {
      return null;
    }
    return (long) (Integer) physical;
  }

  static Object decodeTime(Object physical, PrimitiveType fileType, MajorType columnType, Bound bound) {
    LogicalTypeAnnotation annotation = fileType.getLogicalTypeAnnotation();
    if (!(annotation instanceof TimeLogicalTypeAnnotation)) {
      return null;
    }
    long value;
    if (physical instanceof Integer) {
      value = (Integer) physical;
    } else if (physical instanceof Long) {
      value = (Long) physical;
    } else {
      return null;
    }
    return convertUnits(value, ParquetTypeHelper.getTimestampUnit(((TimeLogicalTypeAnnotation) annotation).getUnit()),
        columnType.getUnit(), bound);
  }

  /**
   * Local timestamps are only comparable with local timestamps and instants with instants.
   */
  static Object decodeTimestamp(Object physical, PrimitiveType fileType, MajorType columnType, Bound bound) {
    LogicalTypeAnnotation annotation = fileType.getLogicalTypeAnnotation();
    if (!(physical instanceof Long) || !(annotation instanceof TimestampLogicalTypeAnnotation)) {
      return null;
    }
    TimestampLogicalTypeAnnotation timestamp = (TimestampLogicalTypeAnnotation) annotation;
    if (timestamp.isAdjustedToUTC() != (columnType.getMinorType() == MinorType.TIMESTAMPTZ)) {
      return null;
    }
    return convertUnits((Long) physical, ParquetTypeHelper.getTimestampUnit(timestamp.getUnit()), columnType.getUnit(), bound);
  }

  /**
   * Converts a value between resolutions. Conversion into a coarser unit rounds the value
   * according to its bound, and fails for an exact value that is not a whole number of
   * target units.
   *
   * @return converted value, or {@code null} when it does not fit into a long
   */
  static Long convertUnits(long value, TimestampUnit from, TimestampUnit to, Bound bound) {
    if (from == to) {
      return value;
    }
    long factor = to.factorFrom(from);
    if (factor != 0) {
      try {
        return Math.multiplyExact(value, factor);
      } catch (ArithmeticException e) {
        return null;
      }
    }
    long divisor = from.factorFrom(to);
    long quotient = Math.floorDiv(value, divisor);
    boolean exact = Math.floorMod(value, divisor) == 0;
    switch (bound) {
      case MIN:
        return quotient;
      case MAX:
        return exact ? quotient : quotient + 1;
      default:
        return exact ? quotient : null;
    }
  }

  public static class Builder {
    private final Map<MinorType, StatisticsDecoder> decoders = new EnumMap<>(MinorType.class);

    private Builder() {
      for (MinorType type : MinorType.values()) {
        if (type.isIntegral()) {
          decoders.put(type, StatisticsDecoders::decodeIntegral);
        }
      }
      decoders.put(MinorType.FLOAT4, StatisticsDecoders::decodeFloatingPoint);
      decoders.put(MinorType.FLOAT8, StatisticsDecoders::decodeFloatingPoint);
      decoders.put(MinorType.VARDECIMAL, StatisticsDecoders::decodeDecimal);
      decoders.put(MinorType.VARCHAR, StatisticsDecoders::decodeBytes);
      decoders.put(MinorType.VARBINARY, StatisticsDecoders::decodeBytes);
      decoders.put(MinorType.BIT, StatisticsDecoders::decodeBoolean);
      decoders.put(MinorType.DATE, StatisticsDecoders::decodeDate);
      decoders.put(MinorType.TIME, StatisticsDecoders::decodeTime);
      decoders.put(MinorType.TIMESTAMP, StatisticsDecoders::decodeTimestamp);
      decoders.put(MinorType.TIMESTAMPTZ, StatisticsDecoders::decodeTimestamp);
    }

    public Builder put(MinorType type, StatisticsDecoder decoder) {
      decoders.put(type, Preconditions.checkNotNull(decoder));
      return this;
    }

    public Builder remove(MinorType type) {
      decoders.remove(type);
      return this;
    }

    public StatisticsDecoders build() {
      return new StatisticsDecoders(decoders);
    }
  }
}
