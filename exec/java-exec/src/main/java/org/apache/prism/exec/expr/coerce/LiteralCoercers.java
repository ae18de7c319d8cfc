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
package org.apache.prism.exec.expr.coerce;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

import org.apache.prism.common.expression.ValueExpressions.Literal;
import org.apache.prism.common.types.MajorType;
import org.apache.prism.common.types.MinorType;
import org.apache.prism.common.types.TimestampUnit;

/**
 * Default coercion strategies. Normalized domains are: {@code Long} for integral types,
 * dates (epoch days), times (units of the day) and timestamps (units since the epoch),
 * {@code Double} for floating point, {@code BigDecimal} for decimals, {@code byte[]} for
 * strings and binaries and {@code Boolean} for bits.
 */
public final class LiteralCoercers {

  /**
   * Largest magnitude up to which every long converts to a double exactly.
   */
  private static final long MAX_EXACT_DOUBLE = 1L << 53;

  private LiteralCoercers() {
  }

  static Optional<Object> toIntegral(Literal literal, MajorType columnType) {
    MinorType columnMinor = columnType.getMinorType();
    MinorType literalMinor = literal.getMajorType().getMinorType();
    long value;
    if (literalMinor.isIntegral()) {
      value = (Long) literal.getValue();
    } else if (literalMinor == MinorType.VARDECIMAL) {
      BigDecimal decimal = (BigDecimal) literal.getValue();
      if (decimal.signum() != 0 && decimal.stripTrailingZeros().scale() > 0) {
        return Optional.empty();
      }
      value = decimal.longValueExact();
    } else {
      return Optional.empty();
    }
    if (value < columnMinor.minIntegralValue() || value > columnMinor.maxIntegralValue()) {
      return Optional.empty();
    }
    return Optional.of(value);
  }

  static Optional<Object> toFloatingPoint(Literal literal, MajorType columnType) {
    MinorType literalMinor = literal.getMajorType().getMinorType();
    double value;
    if (literalMinor.isFloatingPoint()) {
      value = (Double) literal.getValue();
      if (Double.isNaN(value)) {
        return Optional.empty();
      }
    } else if (literalMinor.isIntegral()) {
      long integral = (Long) literal.getValue();
      if (integral < -MAX_EXACT_DOUBLE || integral > MAX_EXACT_DOUBLE) {
        return Optional.empty();
      }
      value = integral;
    } else if (literalMinor == MinorType.VARDECIMAL) {
      BigDecimal decimal = (BigDecimal) literal.getValue();
      value = decimal.doubleValue();
      if (Double.isInfinite(value) || new BigDecimal(value).compareTo(decimal) != 0) {
        return Optional.empty();
      }
    } else {
      return Optional.empty();
    }
    // FLOAT4 values are compared as doubles, a literal without an exact float is ambiguous
    if (columnType.getMinorType() == MinorType.FLOAT4 && (double) (float) value != value) {
      return Optional.empty();
    }
    // -0.0 and 0.0 are equal in SQL
    return Optional.of(value == 0.0d ? 0.0d : value);
  }


  static Optional<Object> toDecimal(Literal literal, MajorType columnType) {
    MinorType literalMinor = literal.getMajorType().getMinorType();
    if (literalMinor == MinorType.VARDECIMAL) {
      return Optional.of(literal.getValue());
    }
    if (literalMinor.isIntegral()) {
      return Optional.of(BigDecimal.valueOf((Long) literal.getValue()));
    }
    return Optional.empty();
  }

  static Optional<Object> toVarChar(Literal literal, MajorType columnType) {
    if (literal.getMajorType().getMinorType() != MinorType.VARCHAR) {
      return Optional.empty();
    }
    return Optional.of(((String) literal.getValue()).getBytes(StandardCharsets.UTF_8));
  }

  static Optional<Object> toVarBinary(Literal literal, MajorType columnType) {
    if (literal.getMajorType().getMinorType() != MinorType.VARBINARY) {
      return Optional.empty();
    }
    return Optional.of(((byte[]) literal.getValue()).clone());
  }

  static Optional<Object> toBoolean(Literal literal, MajorType columnType) {
    if (literal.getMajorType().getMinorType() != MinorType.BIT) {
      return Optional.empty();
    }
    return Optional.of(literal.getValue());
  }

  static Optional<Object> toDate(Literal literal, MajorType columnType) {
    switch (literal.getMajorType().getMinorType()) {
      case DATE:
        return Optional.of(((LocalDate) literal.getValue()).toEpochDay());
      case TIMESTAMP:
        LocalDateTime timestamp = (LocalDateTime) literal.getValue();
        if (!timestamp.toLocalTime().equals(LocalTime.MIDNIGHT)) {
          return Optional.empty();
        }
        return Optional.of(timestamp.toLocalDate().toEpochDay());
      default:
        return Optional.empty();
    }
  }

  static Optional<Object> toTime(Literal literal, MajorType columnType) {
    if (literal.getMajorType().getMinorType() != MinorType.TIME) {
      return Optional.empty();
    }
    long nanos = ((LocalTime) literal.getValue()).toNanoOfDay();
    long nanosPerUnit = columnType.getUnit().nanosPerUnit();
    if (nanos % nanosPerUnit != 0) {
      return Optional.empty();
    }
    return Optional.of(nanos / nanosPerUnit);
  }

  /**
   * Timestamp column without time zone. Zoned literals denote instants and are not comparable
   * with local date-times.
   */
  static Optional<Object> toTimestamp(Literal literal, MajorType columnType) {
    LocalDateTime timestamp;
    switch (literal.getMajorType().getMinorType()) {
      case TIMESTAMP:
        timestamp = (LocalDateTime) literal.getValue();
        break;
      case DATE:
        timestamp = ((LocalDate) literal.getValue()).atStartOfDay();
        break;
      default:
        return Optional.empty();
    }
    return toEpochUnits(timestamp.toEpochSecond(ZoneOffset.UTC), timestamp.getNano(), columnType.getUnit());
  }

  /**
   * Timestamp column adjusted to UTC. Literals with a region zone and literals with an equal
   * offset denote the same instant.
   */
  static Optional<Object> toTimestampTz(Literal literal, MajorType columnType) {
    if (literal.getMajorType().getMinorType() != MinorType.TIMESTAMPTZ) {
      return Optional.empty();
    }
    Instant instant = ((ZonedDateTime) literal.getValue()).toInstant();
    return toEpochUnits(instant.getEpochSecond(), instant.getNano(), columnType.getUnit());
  }

  /**
   * @throws ArithmeticException when the value does not fit into a long
   */
  static Optional<Object> toEpochUnits(long epochSecond, int nanoOfSecond, TimestampUnit unit) {
    long nanosPerUnit = unit.nanosPerUnit();
    if (nanoOfSecond % nanosPerUnit != 0) {
      return Optional.empty();
    }
    return Optional.of(Math.addExact(Math.multiplyExact(epochSecond, unit.perSecond()), nanoOfSecond / nanosPerUnit));
  }
}
