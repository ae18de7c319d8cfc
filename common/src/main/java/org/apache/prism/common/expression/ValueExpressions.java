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
package org.apache.prism.common.expression;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Objects;

import org.apache.prism.common.expression.visitors.ExprVisitor;
import org.apache.prism.common.types.DataMode;
import org.apache.prism.common.types.MajorType;
import org.apache.prism.common.types.MinorType;
import org.apache.prism.common.types.Types;

import com.google.common.base.Preconditions;

/**
 * Factories for constant expressions.
 * <p>
 * The Java representation of a literal value depends on its minor type:
 * <ul>
 *   <li>{@code BIT} - {@link Boolean}</li>
 *   <li>integral types - {@link Long}</li>
 *   <li>{@code FLOAT4}, {@code FLOAT8} - {@link Double}</li>
 *   <li>{@code VARDECIMAL} - {@link BigDecimal}</li>
 *   <li>{@code VARCHAR} - {@link String}</li>
 *   <li>{@code VARBINARY} - {@code byte[]}</li>
 *   <li>{@code DATE} - {@link LocalDate}</li>
 *   <li>{@code TIME} - {@link LocalTime}</li>
 *   <li>{@code TIMESTAMP} - {@link LocalDateTime}, no zone</li>
 *   <li>{@code TIMESTAMPTZ} - {@link ZonedDateTime}, either a region zone or a fixed offset</li>
 * </ul>
 * A {@code null} value denotes SQL {@code NULL} of the given type.
 */
public class ValueExpressions {

  public static Literal getBit(boolean b) {
    return new Literal(Types.required(MinorType.BIT), b);
  }

  public static Literal getInt(int i) {
    return new Literal(Types.required(MinorType.INT), (long) i);
  }

  public static Literal getBigInt(long l) {
    return new Literal(Types.required(MinorType.BIGINT), l);
  }

  public static Literal getFloat4(float f) {
    return new Literal(Types.required(MinorType.FLOAT4), (double) f);
  }

  public static Literal getFloat8(double d) {
    return new Literal(Types.required(MinorType.FLOAT8), d);
  }

  public static Literal getVarDecimal(BigDecimal value, int precision, int scale) {
    return new Literal(Types.decimal(DataMode.REQUIRED, precision, scale), value);
  }

  /**
   * Decimal literal typed by its own precision and scale.
   */
  public static Literal getVarDecimal(BigDecimal value) {
    int scale = Math.max(value.scale(), 0);
    int precision = Math.max(value.precision(), scale);
    return getVarDecimal(value, precision, scale);
  }

  public static Literal getChar(String s) {
    return new Literal(Types.required(MinorType.VARCHAR), s);
  }

  public static Literal getBinary(byte[] bytes) {
    return new Literal(Types.required(MinorType.VARBINARY), bytes.clone());
  }

  public static Literal getDate(LocalDate date) {
    return new Literal(Types.required(MinorType.DATE), date);
  }

  public static Literal getTime(LocalTime time) {
    return new Literal(Types.required(MinorType.TIME), time);
  }

  public static Literal getTimeStamp(LocalDateTime timestamp) {
    return new Literal(Types.required(MinorType.TIMESTAMP), timestamp);
  }

  public static Literal getTimeStampTz(ZonedDateTime timestamp) {
    return new Literal(Types.required(MinorType.TIMESTAMPTZ), timestamp);
  }

  public static Literal getTimeStampTz(OffsetDateTime timestamp) {
    return getTimeStampTz(timestamp.toZonedDateTime());
  }

  public static Literal getNull() {
    return new Literal(Types.NULL, null);
  }

  public static Literal getTypedNull(MinorType type) {
    return new Literal(Types.optional(type), null);
  }

  /**
   * Literal of an explicit type. The value must use the Java representation listed above.
   */
  public static Literal getLiteral(MajorType type, Object value) {
    return new Literal(type, value);
  }

  public static class Literal extends LogicalExpressionBase {

    private final MajorType type;
    private final Object value;

    private Literal(MajorType type, Object value) {
      this.type = Preconditions.checkNotNull(type);
      this.value = value;
      if (value != null) {
        checkRepresentation(type.getMinorType(), value);
      }
    }

    private static void checkRepresentation(MinorType type, Object value) {
      Class<?> expected;
      switch (type) {
        case BIT:
          expected = Boolean.class;
          break;
        case FLOAT4:
        case FLOAT8:
          expected = Double.class;
          break;
        case VARDECIMAL:
          expected = BigDecimal.class;
          break;
        case VARCHAR:
          expected = String.class;
          break;
        case VARBINARY:
          expected = byte[].class;
          break;
        case DATE:
          expected = LocalDate.class;
          break;
        case TIME:
          expected = LocalTime.class;
          break;
        case TIMESTAMP:
          expected = LocalDateTime.class;
          break;
        case TIMESTAMPTZ:
          expected = ZonedDateTime.class;
          break;
        default:
          expected = type.isIntegral() ? Long.class : Object.class;
      }
      Preconditions.checkArgument(expected.isInstance(value),
          "Literal of type %s must be a %s but was %s", type, expected.getSimpleName(), value.getClass().getSimpleName());
    }

    public Object getValue() {
      return value;
    }

    public boolean isNull() {
      return value == null;
    }

    @Override
    public MajorType getMajorType() {
      return type;
    }

    @Override
    public <T, V, E extends Exception> T accept(ExprVisitor<T, V, E> visitor, V value) throws E {
      return visitor.visitLiteral(this, value);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Literal)) {
        return false;
      }
      Literal that = (Literal) o;
      return type.equals(that.type) && Objects.deepEquals(value, that.value);
    }

    @Override
    public int hashCode() {
      return 31 * type.hashCode() + (value instanceof byte[] ? Arrays.hashCode((byte[]) value) : Objects.hashCode(value));
    }
  }
}
