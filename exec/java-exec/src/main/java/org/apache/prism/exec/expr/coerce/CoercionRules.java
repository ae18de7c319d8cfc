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

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import org.apache.prism.common.expression.ValueExpressions.Literal;
import org.apache.prism.common.types.MajorType;
import org.apache.prism.common.types.MinorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Table of literal coercion strategies keyed by column type.
 */
public class CoercionRules {
  private static final Logger logger = LoggerFactory.getLogger(CoercionRules.class);

  private final Map<MinorType, LiteralCoercer> coercers;

  private CoercionRules(Map<MinorType, LiteralCoercer> coercers) {
    this.coercers = new EnumMap<>(coercers);
  }

  /**
   * Rules for every column type with statistics support.
   */
  public static CoercionRules defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public LiteralCoercer forType(MinorType type) {
    return coercers.get(type);
  }

  /**
   * Coerces the literal into the domain of the column. Arithmetic overflow raised by a
   * coercer is treated as an unknown result.
   */
  public Optional<Object> coerce(Literal literal, MajorType columnType) {
    if (literal.isNull()) {
      return Optional.empty();
    }
    LiteralCoercer coercer = coercers.get(columnType.getMinorType());
    if (coercer == null) {
      return Optional.empty();
    }
    try {
      return coercer.coerce(literal, columnType);
    } catch (ArithmeticException e) {
      logger.debug("Literal {} overflows when converted to {}: {}", literal, columnType.getMinorType(), e.getMessage());
      return Optional.empty();
    }
  }

  public static class Builder {
    private final Map<MinorType, LiteralCoercer> coercers = new EnumMap<>(MinorType.class);

    private Builder() {
      LiteralCoercer integral = LiteralCoercers::toIntegral;
      for (MinorType type : MinorType.values()) {
        if (type.isIntegral()) {
          coercers.put(type, integral);
        }
      }
      coercers.put(MinorType.FLOAT4, LiteralCoercers::toFloatingPoint);
      coercers.put(MinorType.FLOAT8, LiteralCoercers::toFloatingPoint);
      coercers.put(MinorType.VARDECIMAL, LiteralCoercers::toDecimal);
      coercers.put(MinorType.VARCHAR, LiteralCoercers::toVarChar);
      coercers.put(MinorType.VARBINARY, LiteralCoercers::toVarBinary);
      coercers.put(MinorType.BIT, LiteralCoercers::toBoolean);
      coercers.put(MinorType.DATE, LiteralCoercers::toDate);
      coercers.put(MinorType.TIME, LiteralCoercers::toTime);
      coercers.put(MinorType.TIMESTAMP, LiteralCoercers::toTimestamp);
      coercers.put(MinorType.TIMESTAMPTZ, LiteralCoercers::toTimestampTz);
    }

    public Builder put(MinorType type, LiteralCoercer coercer) {
      coercers.put(type, Preconditions.checkNotNull(coercer));
      return this;
    }

    public Builder remove(MinorType type) {
      coercers.remove(type);
      return this;
    }

    public CoercionRules build() {
      return new CoercionRules(coercers);
    }
  }
}
