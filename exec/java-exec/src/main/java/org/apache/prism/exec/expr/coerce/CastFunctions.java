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
import java.util.Optional;
import java.util.function.UnaryOperator;

import org.apache.prism.common.types.MajorType;
import org.apache.prism.common.types.MinorType;

/**
 * Casts whose functions preserve order, so statistics bounds of the input are bounds of the
 * result. The functions throw {@link ArithmeticException} for values they cannot convert.
 */
public final class CastFunctions {

  private static final long SECONDS_PER_DAY = 86_400L;

  private CastFunctions() {
  }

  /**
   * Returns the function mapping normalized values of {@code from} to normalized values of
   * {@code to}, or empty when the cast is not order preserving or not supported.
   */
  public static Optional<UnaryOperator<Object>> boundsFunction(MajorType from, MajorType to) {
    MinorType source = from.getMinorType();
    MinorType target = to.getMinorType();
    if (source.isIntegral()) {
      if (target.isIntegral()) {
        return Optional.of(value -> checkRange((Long) value, target));
      }
      if (target == MinorType.FLOAT4) {
        return Optional.of(value -> (double) (float) (long) (Long) value);
      }
      if (target == MinorType.FLOAT8) {
        return Optional.of(value -> (double) (Long) value);
      }
      if (target == MinorType.VARDECIMAL) {
        return Optional.of(value -> toDecimal((Long) value, to));
      }
      return Optional.empty();
    }
    if (source == MinorType.FLOAT4 && target == MinorType.FLOAT8) {
      return Optional.of(UnaryOperator.identity());
    }
    if (source == MinorType.DATE && target == MinorType.TIMESTAMP) {
      long unitsPerDay = SECONDS_PER_DAY * to.getUnit().perSecond();
      return Optional.of(value -> Math.multiplyExact((Long) value, unitsPerDay));
    }
    if (source == target && from.getScale() == to.getScale() && from.getUnit() == to.getUnit()) {
      return Optional.of(UnaryOperator.identity());
    }
    return Optional.empty();
  }

  private static Object checkRange(long value, MinorType target) {
    if (value < target.minIntegralValue() || value > target.maxIntegralValue()) {
      throw new ArithmeticException(value + " out of range of " + target);
    }
    return value;
  }

  private static Object toDecimal(long value, MajorType type) {
    BigDecimal decimal = BigDecimal.valueOf(value).setScale(type.getScale());
    if (decimal.precision() > type.getPrecision()) {
      throw new ArithmeticException(value + " does not fit into DECIMAL(" + type.getPrecision() + ", " + type.getScale() + ")");
    }
    return decimal;
  }
}
