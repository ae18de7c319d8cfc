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
package org.apache.prism.exec.expr.stat;

import java.util.function.UnaryOperator;

import org.apache.prism.common.types.MajorType;
import org.apache.prism.exec.expr.StatisticsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cast over another operand. The cast function must be monotonically non-decreasing so that
 * it maps the bounds of the input onto bounds of the result. A bound that cannot be converted
 * makes both bounds of that unit unknown.
 */
public class CastOperand implements StatOperand {
  private static final Logger logger = LoggerFactory.getLogger(CastOperand.class);

  private final StatOperand input;
  private final MajorType type;
  private final UnaryOperator<Object> function;

  public CastOperand(StatOperand input, MajorType type, UnaryOperator<Object> function) {
    this.input = input;
    this.type = type;
    this.function = function;
  }

  public StatOperand getInput() {
    return input;
  }

  @Override
  public MajorType getType() {
    return type;
  }

  @Override
  public StatisticsBatch evaluate(StatisticsProvider provider) {
    StatisticsBatch inputStatistics = input.evaluate(provider);
    if (inputStatistics == null) {
      return null;
    }
    int size = inputStatistics.size();
    Object[] minValues = new Object[size];
    Object[] maxValues = new Object[size];
    for (int i = 0; i < size; i++) {
      Object min = inputStatistics.getMin(i);
      Object max = inputStatistics.getMax(i);
      if (min == null || max == null) {
        continue;
      }
      try {
        minValues[i] = function.apply(min);
        maxValues[i] = function.apply(max);
      } catch (ArithmeticException e) {
        logger.trace("Unable to cast bounds of unit {} to {}: {}", i, type.getMinorType(), e.getMessage());
        minValues[i] = null;
        maxValues[i] = null;
      }
    }
    return inputStatistics.withBounds(type, minValues, maxValues);
  }

  @Override
  public String toString() {
    return "CAST(" + input + " AS " + type.getMinorType() + ")";
  }
}
