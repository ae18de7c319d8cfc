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

import java.util.Arrays;

import org.apache.prism.common.types.MajorType;
import org.apache.prism.exec.expr.StatisticsProvider;

import com.google.common.base.Preconditions;

/**
 * Literal already normalized into the value domain of the column it is compared with.
 */
public class ConstantOperand implements StatOperand {

  private final Object value;
  private final MajorType type;

  public ConstantOperand(Object value, MajorType type) {
    this.value = Preconditions.checkNotNull(value);
    this.type = type;
  }

  public Object getValue() {
    return value;
  }

  @Override
  public MajorType getType() {
    return type;
  }

  @Override
  public StatisticsBatch evaluate(StatisticsProvider provider) {
    return StatisticsBatch.constant(type, value, provider.getRowCounts());
  }

  @Override
  public String toString() {
    return value instanceof byte[] ? Arrays.toString((byte[]) value) : String.valueOf(value);
  }
}
