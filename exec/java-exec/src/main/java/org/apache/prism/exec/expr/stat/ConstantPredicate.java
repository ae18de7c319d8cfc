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

import org.apache.prism.exec.expr.StatisticsProvider;

/**
 * Predicate with the same result for every unit.
 */
public enum ConstantPredicate implements FilterPredicate {
  /**
   * Literal {@code TRUE}: every unit is read.
   */
  ALWAYS(RowsMatch.SOME),
  /**
   * Never true, e.g. literal {@code FALSE} or a comparison with {@code NULL}.
   */
  NEVER(RowsMatch.NONE),
  /**
   * Part of the filter that cannot be evaluated against statistics.
   */
  UNKNOWN(RowsMatch.UNKNOWN);

  private final RowsMatch result;

  ConstantPredicate(RowsMatch result) {
    this.result = result;
  }

  @Override
  public RowsMatch[] matches(StatisticsProvider provider) {
    RowsMatch[] results = new RowsMatch[provider.getUnitCount()];
    Arrays.fill(results, result);
    return results;
  }
}
