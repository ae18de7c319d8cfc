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
package org.apache.prism.exec.expr;

import org.apache.prism.exec.expr.stat.RowsMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates compiled predicates against unit statistics.
 */
public final class PruningEvaluator {
  private static final Logger logger = LoggerFactory.getLogger(PruningEvaluator.class);

  private PruningEvaluator() {
  }

  /**
   * Matches the predicate against every unit of the provider. Units without rows never match.
   */
  public static RowsMatch[] evaluate(PruningPredicate predicate, StatisticsProvider provider) {
    RowsMatch[] result = provider.evaluate(predicate.getRoot()).clone();
    for (int i = 0; i < result.length; i++) {
      if (provider.getRowCount(i) == 0) {
        result[i] = RowsMatch.NONE;
      }
    }
    if (logger.isTraceEnabled()) {
      logger.trace("{} evaluated over {} units", predicate, result.length);
    }
    return result;
  }

  /**
   * Collapses the three-valued match of every unit into a keep or skip decision.
   */
  public static Decision[] decide(PruningPredicate predicate, StatisticsProvider provider) {
    return decide(evaluate(predicate, provider));
  }

  public static Decision[] decide(RowsMatch[] matches) {
    Decision[] decisions = new Decision[matches.length];
    for (int i = 0; i < matches.length; i++) {
      decisions[i] = Decision.of(matches[i]);
    }
    return decisions;
  }
}
