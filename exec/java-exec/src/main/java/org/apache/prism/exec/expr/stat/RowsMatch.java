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

/**
 * Result of matching a filter against the statistics of one storage unit.
 * Only {@link #NONE} is a proof; the other two both mean the unit has to be read.
 */
public enum RowsMatch {
  /**
   * No row of the unit can satisfy the filter.
   */
  NONE,
  /**
   * Statistics were evaluated and some rows may satisfy the filter.
   */
  SOME,
  /**
   * The filter could not be evaluated against the statistics.
   */
  UNKNOWN;

  public RowsMatch and(RowsMatch other) {
    if (this == NONE || other == NONE) {
      return NONE;
    }
    return this == UNKNOWN || other == UNKNOWN ? UNKNOWN : SOME;
  }

  public RowsMatch or(RowsMatch other) {
    if (this == SOME || other == SOME) {
      return SOME;
    }
    return this == NONE && other == NONE ? NONE : UNKNOWN;
  }

  public boolean canSkip() {
    return this == NONE;
  }
}
