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
package org.apache.prism.common.types;

import java.util.concurrent.TimeUnit;

/**
 * Resolution of a stored timestamp or time value.
 */
public enum TimestampUnit {
  MILLIS(1_000L, TimeUnit.MILLISECONDS),
  MICROS(1_000_000L, TimeUnit.MICROSECONDS),
  NANOS(1_000_000_000L, TimeUnit.NANOSECONDS);

  private final long perSecond;
  private final TimeUnit timeUnit;

  TimestampUnit(long perSecond, TimeUnit timeUnit) {
    this.perSecond = perSecond;
    this.timeUnit = timeUnit;
  }

  /**
   * Number of units in one second.
   */
  public long perSecond() {
    return perSecond;
  }

  public long nanosPerUnit() {
    return 1_000_000_000L / perSecond;
  }

  public TimeUnit toTimeUnit() {
    return timeUnit;
  }

  /**
   * Factor to multiply a value in {@code coarser} by to express it in this unit,
   * or zero when {@code coarser} is in fact finer.
   */
  public long factorFrom(TimestampUnit coarser) {
    return perSecond >= coarser.perSecond ? perSecond / coarser.perSecond : 0;
  }
}
