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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.apache.prism.test.PrismTest;
import org.junit.Test;

public class TestTypes extends PrismTest {

  @Test
  public void testDefaultTimeUnits() {
    assertEquals(TimestampUnit.MICROS, Types.optional(MinorType.TIMESTAMP).getUnit());
    assertEquals(TimestampUnit.MICROS, Types.optional(MinorType.TIMESTAMPTZ).getUnit());
    assertEquals(TimestampUnit.NANOS, Types.optional(MinorType.TIME).getUnit());
    assertNull(Types.optional(MinorType.DATE).getUnit());
  }

  @Test
  public void testComparisonDomains() {
    assertTrue(Types.isSameComparisonDomain(Types.required(MinorType.INT), Types.optional(MinorType.UINT8)));
    assertTrue(Types.isSameComparisonDomain(Types.required(MinorType.FLOAT4), Types.optional(MinorType.FLOAT8)));
    assertTrue(Types.isSameComparisonDomain(Types.decimal(DataMode.OPTIONAL, 10, 2),
        Types.decimal(DataMode.OPTIONAL, 18, 6)));
    assertFalse(Types.isSameComparisonDomain(Types.required(MinorType.INT), Types.required(MinorType.FLOAT8)));
    assertFalse(Types.isSameComparisonDomain(Types.required(MinorType.VARCHAR), Types.required(MinorType.VARBINARY)));
    assertFalse(Types.isSameComparisonDomain(
        Types.withUnit(MinorType.TIMESTAMP, DataMode.OPTIONAL, TimestampUnit.MILLIS),
        Types.withUnit(MinorType.TIMESTAMP, DataMode.OPTIONAL, TimestampUnit.MICROS)));
    assertFalse(Types.isSameComparisonDomain(Types.optional(MinorType.TIMESTAMP), Types.optional(MinorType.TIMESTAMPTZ)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDecimalRequiresScale() {
    Types.optional(MinorType.VARDECIMAL);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnitOnlyForTimeTypes() {
    Types.withUnit(MinorType.DATE, DataMode.OPTIONAL, TimestampUnit.MILLIS);
  }

  @Test
  public void testTimestampUnitFactors() {
    assertEquals(1_000L, TimestampUnit.MICROS.factorFrom(TimestampUnit.MILLIS));
    assertEquals(1_000_000L, TimestampUnit.NANOS.factorFrom(TimestampUnit.MILLIS));
    assertEquals(0L, TimestampUnit.MILLIS.factorFrom(TimestampUnit.NANOS));
    assertEquals(1L, TimestampUnit.MICROS.factorFrom(TimestampUnit.MICROS));
    assertEquals(1_000L, TimestampUnit.MICROS.nanosPerUnit());
  }

  @Test
  public void testIntegralRanges() {
    assertEquals(Byte.MIN_VALUE, MinorType.TINYINT.minIntegralValue());
    assertEquals(0xFFFFL, MinorType.UINT2.maxIntegralValue());
    assertEquals(0L, MinorType.UINT8.minIntegralValue());
    assertTrue(MinorType.UINT4.isIntegral());
    assertFalse(MinorType.VARDECIMAL.isIntegral());
    assertTrue(MinorType.VARDECIMAL.isNumeric());
  }
}
