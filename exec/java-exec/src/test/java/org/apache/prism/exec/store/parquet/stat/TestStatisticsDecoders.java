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
package org.apache.prism.exec.store.parquet.stat;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import java.math.BigDecimal;

import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.TimeUnit;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.prism.categories.ParquetTest;
import org.apache.prism.common.types.DataMode;
import org.apache.prism.common.types.MajorType;
import org.apache.prism.common.types.MinorType;
import org.apache.prism.common.types.TimestampUnit;
import org.apache.prism.common.types.Types;
import org.apache.prism.test.PrismTest;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(ParquetTest.class)
public class TestStatisticsDecoders extends PrismTest {

  private static final PrimitiveType PLAIN_INT32 = org.apache.parquet.schema.Types.optional(PrimitiveTypeName.INT32).named("c");

  @Test
  public void testConvertUnits() {
    assertEquals(Long.valueOf(1), StatisticsDecoders.convertUnits(1_500, TimestampUnit.MICROS, TimestampUnit.MILLIS, Bound.MIN));
    assertEquals(Long.valueOf(2), StatisticsDecoders.convertUnits(1_500, TimestampUnit.MICROS, TimestampUnit.MILLIS, Bound.MAX));
    assertNull(StatisticsDecoders.convertUnits(1_500, TimestampUnit.MICROS, TimestampUnit.MILLIS, Bound.EXACT));
    assertEquals(Long.valueOf(2), StatisticsDecoders.convertUnits(2_000, TimestampUnit.MICROS, TimestampUnit.MILLIS, Bound.EXACT));
    assertEquals(Long.valueOf(-2), StatisticsDecoders.convertUnits(-1_500, TimestampUnit.MICROS, TimestampUnit.MILLIS, Bound.MIN));
    assertEquals(Long.valueOf(-1), StatisticsDecoders.convertUnits(-1_500, TimestampUnit.MICROS, TimestampUnit.MILLIS, Bound.MAX));
    assertEquals(Long.valueOf(7_000_000), StatisticsDecoders.convertUnits(7, TimestampUnit.MILLIS, TimestampUnit.NANOS, Bound.MIN));
    assertEquals(Long.valueOf(42), StatisticsDecoders.convertUnits(42, TimestampUnit.NANOS, TimestampUnit.NANOS, Bound.EXACT));
  }

  @Test
  public void testConvertUnitsOverflow() {
    assertNull(StatisticsDecoders.convertUnits(Long.MAX_VALUE / 2, TimestampUnit.MILLIS, TimestampUnit.NANOS, Bound.MAX));
  }

  @Test
  public void testUnsignedIntegers() {
    PrimitiveType uint32 = org.apache.parquet.schema.Types.optional(PrimitiveTypeName.INT32)
        .as(LogicalTypeAnnotation.intType(32, false)).named("c");
    assertEquals(4_294_967_295L, StatisticsDecoders.decodeIntegral(-1, uint32, Types.optional(MinorType.UINT4), Bound.MAX));
    assertNull(StatisticsDecoders.decodeIntegral(-1, uint32, Types.optional(MinorType.INT), Bound.MAX));

    PrimitiveType uint64 = org.apache.parquet.schema.Types.optional(PrimitiveTypeName.INT64)
        .as(LogicalTypeAnnotation.intType(64, false)).named("c");
    assertEquals(5L, StatisticsDecoders.decodeIntegral(5L, uint64, Types.optional(MinorType.UINT8), Bound.MIN));
    assertNull(StatisticsDecoders.decodeIntegral(-1L, uint64, Types.optional(MinorType.UINT8), Bound.MAX));
  }

  @Test
  public void testIntegralRejectsOtherAnnotations() {
    PrimitiveType date = org.apache.parquet.schema.Types.optional(PrimitiveTypeName.INT32)
        .as(LogicalTypeAnnotation.dateType()).named("c");
    assertNull(StatisticsDecoders.decodeIntegral(3, date, Types.optional(MinorType.INT), Bound.MIN));
    assertNull(StatisticsDecoders.decodeIntegral(1.5f, PLAIN_INT32, Types.optional(MinorType.INT), Bound.MIN));
  }

  @Test
  public void testSignedZeros() {
    PrimitiveType type = org.apache.parquet.schema.Types.optional(PrimitiveTypeName.DOUBLE).named("c");
    MajorType float8 = Types.optional(MinorType.FLOAT8);
    assertEquals(Double.valueOf(-0.0d), StatisticsDecoders.decodeFloatingPoint(0.0d, type, float8, Bound.MIN));
    assertEquals(Double.valueOf(0.0d), StatisticsDecoders.decodeFloatingPoint(-0.0d, type, float8, Bound.MAX));
    assertEquals(Double.valueOf(-0.0d), StatisticsDecoders.decodeFloatingPoint(-0.0d, type, float8, Bound.EXACT));
  }

  @Test
  public void testNaN() {
    PrimitiveType type = org.apache.parquet.schema.Types.optional(PrimitiveTypeName.DOUBLE).named("c");
    MajorType float8 = Types.optional(MinorType.FLOAT8);
    assertNull(StatisticsDecoders.decodeFloatingPoint(Double.NaN, type, float8, Bound.MIN));
    assertNull(StatisticsDecoders.decodeFloatingPoint(Double.NaN, type, float8, Bound.MAX));
    assertEquals(Double.NaN, (Double) StatisticsDecoders.decodeFloatingPoint(Double.NaN, type, float8, Bound.EXACT), 0.0);
  }

  @Test
  public void testFloatWidening() {
    PrimitiveType floatType = org.apache.parquet.schema.Types.optional(PrimitiveTypeName.FLOAT).named("c");
    assertEquals((double) 0.1f, StatisticsDecoders.decodeFloatingPoint(0.1f, floatType, Types.optional(MinorType.FLOAT8), Bound.MIN));
    PrimitiveType doubleType = org.apache.parquet.schema.Types.optional(PrimitiveTypeName.DOUBLE).named("c");
    assertNull(StatisticsDecoders.decodeFloatingPoint(0.1d, doubleType, Types.optional(MinorType.FLOAT4), Bound.MIN));
  }

  @Test
  public void testDecimalRounding() throws Exception {
    PrimitiveType type = org.apache.parquet.schema.Types.optional(PrimitiveTypeName.FIXED_LEN_BYTE_ARRAY)
        .length(2)
        .as(LogicalTypeAnnotation.decimalType(2, 4))
        .named("c");
    MajorType column = Types.decimal(DataMode.OPTIONAL, 4, 1);
    byte[] value = {0x04, (byte) 0xD2};
    assertEquals(new BigDecimal("12.3"), StatisticsDecoders.decodeDecimal(value, type, column, Bound.MIN));
    assertEquals(new BigDecimal("12.4"), StatisticsDecoders.decodeDecimal(value, type, column, Bound.MAX));
    assertEquals(new BigDecimal("12.34"), StatisticsDecoders.decodeDecimal(value, type, column, Bound.EXACT));

    byte[] negative = {(byte) 0xFB, 0x2E};
    assertEquals(new BigDecimal("-12.4"), StatisticsDecoders.decodeDecimal(negative, type, column, Bound.MIN));
    assertEquals(new BigDecimal("-12.3"), StatisticsDecoders.decodeDecimal(negative, type, column, Bound.MAX));
  }

  @Test
  public void testDecimalFromIntegers() throws Exception {
    MajorType column = Types.decimal(DataMode.OPTIONAL, 10, 0);
    assertEquals(new BigDecimal("42"), StatisticsDecoders.decodeDecimal(42, PLAIN_INT32, column, Bound.MIN));
    PrimitiveType uint64 = org.apache.parquet.schema.Types.optional(PrimitiveTypeName.INT64)
        .as(LogicalTypeAnnotation.intType(64, false)).named("c");
    assertEquals(new BigDecimal("18446744073709551615"), StatisticsDecoders.decodeDecimal(-1L, uint64,
        Types.decimal(DataMode.OPTIONAL, 20, 0), Bound.EXACT));
  }

  @Test(expected = CorruptStatisticsException.class)
  public void testEmptyDecimalIsCorrupt() throws Exception {
    PrimitiveType type = org.apache.parquet.schema.Types.optional(PrimitiveTypeName.BINARY)
        .as(LogicalTypeAnnotation.decimalType(2, 10))
        .named("c");
    StatisticsDecoders.decodeDecimal(new byte[0], type, Types.decimal(DataMode.OPTIONAL, 10, 2), Bound.MIN);
  }

  @Test
  public void testBytes() {
    PrimitiveType string = org.apache.parquet.schema.Types.optional(PrimitiveTypeName.BINARY)
        .as(LogicalTypeAnnotation.stringType()).named("c");
    byte[] value = {1, 2};
    assertSame(value, StatisticsDecoders.decodeBytes(value, string, Types.optional(MinorType.VARCHAR), Bound.MIN));
    PrimitiveType decimal = org.apache.parquet.schema.Types.optional(PrimitiveTypeName.BINARY)
        .as(LogicalTypeAnnotation.decimalType(2, 10)).named("c");
    assertNull(StatisticsDecoders.decodeBytes(value, decimal, Types.optional(MinorType.VARBINARY), Bound.MIN));
    assertNull(StatisticsDecoders.decodeBytes(3, PLAIN_INT32, Types.optional(MinorType.VARBINARY), Bound.MIN));
  }

  @Test
  public void testDate() {
    PrimitiveType date = org.apache.parquet.schema.Types.optional(PrimitiveTypeName.INT32)
        .as(LogicalTypeAnnotation.dateType()).named("c");
    assertEquals(19_000L, StatisticsDecoders.decodeDate(19_000, date, Types.optional(MinorType.DATE), Bound.MIN));
    assertNull(StatisticsDecoders.decodeDate(19_000, PLAIN_INT32, Types.optional(MinorType.DATE), Bound.MIN));
  }

  @Test
  public void testTime() {
    PrimitiveType millis = org.apache.parquet.schema.Types.optional(PrimitiveTypeName.INT32)
        .as(LogicalTypeAnnotation.timeType(false, TimeUnit.MILLIS)).named("c");
    assertEquals(1_500_000_000L, StatisticsDecoders.decodeTime(1_500, millis, Types.optional(MinorType.TIME), Bound.MIN));
  }

  @Test
  public void testTimestampZoneMustMatch() {
    PrimitiveType local = org.apache.parquet.schema.Types.optional(PrimitiveTypeName.INT64)
        .as(LogicalTypeAnnotation.timestampType(false, TimeUnit.MILLIS)).named("c");
    PrimitiveType utc = org.apache.parquet.schema.Types.optional(PrimitiveTypeName.INT64)
        .as(LogicalTypeAnnotation.timestampType(true, TimeUnit.MILLIS)).named("c");
    MajorType timestamp = Types.optional(MinorType.TIMESTAMP);
    MajorType timestampTz = Types.optional(MinorType.TIMESTAMPTZ);

    assertEquals(5_000L, StatisticsDecoders.decodeTimestamp(5L, local, timestamp, Bound.MIN));
    assertEquals(5_000L, StatisticsDecoders.decodeTimestamp(5L, utc, timestampTz, Bound.MIN));
    assertNull(StatisticsDecoders.decodeTimestamp(5L, utc, timestamp, Bound.MIN));
    assertNull(StatisticsDecoders.decodeTimestamp(5L, local, timestampTz, Bound.MIN));
  }

  @Test
  public void testOverriddenDecoder() throws Exception {
    StatisticsDecoders decoders = StatisticsDecoders.builder()
        .put(MinorType.INT, (physical, fileType, columnType, bound) -> null)
        .build();
    assertNull(decoders.forType(MinorType.INT).decode(1, PLAIN_INT32, Types.optional(MinorType.INT), Bound.MIN));
    assertNull(StatisticsDecoders.builder().remove(MinorType.BIT).build().forType(MinorType.BIT));
  }
}
