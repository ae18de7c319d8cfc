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
package org.apache.prism.exec.store.parquet;

import static org.apache.prism.exec.store.parquet.ParquetTestUtils.bytes;
import static org.apache.prism.exec.store.parquet.ParquetTestUtils.chunk;
import static org.apache.prism.exec.store.parquet.ParquetTestUtils.int32;
import static org.apache.prism.exec.store.parquet.ParquetTestUtils.intStatistics;
import static org.apache.prism.exec.store.parquet.ParquetTestUtils.rowGroup;
import static org.apache.prism.exec.store.parquet.ParquetTestUtils.string;
import static org.junit.Assert.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import org.apache.parquet.column.Dictionary;
import org.apache.parquet.io.api.Binary;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.prism.categories.ParquetTest;
import org.apache.prism.common.expression.ComparisonExpression;
import org.apache.prism.common.expression.ComparisonOperator;
import org.apache.prism.common.expression.IsNullExpression;
import org.apache.prism.common.expression.LogicalExpression;
import org.apache.prism.common.expression.SchemaPath;
import org.apache.prism.common.expression.ValueExpressions;
import org.apache.prism.common.types.DataMode;
import org.apache.prism.common.types.MinorType;
import org.apache.prism.common.types.TimestampUnit;
import org.apache.prism.common.types.Types;
import org.apache.prism.exec.expr.Decision;
import org.apache.prism.exec.expr.coerce.CoercionRules;
import org.apache.prism.exec.record.metadata.TupleSchema;
import org.apache.prism.exec.store.parquet.metadata.ColumnChunkMetadata;
import org.apache.prism.exec.store.parquet.metadata.FileMetadata;
import org.apache.prism.exec.store.parquet.metadata.RawStatistics;
import org.apache.prism.exec.store.parquet.metadata.RowGroupMetadata;
import org.apache.prism.exec.store.parquet.stat.StatisticsDecoders;
import org.apache.prism.test.PrismTest;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import com.codahale.metrics.MetricRegistry;

/**
 * Decisions for a single row group with hand written footer statistics.
 */
@Category(ParquetTest.class)
public class TestPruningScenarios extends PrismTest {

  private static final SchemaPath COL = SchemaPath.getSimplePath("col");

  private final ParquetPruner pruner = new ParquetPruner(PruningOptions.defaults(), CoercionRules.defaults(),
      StatisticsDecoders.defaults(), new PruningMetrics(new MetricRegistry()), null);

  @Test
  public void testRangeAboveMaxIsSkipped() {
    RowGroupMetadata rowGroup = intRowGroup(5, 10, 0L, 100);
    assertEquals(Decision.SKIP, decide(compare(ComparisonOperator.GREATER_THAN, ValueExpressions.getInt(20)), intSchema(), rowGroup));
  }

  @Test
  public void testValueInsideRangeIsKept() {
    RowGroupMetadata rowGroup = intRowGroup(5, 10, 0L, 100);
    assertEquals(Decision.KEEP, decide(compare(ComparisonOperator.EQUAL, ValueExpressions.getInt(7)), intSchema(), rowGroup));
  }

  @Test
  public void testIsNullWithoutNullsIsSkipped() {
    RowGroupMetadata rowGroup = intRowGroup(5, 10, 0L, 100);
    assertEquals(Decision.SKIP, decide(IsNullExpression.isNull(COL), intSchema(), rowGroup));
  }

  @Test
  public void testValueOutsideDictionaryBoundsIsSkipped() {
    PrimitiveType type = string("col");
    Dictionary dictionary = mock(Dictionary.class);
    when(dictionary.getMaxId()).thenReturn(1);
    when(dictionary.decodeToBinary(0)).thenReturn(Binary.fromString("apple"));
    when(dictionary.decodeToBinary(1)).thenReturn(Binary.fromString("banana"));
    RawStatistics statistics = RawStatistics.builder()
        .primitiveType(type)
        .min(bytes(0))
        .max(bytes(1))
        .nullCount(0L)
        .dictionaryBounds(dictionary, true)
        .build();
    RowGroupMetadata rowGroup = rowGroup(0, 100, chunk(type, statistics));
    TupleSchema schema = new TupleSchema().add("col", Types.optional(MinorType.VARCHAR));

    assertEquals(Decision.SKIP, decide(compare(ComparisonOperator.EQUAL, ValueExpressions.getChar("cherry")), schema, rowGroup));
    assertEquals(Decision.KEEP, decide(compare(ComparisonOperator.EQUAL, ValueExpressions.getChar("apricot")), schema, rowGroup));
  }

  @Test
  public void testAllNullUnitIsSkipped() {
    RowGroupMetadata rowGroup = intRowGroup(null, null, 100L, 100);
    assertEquals(Decision.SKIP, decide(IsNullExpression.isNotNull(COL), intSchema(), rowGroup));
    assertEquals(Decision.SKIP, decide(compare(ComparisonOperator.EQUAL, ValueExpressions.getInt(5)), intSchema(), rowGroup));
  }

  @Test
  public void testOutOfRangeLiteralIsKept() {
    RowGroupMetadata rowGroup = intRowGroup(5, 10, 0L, 100);
    assertEquals(Decision.KEEP,
        decide(compare(ComparisonOperator.GREATER_THAN, ValueExpressions.getBigInt(Long.MAX_VALUE)), intSchema(), rowGroup));
  }

  @Test
  public void testOverflowingTimestampLiteralIsKept() {
    PrimitiveType type = org.apache.parquet.schema.Types.optional(PrimitiveTypeName.INT64)
        .as(LogicalTypeAnnotation.timestampType(false, LogicalTypeAnnotation.TimeUnit.NANOS))
        .named("col");
    RawStatistics statistics = RawStatistics.builder()
        .primitiveType(type)
        .min(bytes(0L))
        .max(bytes(1_000_000_000L))
        .nullCount(0L)
        .build();
    RowGroupMetadata rowGroup = rowGroup(0, 100, chunk(type, statistics));
    TupleSchema schema = new TupleSchema().add("col", Types.withUnit(MinorType.TIMESTAMP, DataMode.OPTIONAL, TimestampUnit.NANOS));

    LogicalExpression filter = compare(ComparisonOperator.GREATER_THAN,
        ValueExpressions.getTimeStamp(LocalDateTime.of(3000, 1, 1, 0, 0)));
    assertEquals(Decision.KEEP, decide(filter, schema, rowGroup));
  }

  @Test
  public void testZonedLiteralsDenoteInstants() {
    PrimitiveType type = org.apache.parquet.schema.Types.optional(PrimitiveTypeName.INT64)
        .as(LogicalTypeAnnotation.timestampType(true, LogicalTypeAnnotation.TimeUnit.MICROS))
        .named("col");
    long micros = LocalDateTime.of(2024, 1, 1, 0, 0).toEpochSecond(ZoneOffset.UTC) * 1_000_000L;
    RawStatistics statistics = RawStatistics.builder()
        .primitiveType(type)
        .min(bytes(micros))
        .max(bytes(micros))
        .nullCount(0L)
        .build();
    RowGroupMetadata rowGroup = rowGroup(0, 10, chunk(type, statistics));
    TupleSchema schema = new TupleSchema().add("col", Types.optional(MinorType.TIMESTAMPTZ));

    ZonedDateTime utc = ZonedDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneId.of("UTC"));
    ZonedDateTime paris = ZonedDateTime.of(2024, 1, 1, 1, 0, 0, 0, ZoneId.of("Europe/Paris"));
    assertEquals(Decision.KEEP, decide(compare(ComparisonOperator.EQUAL, ValueExpressions.getTimeStampTz(utc)), schema, rowGroup));
    assertEquals(Decision.KEEP, decide(compare(ComparisonOperator.EQUAL, ValueExpressions.getTimeStampTz(paris)), schema, rowGroup));
    assertEquals(Decision.SKIP, decide(compare(ComparisonOperator.LESS_THAN, ValueExpressions.getTimeStampTz(paris)), schema, rowGroup));
  }

  private Decision decide(LogicalExpression filter, TupleSchema schema, RowGroupMetadata rowGroup) {
    FileMetadata file = FileMetadata.builder()
        .location("/data/part-0.parquet")
        .rowGroup(rowGroup)
        .build();
    AccessPlan plan = pruner.pruneRowGroups(file, pruner.prepare(filter, schema));
    return plan.getSelection()[0];
  }

  private static LogicalExpression compare(ComparisonOperator operator, LogicalExpression literal) {
    return new ComparisonExpression(operator, COL, literal);
  }

  private static TupleSchema intSchema() {
    return new TupleSchema().add("col", Types.optional(MinorType.INT));
  }

  private static RowGroupMetadata intRowGroup(Integer min, Integer max, Long nullCount, long rowCount) {
    PrimitiveType type = int32("col");
    ColumnChunkMetadata chunk = chunk(type, intStatistics(type, min, max, nullCount));
    return rowGroup(0, rowCount, chunk);
  }
}
