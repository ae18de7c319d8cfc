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

import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.DecimalLogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.IntLogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.TimeLogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.TimestampLogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type.Repetition;
import org.apache.prism.common.expression.SchemaPath;
import org.apache.prism.common.types.DataMode;
import org.apache.prism.common.types.MajorType;
import org.apache.prism.common.types.MinorType;
import org.apache.prism.common.types.TimestampUnit;
import org.apache.prism.common.types.Types;
import org.apache.prism.exec.record.metadata.TupleSchema;

import com.google.common.collect.ImmutableBiMap;

/**
 * Util class for converting Parquet types into column types.
 */
public class ParquetTypeHelper {

  private static final ImmutableBiMap<DataMode, Repetition> modeMap = new ImmutableBiMap.Builder<DataMode, Repetition>()
      .put(DataMode.REQUIRED, Repetition.REQUIRED)
      .put(DataMode.OPTIONAL, Repetition.OPTIONAL)
      .put(DataMode.REPEATED, Repetition.REPEATED)
      .build();

  private ParquetTypeHelper() {
  }

  /**
   * @param repetition Parquet repetition type
   * @return data mode in correspondence to Parquet repetition type
   */
  public static DataMode getDataModeForRepetition(Repetition repetition) {
    return modeMap.inverse().get(repetition);
  }

  /**
   * @param dataMode data mode
   * @return Parquet repetition type in correspondence to data mode
   */
  public static Repetition getRepetitionForDataMode(DataMode dataMode) {
    return modeMap.get(dataMode);
  }

  /**
   * Column type of a Parquet primitive type, taking its logical type annotation into account.
   */
  public static MajorType getMajorType(PrimitiveType type, DataMode mode) {
    LogicalTypeAnnotation annotation = type.getLogicalTypeAnnotation();
    if (annotation instanceof DecimalLogicalTypeAnnotation) {
      DecimalLogicalTypeAnnotation decimal = (DecimalLogicalTypeAnnotation) annotation;
      return Types.decimal(mode, decimal.getPrecision(), decimal.getScale());
    }
    switch (type.getPrimitiveTypeName()) {
      case BOOLEAN:
        return Types.withMode(MinorType.BIT, mode);
      case INT32:
        if (annotation instanceof LogicalTypeAnnotation.DateLogicalTypeAnnotation) {
          return Types.withMode(MinorType.DATE, mode);
        } else if (annotation instanceof TimeLogicalTypeAnnotation) {
          return Types.withUnit(MinorType.TIME, mode, TimestampUnit.MILLIS);
        }
        return Types.withMode(getIntegralType(annotation, MinorType.INT), mode);
      case INT64:
        if (annotation instanceof TimeLogicalTypeAnnotation) {
          return Types.withUnit(MinorType.TIME, mode, getTimestampUnit(((TimeLogicalTypeAnnotation) annotation).getUnit()));
        } else if (annotation instanceof TimestampLogicalTypeAnnotation) {
          TimestampLogicalTypeAnnotation timestamp = (TimestampLogicalTypeAnnotation) annotation;
          MinorType minorType = timestamp.isAdjustedToUTC() ? MinorType.TIMESTAMPTZ : MinorType.TIMESTAMP;
          return Types.withUnit(minorType, mode, getTimestampUnit(timestamp.getUnit()));
        }
        return Types.withMode(getIntegralType(annotation, MinorType.BIGINT), mode);
      case INT96:
        return Types.withUnit(MinorType.TIMESTAMP, mode, TimestampUnit.NANOS);
      case FLOAT:
        return Types.withMode(MinorType.FLOAT4, mode);
      case DOUBLE:
        return Types.withMode(MinorType.FLOAT8, mode);
      case BINARY:
        if (annotation instanceof LogicalTypeAnnotation.StringLogicalTypeAnnotation
            || annotation instanceof LogicalTypeAnnotation.EnumLogicalTypeAnnotation
            || annotation instanceof LogicalTypeAnnotation.JsonLogicalTypeAnnotation) {
          return Types.withMode(MinorType.VARCHAR, mode);
        }
        return Types.withMode(MinorType.VARBINARY, mode);
      default:
        return Types.withMode(MinorType.VARBINARY, mode);
    }
  }

  /**
   * Schema of the leaf columns of a file. Columns nested in a repeated group are repeated.
   */
  public static TupleSchema getSchema(MessageType messageType) {
    TupleSchema schema = new TupleSchema();
    for (ColumnDescriptor column : messageType.getColumns()) {
      PrimitiveType type = column.getPrimitiveType();
      DataMode mode;
      if (column.getMaxRepetitionLevel() > 0) {
        mode = DataMode.REPEATED;
      } else {
        mode = getDataModeForRepetition(type.getRepetition());
      }
      schema.add(SchemaPath.getCompoundPath(column.getPath()), getMajorType(type, mode));
    }
    return schema;
  }

  private static MinorType getIntegralType(LogicalTypeAnnotation annotation, MinorType defaultType) {
    if (!(annotation instanceof IntLogicalTypeAnnotation)) {
      return defaultType;
    }
    IntLogicalTypeAnnotation intType = (IntLogicalTypeAnnotation) annotation;
    switch (intType.getBitWidth()) {
      case 8:
        return intType.isSigned() ? MinorType.TINYINT : MinorType.UINT1;
      case 16:
        return intType.isSigned() ? MinorType.SMALLINT : MinorType.UINT2;
      case 32:
        return intType.isSigned() ? MinorType.INT : MinorType.UINT4;
      default:
        return intType.isSigned() ? MinorType.BIGINT : MinorType.UINT8;
    }
  }

  public static TimestampUnit getTimestampUnit(LogicalTypeAnnotation.TimeUnit unit) {
    switch (unit) {
      case MILLIS:
        return TimestampUnit.MILLIS;
      case MICROS:
        return TimestampUnit.MICROS;
      default:
        return TimestampUnit.NANOS;
    }
  }
}
