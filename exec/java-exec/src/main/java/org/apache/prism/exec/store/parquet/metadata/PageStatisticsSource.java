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
package org.apache.prism.exec.store.parquet.metadata;

import java.nio.ByteBuffer;
import java.util.List;

import org.apache.parquet.internal.column.columnindex.ColumnIndex;
import org.apache.prism.common.expression.SchemaPath;
import org.apache.prism.metastore.metadata.MetadataType;

import com.google.common.base.Preconditions;

/**
 * Row ranges of one row group, see {@link PageIndex}, with statistics taken from the
 * column index page holding each range.
 */
public class PageStatisticsSource implements StatisticsSource {
  private final RowGroupMetadata rowGroup;
  private final PageIndex pageIndex;
  private final long[] rowCounts;

  public PageStatisticsSource(RowGroupMetadata rowGroup) {
    this.rowGroup = rowGroup;
    this.pageIndex = Preconditions.checkNotNull(rowGroup.getPageIndex(),
        "Row group %s has no page index", rowGroup.getRowGroupIndex());
    this.rowCounts = pageIndex.getPageRowCounts();
  }

  @Override
  public MetadataType getMetadataType() {
    return MetadataType.PAGE;
  }

  @Override
  public int getUnitCount() {
    return pageIndex.getPageCount();
  }

  @Override
  public long getRowCount(int unit) {
    return rowCounts[unit];
  }

  @Override
  public long[] getRowCounts() {
    return pageIndex.getPageRowCounts();
  }

  @Override
  public RawStatistics getStatistics(int unit, SchemaPath column) {
    ColumnChunkMetadata chunk = rowGroup.getColumn(column);
    if (chunk == null) {
      return null;
    }
    RawStatistics empty = RawStatistics.empty(chunk.getPrimitiveType());
    ColumnIndex columnIndex = pageIndex.getColumnIndex(column);
    if (columnIndex == null) {
      return empty;
    }
    int page = pageIndex.getColumnPage(column, unit);
    List<Long> nullCounts = columnIndex.getNullCounts();
    Long pageNullCount = nullCounts == null || page >= nullCounts.size() ? null : nullCounts.get(page);
    boolean allNull = columnIndex.getNullPages().get(page)
        || pageNullCount != null && pageNullCount == pageIndex.getColumnPageRowCount(column, page);
    if (allNull) {
      return RawStatistics.builder()
          .primitiveType(chunk.getPrimitiveType())
          .nullCount(getRowCount(unit))
          .build();
    }
    return RawStatistics.builder()
        .primitiveType(chunk.getPrimitiveType())
        .min(toBytes(columnIndex.getMinValues(), page))
        .max(toBytes(columnIndex.getMaxValues(), page))
        .nullCount(rangeNullCount(column, unit, pageNullCount))
        .build();
  }

  // a range holding part of a page knows its null count only when the page has none
  private Long rangeNullCount(SchemaPath column, int unit, Long pageNullCount) {
    if (pageNullCount == null) {
      return null;
    }
    if (pageIndex.coversColumnPage(column, unit) || pageNullCount == 0) {
      return pageNullCount;
    }
    return null;
  }

  private static byte[] toBytes(List<ByteBuffer> values, int unit) {
    if (values == null || unit >= values.size() || values.get(unit) == null) {
      return null;
    }
    ByteBuffer value = values.get(unit).duplicate();
    byte[] bytes = new byte[value.remaining()];
    value.get(bytes);
    return bytes;
  }
}
