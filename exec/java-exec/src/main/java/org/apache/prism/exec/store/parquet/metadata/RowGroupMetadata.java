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

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.prism.common.expression.SchemaPath;

import com.google.common.base.Preconditions;

/**
 * Footer metadata of one row group.
 */
public class RowGroupMetadata {

  private final int rowGroupIndex;
  private final long rowCount;
  private final Map<SchemaPath, ColumnChunkMetadata> columns;
  private final PageIndex pageIndex;

  private RowGroupMetadata(RowGroupMetadataBuilder builder) {
    this.rowGroupIndex = builder.rowGroupIndex;
    this.rowCount = builder.rowCount;
    this.columns = builder.columns;
    this.pageIndex = builder.pageIndex;
  }

  /**
   * Returns index of current row group within its file.
   */
  public int getRowGroupIndex() {
    return rowGroupIndex;
  }

  public long getRowCount() {
    return rowCount;
  }

  /**
   * @return chunk of the column, or {@code null} when the file has no such column
   */
  public ColumnChunkMetadata getColumn(SchemaPath path) {
    return columns.get(path);
  }

  public Map<SchemaPath, ColumnChunkMetadata> getColumns() {
    return columns;
  }

  /**
   * @return page index of the row group, or {@code null} when the file has none
   */
  public PageIndex getPageIndex() {
    return pageIndex;
  }

  public static RowGroupMetadataBuilder builder() {
    return new RowGroupMetadataBuilder();
  }

  public static class RowGroupMetadataBuilder {
    private int rowGroupIndex;
    private long rowCount = -1;
    private final Map<SchemaPath, ColumnChunkMetadata> columns = new LinkedHashMap<>();
    private PageIndex pageIndex;

    public RowGroupMetadataBuilder rowGroupIndex(int rowGroupIndex) {
      this.rowGroupIndex = rowGroupIndex;
      return this;
    }

    public RowGroupMetadataBuilder rowCount(long rowCount) {
      this.rowCount = rowCount;
      return this;
    }

    public RowGroupMetadataBuilder column(ColumnChunkMetadata column) {
      columns.put(column.getPath(), column);
      return this;
    }

    public RowGroupMetadataBuilder pageIndex(PageIndex pageIndex) {
      this.pageIndex = pageIndex;
      return this;
    }

    public RowGroupMetadata build() {
      Preconditions.checkState(rowCount >= 0, "rowCount was not set");
      Preconditions.checkState(pageIndex == null || pageIndex.getRowCount() == rowCount,
          "pages of row group %s hold %s rows instead of %s", rowGroupIndex,
          pageIndex == null ? 0 : pageIndex.getRowCount(), rowCount);
      return new RowGroupMetadata(this);
    }
  }
}
