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

import java.util.List;

import org.apache.prism.common.expression.SchemaPath;
import org.apache.prism.metastore.metadata.MetadataType;

import com.google.common.collect.ImmutableList;

/**
 * Row groups of a file taken from its footer.
 */
public class RowGroupStatisticsSource implements StatisticsSource {

  private final List<RowGroupMetadata> rowGroups;

  public RowGroupStatisticsSource(List<RowGroupMetadata> rowGroups) {
    this.rowGroups = ImmutableList.copyOf(rowGroups);
  }

  @Override
  public MetadataType getMetadataType() {
    return MetadataType.ROW_GROUP;
  }

  @Override
  public int getUnitCount() {
    return rowGroups.size();
  }

  @Override
  public long getRowCount(int unit) {
    return rowGroups.get(unit).getRowCount();
  }

  @Override
  public RawStatistics getStatistics(int unit, SchemaPath column) {
    ColumnChunkMetadata chunk = rowGroups.get(unit).getColumn(column);
    return chunk == null ? null : chunk.getStatistics();
  }
}
