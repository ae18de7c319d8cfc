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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.parquet.schema.MessageType;
import org.apache.prism.common.expression.SchemaPath;
import org.apache.prism.common.expression.ValueExpressions.Literal;

/**
 * Footer metadata of one file together with the values of partition columns
 * derived from its location.
 */
public class FileMetadata {

  private final String location;
  private final MessageType schema;
  private final List<RowGroupMetadata> rowGroups;
  private final Map<SchemaPath, Literal> partitionValues;

  private FileMetadata(FileMetadataBuilder builder) {
    this.location = builder.location;
    this.schema = builder.schema;
    this.rowGroups = builder.rowGroups;
    this.partitionValues = builder.partitionValues;
  }

  public String getLocation() {
    return location;
  }

  /**
   * @return file schema, or {@code null} when it was not read
   */
  public MessageType getSchema() {
    return schema;
  }

  public List<RowGroupMetadata> getRowGroups() {
    return rowGroups;
  }

  public long getRowCount() {
    long rowCount = 0;
    for (RowGroupMetadata rowGroup : rowGroups) {
      rowCount += rowGroup.getRowCount();
    }
    return rowCount;
  }

  /**
   * Values shared by all rows of the file. A null literal stands for a null partition.
   */
  public Map<SchemaPath, Literal> getPartitionValues() {
    return partitionValues;
  }

  public static FileMetadataBuilder builder() {
    return new FileMetadataBuilder();
  }

  public static class FileMetadataBuilder {
    private String location;
    private MessageType schema;
    private final List<RowGroupMetadata> rowGroups = new ArrayList<>();
    private final Map<SchemaPath, Literal> partitionValues = new LinkedHashMap<>();

    public FileMetadataBuilder location(String location) {
      this.location = location;
      return this;
    }

    public FileMetadataBuilder schema(MessageType schema) {
      this.schema = schema;
      return this;
    }

    public FileMetadataBuilder rowGroup(RowGroupMetadata rowGroup) {
      rowGroups.add(rowGroup);
      return this;
    }

    public FileMetadataBuilder partitionValue(SchemaPath column, Literal value) {
      partitionValues.put(column, value);
      return this;
    }

    public FileMetadata build() {
      Objects.requireNonNull(location, "location was not set");
      return new FileMetadata(this);
    }
  }
}
