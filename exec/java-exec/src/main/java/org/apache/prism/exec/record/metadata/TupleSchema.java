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
package org.apache.prism.exec.record.metadata;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.prism.common.expression.SchemaPath;
import org.apache.prism.common.types.MajorType;

import com.google.common.base.Preconditions;

/**
 * Insertion-ordered implementation of {@link TupleMetadata}.
 */
public class TupleSchema implements TupleMetadata {

  private final Map<SchemaPath, ColumnMetadata> columns = new LinkedHashMap<>();

  public TupleSchema add(ColumnMetadata column) {
    ColumnMetadata previous = columns.putIfAbsent(column.path(), column);
    Preconditions.checkArgument(previous == null, "Duplicate column: %s", column.path());
    return this;
  }

  public TupleSchema add(SchemaPath path, MajorType type) {
    return add(new ColumnMetadata(path, type));
  }

  public TupleSchema add(String name, MajorType type) {
    return add(SchemaPath.getSimplePath(name), type);
  }

  @Override
  public int size() {
    return columns.size();
  }

  @Override
  public boolean isEmpty() {
    return columns.isEmpty();
  }

  @Override
  public ColumnMetadata metadata(SchemaPath path) {
    return columns.get(path);
  }

  @Override
  public boolean contains(SchemaPath path) {
    return columns.containsKey(path);
  }

  @Override
  public List<ColumnMetadata> toMetadataList() {
    return new ArrayList<>(columns.values());
  }

  @Override
  public Iterator<ColumnMetadata> iterator() {
    return columns.values().iterator();
  }

  @Override
  public String toString() {
    return "TupleSchema" + columns.values();
  }
}
