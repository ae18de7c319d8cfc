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

import java.util.List;

import org.apache.prism.common.expression.SchemaPath;

/**
 * Schema of the columns a predicate may reference. Only columns present here
 * can have statistics; references to other columns are never pruned on.
 */
public interface TupleMetadata extends Iterable<ColumnMetadata> {

  int size();

  boolean isEmpty();

  /**
   * @return the column with the given path or {@code null} when the schema has no such column
   */
  ColumnMetadata metadata(SchemaPath path);

  boolean contains(SchemaPath path);

  List<ColumnMetadata> toMetadataList();
}
