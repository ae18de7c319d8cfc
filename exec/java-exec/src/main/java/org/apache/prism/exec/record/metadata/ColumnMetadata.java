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

import java.util.Objects;

import org.apache.prism.common.expression.SchemaPath;
import org.apache.prism.common.types.MajorType;

import com.google.common.base.Preconditions;

/**
 * Column available for statistics-based pruning.
 */
public class ColumnMetadata {

  private final SchemaPath path;
  private final MajorType type;

  public ColumnMetadata(SchemaPath path, MajorType type) {
    this.path = Preconditions.checkNotNull(path);
    this.type = Preconditions.checkNotNull(type);
  }

  public SchemaPath path() {
    return path;
  }

  public String name() {
    return path.getAsUnescapedPath();
  }

  public MajorType majorType() {
    return type;
  }

  public boolean isArray() {
    return type.isRepeated();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnMetadata)) {
      return false;
    }
    ColumnMetadata that = (ColumnMetadata) o;
    return path.equals(that.path) && type.equals(that.type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(path, type);
  }

  @Override
  public String toString() {
    return path.getPath() + " " + type;
  }
}
