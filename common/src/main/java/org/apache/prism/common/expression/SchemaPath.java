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
package org.apache.prism.common.expression;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.prism.common.expression.visitors.ExprVisitor;
import org.apache.prism.common.types.MajorType;
import org.apache.prism.common.types.Types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Reference to a (possibly nested) column.
 */
public class SchemaPath extends LogicalExpressionBase implements Comparable<SchemaPath> {

  private final ImmutableList<String> names;

  private SchemaPath(List<String> names) {
    Preconditions.checkArgument(!names.isEmpty(), "Column path must have at least one segment");
    this.names = ImmutableList.copyOf(names);
  }

  public static SchemaPath getSimplePath(String name) {
    return getCompoundPath(name);
  }

  public static SchemaPath getCompoundPath(String... strings) {
    return new SchemaPath(Arrays.asList(strings));
  }

  /**
   * Parses a dotted path such as {@code a.b.c}. Segments are not quoted.
   */
  @JsonCreator
  public static SchemaPath parseFromString(String path) {
    return getCompoundPath(path.split("\\."));
  }

  public List<String> getNames() {
    return names;
  }

  public String getRootSegmentPath() {
    return names.get(0);
  }

  public String getLastSegment() {
    return names.get(names.size() - 1);
  }

  public boolean isSimplePath() {
    return names.size() == 1;
  }

  public SchemaPath getChild(String childPath) {
    return new SchemaPath(ImmutableList.<String>builder().addAll(names).add(childPath).build());
  }

  public String getAsUnescapedPath() {
    return String.join(".", names);
  }

  /**
   * Returns the path in the quoted form used by plans, e.g. {@code `a`.`b`}.
   */
  @JsonValue
  public String getPath() {
    return names.stream()
        .map(name -> "`" + name.replace("`", "\\`") + "`")
        .collect(Collectors.joining("."));
  }

  @Override
  public MajorType getMajorType() {
    return Types.LATE_BIND_TYPE;
  }

  @Override
  public <T, V, E extends Exception> T accept(ExprVisitor<T, V, E> visitor, V value) throws E {
    return visitor.visitSchemaPath(this, value);
  }

  @Override
  public int compareTo(SchemaPath o) {
    return getAsUnescapedPath().compareTo(o.getAsUnescapedPath());
  }

  @Override
  public int hashCode() {
    return names.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof SchemaPath)) {
      return false;
    }
    return names.equals(((SchemaPath) obj).names);
  }
}
