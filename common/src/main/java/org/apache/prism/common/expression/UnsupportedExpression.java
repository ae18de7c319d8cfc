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

import java.util.Iterator;
import java.util.List;

import org.apache.prism.common.expression.visitors.ExprVisitor;
import org.apache.prism.common.types.MajorType;
import org.apache.prism.common.types.MinorType;
import org.apache.prism.common.types.Types;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Opaque node for anything the pruning engine cannot reason about: subqueries,
 * volatile or unknown functions, arithmetic over columns.
 */
public class UnsupportedExpression extends LogicalExpressionBase {

  private final String description;
  private final ImmutableList<LogicalExpression> args;
  private final MajorType type;

  public UnsupportedExpression(String description, List<? extends LogicalExpression> args, MajorType type) {
    this.description = Preconditions.checkNotNull(description);
    this.args = ImmutableList.copyOf(args);
    this.type = Preconditions.checkNotNull(type);
  }

  public UnsupportedExpression(String description, LogicalExpression... args) {
    this(description, ImmutableList.copyOf(args), Types.optional(MinorType.BIT));
  }

  public String getDescription() {
    return description;
  }

  public List<LogicalExpression> getArgs() {
    return args;
  }

  @Override
  public MajorType getMajorType() {
    return type;
  }

  @Override
  public <T, V, E extends Exception> T accept(ExprVisitor<T, V, E> visitor, V value) throws E {
    return visitor.visitUnsupported(this, value);
  }

  @Override
  public Iterator<LogicalExpression> iterator() {
    return args.iterator();
  }
}
