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
 * {@code input [NOT] IN (v1, ..., vn)}.
 */
public class InListExpression extends LogicalExpressionBase {

  private final LogicalExpression input;
  private final ImmutableList<LogicalExpression> values;
  private final boolean negated;

  public InListExpression(LogicalExpression input, List<? extends LogicalExpression> values, boolean negated) {
    Preconditions.checkArgument(!values.isEmpty(), "IN list must not be empty");
    this.input = Preconditions.checkNotNull(input);
    this.values = ImmutableList.copyOf(values);
    this.negated = negated;
  }

  public LogicalExpression getInput() {
    return input;
  }

  public List<LogicalExpression> getValues() {
    return values;
  }

  public boolean isNegated() {
    return negated;
  }

  @Override
  public MajorType getMajorType() {
    return Types.optional(MinorType.BIT);
  }

  @Override
  public <T, V, E extends Exception> T accept(ExprVisitor<T, V, E> visitor, V value) throws E {
    return visitor.visitInList(this, value);
  }

  @Override
  public Iterator<LogicalExpression> iterator() {
    return ImmutableList.<LogicalExpression>builder().add(input).addAll(values).build().iterator();
  }
}
