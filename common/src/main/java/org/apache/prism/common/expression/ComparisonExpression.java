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

import org.apache.prism.common.expression.visitors.ExprVisitor;
import org.apache.prism.common.types.MajorType;
import org.apache.prism.common.types.MinorType;
import org.apache.prism.common.types.Types;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

public class ComparisonExpression extends LogicalExpressionBase {

  private final ComparisonOperator operator;
  private final LogicalExpression left;
  private final LogicalExpression right;

  public ComparisonExpression(ComparisonOperator operator, LogicalExpression left, LogicalExpression right) {
    this.operator = Preconditions.checkNotNull(operator);
    this.left = Preconditions.checkNotNull(left);
    this.right = Preconditions.checkNotNull(right);
  }

  public ComparisonOperator getOperator() {
    return operator;
  }

  public LogicalExpression getLeft() {
    return left;
  }

  public LogicalExpression getRight() {
    return right;
  }

  @Override
  public MajorType getMajorType() {
    return Types.optional(MinorType.BIT);
  }

  @Override
  public <T, V, E extends Exception> T accept(ExprVisitor<T, V, E> visitor, V value) throws E {
    return visitor.visitComparison(this, value);
  }

  @Override
  public Iterator<LogicalExpression> iterator() {
    return ImmutableList.of(left, right).iterator();
  }
}
