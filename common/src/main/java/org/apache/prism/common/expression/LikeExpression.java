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
import com.google.common.collect.Iterators;

/**
 * {@code input [NOT] LIKE pattern [ESCAPE escape]}. {@code %} matches any sequence,
 * {@code _} any single character.
 */
public class LikeExpression extends LogicalExpressionBase {

  private final LogicalExpression input;
  private final String pattern;
  private final Character escape;
  private final boolean negated;

  public LikeExpression(LogicalExpression input, String pattern, Character escape, boolean negated) {
    this.input = Preconditions.checkNotNull(input);
    this.pattern = Preconditions.checkNotNull(pattern);
    this.escape = escape;
    this.negated = negated;
  }

  public LikeExpression(LogicalExpression input, String pattern) {
    this(input, pattern, null, false);
  }

  public LogicalExpression getInput() {
    return input;
  }

  public String getPattern() {
    return pattern;
  }

  /**
   * Escape character, or {@code null} when the pattern has none.
   */
  public Character getEscape() {
    return escape;
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
    return visitor.visitLike(this, value);
  }

  @Override
  public Iterator<LogicalExpression> iterator() {
    return Iterators.singletonIterator(input);
  }
}
