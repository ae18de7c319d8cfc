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
 * {@code input IS [NOT] TRUE|FALSE}. Never evaluates to {@code NULL}.
 */
public class BooleanTestExpression extends LogicalExpressionBase {

  public enum Kind {
    IS_TRUE("IS TRUE"),
    IS_FALSE("IS FALSE"),
    IS_NOT_TRUE("IS NOT TRUE"),
    IS_NOT_FALSE("IS NOT FALSE");

    private final String sql;

    Kind(String sql) {
      this.sql = sql;
    }

    public String getSql() {
      return sql;
    }

    public Kind negate() {
      switch (this) {
        case IS_TRUE:
          return IS_NOT_TRUE;
        case IS_FALSE:
          return IS_NOT_FALSE;
        case IS_NOT_TRUE:
          return IS_TRUE;
        default:
          return IS_FALSE;
      }
    }
  }

  private final LogicalExpression input;
  private final Kind kind;

  public BooleanTestExpression(LogicalExpression input, Kind kind) {
    this.input = Preconditions.checkNotNull(input);
    this.kind = Preconditions.checkNotNull(kind);
  }

  public LogicalExpression getInput() {
    return input;
  }

  public Kind getKind() {
    return kind;
  }

  @Override
  public MajorType getMajorType() {
    return Types.required(MinorType.BIT);
  }

  @Override
  public <T, V, E extends Exception> T accept(ExprVisitor<T, V, E> visitor, V value) throws E {
    return visitor.visitBooleanTest(this, value);
  }

  @Override
  public Iterator<LogicalExpression> iterator() {
    return Iterators.singletonIterator(input);
  }
}
