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

import java.util.List;

import org.apache.prism.common.expression.ValueExpressions.Literal;
import org.apache.prism.common.expression.visitors.ExprVisitor;
import org.apache.prism.common.types.MajorType;
import org.apache.prism.common.types.MinorType;

import com.google.common.io.BaseEncoding;

/**
 * Renders a predicate in SQL-like text for logging and plan explain.
 */
public class ExpressionStringBuilder implements ExprVisitor<Void, StringBuilder, RuntimeException> {

  private static final ExpressionStringBuilder INSTANCE = new ExpressionStringBuilder();

  public static String toString(LogicalExpression expr) {
    StringBuilder sb = new StringBuilder();
    expr.accept(INSTANCE, sb);
    return sb.toString();
  }

  @Override
  public Void visitSchemaPath(SchemaPath path, StringBuilder sb) {
    sb.append(path.getPath());
    return null;
  }

  @Override
  public Void visitLiteral(Literal literal, StringBuilder sb) {
    Object value = literal.getValue();
    MinorType type = literal.getMajorType().getMinorType();
    if (value == null) {
      sb.append("NULL");
    } else if (type == MinorType.VARCHAR) {
      sb.append('\'').append(((String) value).replace("'", "''")).append('\'');
    } else if (type == MinorType.VARBINARY) {
      sb.append("X'").append(BaseEncoding.base16().encode((byte[]) value)).append('\'');
    } else if (type.isTemporal()) {
      sb.append(type).append(" '").append(value).append('\'');
    } else {
      sb.append(value);
    }
    return null;
  }

  @Override
  public Void visitComparison(ComparisonExpression comparison, StringBuilder sb) {
    comparison.getLeft().accept(this, sb);
    sb.append(' ').append(comparison.getOperator().getSymbol()).append(' ');
    comparison.getRight().accept(this, sb);
    return null;
  }

  @Override
  public Void visitBooleanOperator(BooleanOperator op, StringBuilder sb) {
    sb.append('(');
    List<LogicalExpression> args = op.getArgs();
    for (int i = 0; i < args.size(); i++) {
      if (i != 0) {
        sb.append(' ').append(op.getKind()).append(' ');
      }
      args.get(i).accept(this, sb);
    }
    sb.append(')');
    return null;
  }

  @Override
  public Void visitNot(NotExpression not, StringBuilder sb) {
    sb.append("NOT (");
    not.getInput().accept(this, sb);
    sb.append(')');
    return null;
  }

  @Override
  public Void visitIsNull(IsNullExpression isNull, StringBuilder sb) {
    isNull.getInput().accept(this, sb);
    sb.append(isNull.isNegated() ? " IS NOT NULL" : " IS NULL");
    return null;
  }

  @Override
  public Void visitBooleanTest(BooleanTestExpression test, StringBuilder sb) {
    test.getInput().accept(this, sb);
    sb.append(' ').append(test.getKind().getSql());
    return null;
  }

  @Override
  public Void visitInList(InListExpression in, StringBuilder sb) {
    in.getInput().accept(this, sb);
    sb.append(in.isNegated() ? " NOT IN (" : " IN (");
    List<LogicalExpression> values = in.getValues();
    for (int i = 0; i < values.size(); i++) {
      if (i != 0) {
        sb.append(", ");
      }
      values.get(i).accept(this, sb);
    }
    sb.append(')');
    return null;
  }

  @Override
  public Void visitCast(CastExpression cast, StringBuilder sb) {
    MajorType type = cast.getMajorType();
    sb.append("CAST(");
    cast.getInput().accept(this, sb);
    sb.append(" AS ").append(type.getMinorType());
    if (type.getMinorType() == MinorType.VARDECIMAL) {
      sb.append('(').append(type.getPrecision()).append(", ").append(type.getScale()).append(')');
    }
    sb.append(')');
    return null;
  }

  @Override
  public Void visitLike(LikeExpression like, StringBuilder sb) {
    like.getInput().accept(this, sb);
    sb.append(like.isNegated() ? " NOT LIKE '" : " LIKE '").append(like.getPattern().replace("'", "''")).append('\'');
    if (like.getEscape() != null) {
      sb.append(" ESCAPE '").append(like.getEscape()).append('\'');
    }
    return null;
  }

  @Override
  public Void visitUnsupported(UnsupportedExpression unsupported, StringBuilder sb) {
    sb.append(unsupported.getDescription()).append('(');
    List<LogicalExpression> args = unsupported.getArgs();
    for (int i = 0; i < args.size(); i++) {
      if (i != 0) {
        sb.append(", ");
      }
      args.get(i).accept(this, sb);
    }
    sb.append(')');
    return null;
  }
}
