/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.expression;

import org.sqlexec.expression.ArithmeticExpression.Operator;
import org.sqlexec.planner.physical.page.Block.BlockType;
import org.sqlexec.planner.physical.page.Schema;

/** Static factory methods for building expressions. */
public final class DSL {

  private DSL() {}

  public static ReferenceExpression ref(String name, int index, BlockType type) {
    return new ReferenceExpression(name, index, type);
  }

  /** References the named field of the given schema. */
  public static ReferenceExpression ref(Schema schema, String name) {
    int index = schema.indexOf(name);
    if (index < 0) {
      throw new IllegalArgumentException("No field " + name + " in " + schema);
    }
    return new ReferenceExpression(name, index, schema.getType(index));
  }

  public static LiteralExpression literal(Object value) {
    return LiteralExpression.of(value);
  }

  public static NamedExpression named(String name, Expression expression) {
    return new NamedExpression(name, expression);
  }

  /** Names a column reference after the column itself. */
  public static NamedExpression named(ReferenceExpression reference) {
    return new NamedExpression(reference.getName(), reference);
  }

  public static ComparisonExpression equal(Expression left, Expression right) {
    return new ComparisonExpression(ComparisonExpression.Operator.EQUAL, left, right);
  }

  public static ComparisonExpression notEqual(Expression left, Expression right) {
    return new ComparisonExpression(ComparisonExpression.Operator.NOT_EQUAL, left, right);
  }

  public static ComparisonExpression less(Expression left, Expression right) {
    return new ComparisonExpression(ComparisonExpression.Operator.LESS, left, right);
  }

  public static ComparisonExpression lessOrEqual(Expression left, Expression right) {
    return new ComparisonExpression(ComparisonExpression.Operator.LESS_OR_EQUAL, left, right);
  }

  public static ComparisonExpression greater(Expression left, Expression right) {
    return new ComparisonExpression(ComparisonExpression.Operator.GREATER, left, right);
  }

  public static ComparisonExpression greaterOrEqual(Expression left, Expression right) {
    return new ComparisonExpression(ComparisonExpression.Operator.GREATER_OR_EQUAL, left, right);
  }

  public static LogicalExpression and(Expression left, Expression right) {
    return new LogicalExpression(LogicalExpression.Operator.AND, left, right);
  }

  public static LogicalExpression or(Expression left, Expression right) {
    return new LogicalExpression(LogicalExpression.Operator.OR, left, right);
  }

  public static NotExpression not(Expression child) {
    return new NotExpression(child);
  }

  public static IsNullExpression isNull(Expression child) {
    return new IsNullExpression(child, false);
  }

  public static IsNullExpression isNotNull(Expression child) {
    return new IsNullExpression(child, true);
  }

  public static ArithmeticExpression add(Expression left, Expression right) {
    return new ArithmeticExpression(Operator.ADD, left, right);
  }

  public static ArithmeticExpression subtract(Expression left, Expression right) {
    return new ArithmeticExpression(Operator.SUBTRACT, left, right);
  }

  public static ArithmeticExpression multiply(Expression left, Expression right) {
    return new ArithmeticExpression(Operator.MULTIPLY, left, right);
  }

  public static ArithmeticExpression divide(Expression left, Expression right) {
    return new ArithmeticExpression(Operator.DIVIDE, left, right);
  }
}
