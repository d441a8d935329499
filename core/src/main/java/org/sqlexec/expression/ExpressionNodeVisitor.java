/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.expression;

/**
 * Abstract visitor for the expression tree. Every visit method falls back to {@link
 * #visitNode(Expression, Object)}.
 *
 * @param <T> return type
 * @param <C> context type
 */
public abstract class ExpressionNodeVisitor<T, C> {

  public T visitNode(Expression node, C context) {
    return null;
  }

  public T visitReference(ReferenceExpression node, C context) {
    return visitNode(node, context);
  }

  public T visitLiteral(LiteralExpression node, C context) {
    return visitNode(node, context);
  }

  public T visitComparison(ComparisonExpression node, C context) {
    return visitNode(node, context);
  }

  public T visitLogical(LogicalExpression node, C context) {
    return visitNode(node, context);
  }

  public T visitNot(NotExpression node, C context) {
    return visitNode(node, context);
  }

  public T visitIsNull(IsNullExpression node, C context) {
    return visitNode(node, context);
  }

  public T visitArithmetic(ArithmeticExpression node, C context) {
    return visitNode(node, context);
  }

  public T visitNamed(NamedExpression node, C context) {
    return visitNode(node, context);
  }
}
