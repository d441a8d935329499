/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.planner;

import java.util.List;
import org.sqlexec.exception.CompileException;
import org.sqlexec.expression.ArithmeticExpression;
import org.sqlexec.expression.ComparisonExpression;
import org.sqlexec.expression.Expression;
import org.sqlexec.expression.ExpressionNodeVisitor;
import org.sqlexec.expression.IsNullExpression;
import org.sqlexec.expression.LiteralExpression;
import org.sqlexec.expression.LogicalExpression;
import org.sqlexec.expression.NamedExpression;
import org.sqlexec.expression.NotExpression;
import org.sqlexec.expression.ReferenceExpression;
import org.sqlexec.expression.aggregation.AggregateCall;
import org.sqlexec.expression.window.WindowCall;
import org.sqlexec.expression.window.WindowFrame;
import org.sqlexec.expression.window.WindowFrameUnits;
import org.sqlexec.planner.physical.operator.SortKey;
import org.sqlexec.planner.physical.page.Block.BlockType;
import org.sqlexec.planner.physical.page.Schema;

/**
 * Checks expressions against the schema they are evaluated over and returns their result type.
 * Every violation raises {@link CompileException}.
 */
public class ExpressionTypeChecker extends ExpressionNodeVisitor<BlockType, Schema> {

  /** Checks {@code expression} over {@code schema} and returns its type. */
  public BlockType check(Expression expression, Schema schema) {
    return expression.accept(this, schema);
  }

  /** Checks a filter predicate. */
  public void checkPredicate(Expression predicate, Schema schema) {
    BlockType type = check(predicate, schema);
    if (type != BlockType.BOOLEAN && type != BlockType.NULL) {
      throw new CompileException(
          String.format("Predicate %s must be BOOLEAN but is %s", predicate, type));
    }
  }

  /** Checks the argument and return type of an aggregate call. */
  public void checkAggregate(AggregateCall call, Schema schema) {
    if (!call.getFunction().isDecomposable()) {
      throw new CompileException(
          String.format(
              "Aggregate function %s cannot be split into partial and final phases",
              call.getFunction()));
    }
    if (call.getArgument() != null) {
      check(call.getArgument(), schema);
    }
    if (call.getReturnType() == null) {
      throw new CompileException(
          String.format(
              "Aggregate function %s does not accept %s input", call.getFunction(),
              call.getInputType()));
    }
  }

  /**
   * Checks the argument, return type and frame of a window function. RANGE offsets need exactly
   * one numeric ORDER BY column; GROUPS frames need an ORDER BY.
   */
  public void checkWindow(WindowCall call, List<SortKey> orderBy, Schema schema) {
    if (call.getArgument() != null) {
      check(call.getArgument(), schema);
    }
    if (call.getReturnType() == null) {
      throw new CompileException(
          String.format(
              "Window function %s does not accept %s input", call.getFunction(),
              call.getInputType()));
    }
    if (call.getFunction().isRanking()) {
      return;
    }
    WindowFrame frame = call.getFrame();
    if (frame.getUnits() == WindowFrameUnits.RANGE && !frame.isFreeRange()) {
      if (orderBy.size() != 1) {
        throw new CompileException(
            String.format("RANGE frame %s requires exactly one ORDER BY column", frame));
      }
      BlockType orderType = schema.getType(orderBy.get(0).fieldIndex());
      if (!orderType.isNumeric()) {
        throw new CompileException(
            String.format(
                "RANGE frame %s needs a numeric ORDER BY column, got %s", frame, orderType));
      }
    }
    if (frame.getUnits() == WindowFrameUnits.GROUPS && orderBy.isEmpty()) {
      throw new CompileException(
          String.format("GROUPS frame %s requires an ORDER BY clause", frame));
    }
  }

  /** Checks that both key lists have the same length and pairwise joinable types. */
  public void checkJoinKeys(
      List<Expression> leftKeys, Schema left, List<Expression> rightKeys, Schema right) {
    if (leftKeys.isEmpty() || leftKeys.size() != rightKeys.size()) {
      throw new CompileException(
          String.format(
              "Join needs the same positive number of keys on both sides: %s vs %s",
              leftKeys, rightKeys));
    }
    for (int i = 0; i < leftKeys.size(); i++) {
      BlockType leftType = check(leftKeys.get(i), left);
      BlockType rightType = check(rightKeys.get(i), right);
      if (leftType != BlockType.NULL
          && rightType != BlockType.NULL
          && leftType.widen() != rightType.widen()) {
        throw new CompileException(
            String.format(
                "Join key types do not match: %s (%s) and %s (%s)",
                leftKeys.get(i), leftType, rightKeys.get(i), rightType));
      }
    }
  }

  @Override
  public BlockType visitNode(Expression node, Schema schema) {
    throw new CompileException("Unsupported expression: " + node);
  }

  @Override
  public BlockType visitReference(ReferenceExpression node, Schema schema) {
    int index = node.getIndex();
    if (index < 0 || index >= schema.size()) {
      throw new CompileException(
          String.format("Column %s is out of range for input %s", node, schema));
    }
    if (schema.getType(index) != node.getType()) {
      throw new CompileException(
          String.format(
              "Column %s has type %s but the input column is %s",
              node, node.getType(), schema.getType(index)));
    }
    return node.getType();
  }

  @Override
  public BlockType visitLiteral(LiteralExpression node, Schema schema) {
    return node.getType();
  }

  @Override
  public BlockType visitComparison(ComparisonExpression node, Schema schema) {
    BlockType left = check(node.getLeft(), schema);
    BlockType right = check(node.getRight(), schema);
    if (!comparable(left, right)) {
      throw new CompileException(
          String.format("Cannot compare %s (%s) with %s (%s)", node.getLeft(), left,
              node.getRight(), right));
    }
    return BlockType.BOOLEAN;
  }

  private static boolean comparable(BlockType left, BlockType right) {
    if (left == BlockType.NULL || right == BlockType.NULL) {
      return true;
    }
    if (left.isNumeric() && right.isNumeric()) {
      return true;
    }
    return left == right && left != BlockType.UNKNOWN;
  }

  @Override
  public BlockType visitLogical(LogicalExpression node, Schema schema) {
    requireBoolean(node.getLeft(), schema);
    requireBoolean(node.getRight(), schema);
    return BlockType.BOOLEAN;
  }

  @Override
  public BlockType visitNot(NotExpression node, Schema schema) {
    requireBoolean(node.getChild(), schema);
    return BlockType.BOOLEAN;
  }

  @Override
  public BlockType visitIsNull(IsNullExpression node, Schema schema) {
    check(node.getChild(), schema);
    return BlockType.BOOLEAN;
  }

  @Override
  public BlockType visitArithmetic(ArithmeticExpression node, Schema schema) {
    BlockType left = check(node.getLeft(), schema);
    BlockType right = check(node.getRight(), schema);
    BlockType result = ArithmeticExpression.resultType(left, right);
    if (result == null) {
      throw new CompileException(
          String.format("Arithmetic %s needs numeric operands, got %s and %s", node, left, right));
    }
    return result;
  }

  @Override
  public BlockType visitNamed(NamedExpression node, Schema schema) {
    return check(node.getDelegated(), schema);
  }

  private void requireBoolean(Expression expression, Schema schema) {
    BlockType type = check(expression, schema);
    if (type != BlockType.BOOLEAN && type != BlockType.NULL) {
      throw new CompileException(
          String.format("Operand %s must be BOOLEAN but is %s", expression, type));
    }
  }
}
