/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.expression.window;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.sqlexec.expression.Expression;
import org.sqlexec.expression.aggregation.Accumulator;
import org.sqlexec.planner.physical.page.Block.BlockType;
import org.sqlexec.planner.physical.page.Schema.Field;

/**
 * One window function of a window node: function, argument (null for ranking functions and
 * COUNT(*)), frame and output name.
 */
@Getter
@EqualsAndHashCode
public class WindowCall {

  private final WindowFunction function;

  private final Expression argument;

  private final WindowFrame frame;

  private final String name;

  public WindowCall(
      WindowFunction function, Expression argument, WindowFrame frame, String name) {
    if (function.isRanking() && argument != null) {
      throw new IllegalArgumentException(function + " takes no argument");
    }
    if (!function.isRanking() && argument == null && function != WindowFunction.COUNT) {
      throw new IllegalArgumentException(function + " requires an argument");
    }
    this.function = function;
    this.argument = argument;
    this.frame = frame == null ? WindowFrame.DEFAULT : frame;
    this.name = name;
  }

  /** An aggregate over the default frame. */
  public static WindowCall of(WindowFunction function, Expression argument, String name) {
    return new WindowCall(function, argument, null, name);
  }

  /** An aggregate over {@code frame}. */
  public static WindowCall of(
      WindowFunction function, Expression argument, WindowFrame frame, String name) {
    return new WindowCall(function, argument, frame, name);
  }

  /** ROW_NUMBER, RANK or DENSE_RANK. */
  public static WindowCall ranking(WindowFunction function, String name) {
    return new WindowCall(function, null, null, name);
  }

  public BlockType getInputType() {
    return argument == null ? BlockType.NULL : argument.type();
  }

  public BlockType getReturnType() {
    return function.returnType(getInputType());
  }

  public Field getOutputField() {
    return Field.of(name, getReturnType());
  }

  public Accumulator createAccumulator() {
    return function.getAggregate().createAccumulator(getInputType());
  }

  @Override
  public String toString() {
    if (function.isRanking()) {
      return function + "() AS " + name;
    }
    return function
        + "("
        + (argument == null ? "*" : argument.toString())
        + ") "
        + frame
        + " AS "
        + name;
  }
}
