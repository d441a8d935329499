/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.expression.aggregation;

import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.sqlexec.expression.Expression;
import org.sqlexec.planner.physical.page.Block.BlockType;
import org.sqlexec.planner.physical.page.Schema.Field;

/** One aggregate in an aggregation: function, argument (null for COUNT(*)) and output name. */
@Getter
@EqualsAndHashCode
public class AggregateCall {

  private final AggregateFunction function;

  private final Expression argument;

  private final String name;

  public AggregateCall(AggregateFunction function, Expression argument, String name) {
    if (argument == null && function != AggregateFunction.COUNT) {
      throw new IllegalArgumentException(function + " requires an argument");
    }
    this.function = function;
    this.argument = argument;
    this.name = name;
  }

  public static AggregateCall of(AggregateFunction function, Expression argument, String name) {
    return new AggregateCall(function, argument, name);
  }

  /** COUNT(*). */
  public static AggregateCall countAll(String name) {
    return new AggregateCall(AggregateFunction.COUNT, null, name);
  }

  /** Returns the argument type, NULL for COUNT(*). */
  public BlockType getInputType() {
    return argument == null ? BlockType.NULL : argument.type();
  }

  public BlockType getReturnType() {
    return function.returnType(getInputType());
  }

  public Field getOutputField() {
    return Field.of(name, getReturnType());
  }

  /** Returns the intermediate state columns emitted by the partial phase. */
  public List<Field> getStateFields() {
    List<String> stateNames = function.getStateNames();
    List<BlockType> stateTypes = function.stateTypes(getInputType());
    List<Field> fields = new ArrayList<>(stateNames.size());
    for (int i = 0; i < stateNames.size(); i++) {
      fields.add(Field.of(name + "[" + stateNames.get(i) + "]", stateTypes.get(i)));
    }
    return fields;
  }

  public Accumulator createAccumulator() {
    return function.createAccumulator(getInputType());
  }

  @Override
  public String toString() {
    return function + "(" + (argument == null ? "*" : argument.toString()) + ") AS " + name;
  }
}
