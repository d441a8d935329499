/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.logical;

/**
 * The visitor of {@link LogicalPlan}.
 *
 * @param <R> return type
 * @param <C> context type
 */
public abstract class LogicalPlanNodeVisitor<R, C> {

  public R visitNode(LogicalPlan plan, C context) {
    return null;
  }

  public R visitScan(LogicalScan plan, C context) {
    return visitNode(plan, context);
  }

  public R visitFilter(LogicalFilter plan, C context) {
    return visitNode(plan, context);
  }

  public R visitProject(LogicalProject plan, C context) {
    return visitNode(plan, context);
  }

  public R visitAggregation(LogicalAggregation plan, C context) {
    return visitNode(plan, context);
  }

  public R visitJoin(LogicalJoin plan, C context) {
    return visitNode(plan, context);
  }

  public R visitSort(LogicalSort plan, C context) {
    return visitNode(plan, context);
  }

  public R visitLimit(LogicalLimit plan, C context) {
    return visitNode(plan, context);
  }

  public R visitUnion(LogicalUnion plan, C context) {
    return visitNode(plan, context);
  }

  public R visitWindow(LogicalWindow plan, C context) {
    return visitNode(plan, context);
  }
}
