/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.logical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.sqlexec.expression.NamedExpression;
import org.sqlexec.planner.physical.page.Schema;

/** Project field specified by the {@link LogicalProject#projectList}. */
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalProject extends LogicalPlan {

  @Getter private final List<NamedExpression> projectList;

  public LogicalProject(LogicalPlan child, List<NamedExpression> projectList) {
    super(ImmutableList.of(child), schemaOf(projectList));
    this.projectList = ImmutableList.copyOf(projectList);
  }

  private static Schema schemaOf(List<NamedExpression> projectList) {
    return new Schema(
        projectList.stream()
            .map(expr -> Schema.Field.of(expr.getName(), expr.type()))
            .collect(Collectors.toList()));
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitProject(this, context);
  }
}
