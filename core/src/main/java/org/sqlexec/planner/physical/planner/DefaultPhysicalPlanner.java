/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.planner;

import com.google.common.math.LongMath;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.sqlexec.config.ExecutionConfig;
import org.sqlexec.config.SessionContext;
import org.sqlexec.exception.CompileException;
import org.sqlexec.expression.NamedExpression;
import org.sqlexec.expression.ReferenceExpression;
import org.sqlexec.expression.aggregation.AggregateCall;
import org.sqlexec.expression.window.WindowCall;
import org.sqlexec.planner.logical.LogicalAggregation;
import org.sqlexec.planner.logical.LogicalFilter;
import org.sqlexec.planner.logical.LogicalJoin;
import org.sqlexec.planner.logical.LogicalLimit;
import org.sqlexec.planner.logical.LogicalPlan;
import org.sqlexec.planner.logical.LogicalPlanNodeVisitor;
import org.sqlexec.planner.logical.LogicalProject;
import org.sqlexec.planner.logical.LogicalScan;
import org.sqlexec.planner.logical.LogicalSort;
import org.sqlexec.planner.logical.LogicalUnion;
import org.sqlexec.planner.logical.LogicalWindow;
import org.sqlexec.planner.physical.join.JoinMode;
import org.sqlexec.planner.physical.operator.AggregationMode;
import org.sqlexec.planner.physical.operator.SortKey;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.planner.physical.partitioning.Distribution;
import org.sqlexec.planner.physical.partitioning.Partitioning;
import org.sqlexec.planner.physical.plan.AggregateExec;
import org.sqlexec.planner.physical.plan.ExecutionPlan;
import org.sqlexec.planner.physical.plan.FilterExec;
import org.sqlexec.planner.physical.plan.GlobalLimitExec;
import org.sqlexec.planner.physical.plan.HashJoinExec;
import org.sqlexec.planner.physical.plan.LocalLimitExec;
import org.sqlexec.planner.physical.plan.PlanFormatter;
import org.sqlexec.planner.physical.plan.ProjectionExec;
import org.sqlexec.planner.physical.plan.RepartitionExec;
import org.sqlexec.planner.physical.plan.ScanExec;
import org.sqlexec.planner.physical.plan.SortExec;
import org.sqlexec.planner.physical.plan.SortPreservingMergeExec;
import org.sqlexec.planner.physical.plan.UnionExec;
import org.sqlexec.planner.physical.plan.WindowAggExec;
import org.sqlexec.storage.Split;
import org.sqlexec.storage.Table;

/**
 * Compiles a {@link LogicalPlan} bottom-up into an {@link ExecutionPlan}.
 *
 * <p>Each logical node becomes one or more physical nodes whose required input distributions are
 * then met by the {@link DistributionEnforcer}. Aggregations are split into a partial and a final
 * phase, joins pick CollectLeft or Partitioned from the estimated size of the build side, sorts
 * run per partition and are merged, limits run per partition before a global limit. Window
 * functions run over input hash partitioned on the window partition keys and sorted per
 * partition. Every expression is type checked on the way.
 */
@Log4j2
public class DefaultPhysicalPlanner extends LogicalPlanNodeVisitor<ExecutionPlan, Void>
    implements PhysicalPlanner {

  private final SessionContext session;
  private final ExecutionConfig config;
  private final CostEstimator costEstimator;
  private final DistributionEnforcer enforcer;
  private final ExpressionTypeChecker typeChecker = new ExpressionTypeChecker();

  public DefaultPhysicalPlanner(SessionContext session) {
    this(session, new DefaultCostEstimator(session.getStorageEngine(), session.getConfig()));
  }

  public DefaultPhysicalPlanner(SessionContext session, CostEstimator costEstimator) {
    this.session = session;
    this.config = session.getConfig();
    this.costEstimator = costEstimator;
    this.enforcer = new DistributionEnforcer(config);
  }

  @Override
  public ExecutionPlan plan(LogicalPlan plan) {
    ExecutionPlan physical = compile(plan);
    if (!physical.getSchema().isTypeCompatible(plan.getSchema())) {
      throw new CompileException(
          String.format(
              "Compiled schema %s does not match logical schema %s",
              physical.getSchema(), plan.getSchema()));
    }
    log.info(
        "Compiled plan into {} output partitions with target {}",
        physical.getOutputPartitioning().getPartitionCount(),
        config.getTargetPartitions());
    if (log.isDebugEnabled()) {
      log.debug("Physical plan:\n{}", PlanFormatter.format(physical));
    }
    return physical;
  }

  private ExecutionPlan compile(LogicalPlan plan) {
    return plan.accept(this, null);
  }

  private int target() {
    return config.getTargetPartitions();
  }

  @Override
  public ExecutionPlan visitNode(LogicalPlan plan, Void context) {
    throw new CompileException("Unsupported logical plan node: " + plan.getClass().getSimpleName());
  }

  @Override
  public ExecutionPlan visitScan(LogicalScan plan, Void context) {
    Table table = session.getStorageEngine().getTable(plan.getTableName());
    Schema tableSchema = table.getSchema();
    List<String> columns = plan.getColumns();
    int[] projection = new int[columns.size()];
    for (int i = 0; i < columns.size(); i++) {
      int index = tableSchema.indexOf(columns.get(i));
      if (index < 0) {
        throw new CompileException(
            String.format("Table %s has no column %s", table.getName(), columns.get(i)));
      }
      if (tableSchema.getType(index) != plan.getSchema().getType(i)) {
        throw new CompileException(
            String.format(
                "Column %s of table %s is %s, not %s",
                columns.get(i),
                table.getName(),
                tableSchema.getType(index),
                plan.getSchema().getType(i)));
      }
      projection[i] = index;
    }
    List<Split> splits = table.getSplits();
    ExecutionPlan scan =
        new ScanExec(table, projection, plan.getSchema(), ScanExec.groupSplits(splits, target()));
    int partitions = scan.getOutputPartitioning().getPartitionCount();
    if (config.isRepartitionScans() && target() > 1 && partitions < target()) {
      return new RepartitionExec(scan, Partitioning.roundRobin(target()));
    }
    return scan;
  }

  @Override
  public ExecutionPlan visitFilter(LogicalFilter plan, Void context) {
    ExecutionPlan input = compile(plan.getChild().get(0));
    typeChecker.checkPredicate(plan.getCondition(), input.getSchema());
    return enforcer.coalesceBatches(new FilterExec(input, plan.getCondition()));
  }

  @Override
  public ExecutionPlan visitProject(LogicalProject plan, Void context) {
    ExecutionPlan input = compile(plan.getChild().get(0));
    for (NamedExpression expression : plan.getProjectList()) {
      typeChecker.check(expression, input.getSchema());
    }
    return new ProjectionExec(input, plan.getProjectList(), plan.getSchema());
  }

  @Override
  public ExecutionPlan visitAggregation(LogicalAggregation plan, Void context) {
    ExecutionPlan input = compile(plan.getChild().get(0));
    List<NamedExpression> groupBy = plan.getGroupByList();
    List<AggregateCall> aggregates = plan.getAggregatorList();
    for (NamedExpression group : groupBy) {
      typeChecker.check(group, input.getSchema());
    }
    for (AggregateCall aggregate : aggregates) {
      typeChecker.checkAggregate(aggregate, input.getSchema());
    }

    Schema partialSchema = AggregateExec.partialSchema(groupBy, aggregates);
    ExecutionPlan partial =
        new AggregateExec(AggregationMode.PARTIAL, input, groupBy, aggregates, partialSchema);

    List<NamedExpression> finalGroupBy = new ArrayList<>(groupBy.size());
    for (ReferenceExpression column : AggregateExec.leadingColumns(partialSchema, groupBy.size())) {
      finalGroupBy.add(new NamedExpression(column.getName(), column));
    }
    AggregationMode finalMode =
        !groupBy.isEmpty() && target() > 1
            ? AggregationMode.FINAL_PARTITIONED
            : AggregationMode.FINAL;
    return enforcer.enforce(
        new AggregateExec(finalMode, partial, finalGroupBy, aggregates, plan.getSchema()));
  }

  @Override
  public ExecutionPlan visitJoin(LogicalJoin plan, Void context) {
    ExecutionPlan left = compile(plan.getLeft());
    ExecutionPlan right = compile(plan.getRight());
    typeChecker.checkJoinKeys(
        plan.getLeftKeys(), left.getSchema(), plan.getRightKeys(), right.getSchema());

    JoinMode mode = chooseJoinMode(plan, right);
    ExecutionPlan join =
        new HashJoinExec(
            left, right, plan.getJoinType(), mode, plan.getLeftKeys(), plan.getRightKeys());
    return enforcer.coalesceBatches(enforcer.enforce(join));
  }

  private JoinMode chooseJoinMode(LogicalJoin plan, ExecutionPlan right) {
    boolean singleProbe = right.getOutputPartitioning().getPartitionCount() == 1;
    if (plan.getJoinType().tracksBuildMatches() && !singleProbe) {
      return JoinMode.PARTITIONED;
    }
    if (target() == 1) {
      return JoinMode.COLLECT_LEFT;
    }
    long rows = costEstimator.estimateRows(plan.getLeft());
    long bytes = costEstimator.estimateBytes(plan.getLeft());
    boolean small =
        rows <= config.getHashJoinSinglePartitionThresholdRows()
            && bytes <= config.getHashJoinSinglePartitionThresholdBytes();
    log.debug("Join build side estimate: {} rows, {} bytes", rows, bytes);
    return small ? JoinMode.COLLECT_LEFT : JoinMode.PARTITIONED;
  }

  @Override
  public ExecutionPlan visitSort(LogicalSort plan, Void context) {
    ExecutionPlan input = compile(plan.getChild().get(0));
    List<SortKey> sortKeys = plan.getSortList();
    for (SortKey key : sortKeys) {
      checkSortKey(key, input.getSchema());
    }
    if (input.getOutputPartitioning().getPartitionCount() == 1) {
      return new SortExec(input, sortKeys, null, false);
    }
    return new SortPreservingMergeExec(new SortExec(input, sortKeys, null, true), sortKeys, null);
  }

  private void checkSortKey(SortKey key, Schema schema) {
    if (key.fieldIndex() < 0
        || key.fieldIndex() >= schema.size()
        || !schema.getField(key.fieldIndex()).getName().equals(key.fieldName())) {
      throw new CompileException(
          String.format("Sort key %s does not match input %s", key, schema));
    }
  }

  @Override
  public ExecutionPlan visitLimit(LogicalLimit plan, Void context) {
    ExecutionPlan input = compile(plan.getChild().get(0));
    if (plan.getOffset() < 0 || (plan.getLimit() != null && plan.getLimit() < 0)) {
      throw new CompileException(
          String.format(
              "Limit and offset must not be negative: limit=%s, offset=%d",
              plan.getLimit(), plan.getOffset()));
    }
    if (plan.getLimit() != null && input.getOutputPartitioning().getPartitionCount() > 1) {
      input =
          new LocalLimitExec(input, LongMath.saturatedAdd(plan.getOffset(), plan.getLimit()));
    }
    return enforcer.enforce(new GlobalLimitExec(input, plan.getOffset(), plan.getLimit()));
  }

  @Override
  public ExecutionPlan visitUnion(LogicalUnion plan, Void context) {
    List<ExecutionPlan> inputs = new ArrayList<>();
    for (LogicalPlan child : plan.getChild()) {
      ExecutionPlan input = compile(child);
      if (!input.getSchema().isTypeCompatible(plan.getSchema())) {
        throw new CompileException(
            String.format(
                "Union input schema %s is not compatible with %s",
                input.getSchema(), plan.getSchema()));
      }
      inputs.add(input);
    }
    return new UnionExec(inputs);
  }

  @Override
  public ExecutionPlan visitWindow(LogicalWindow plan, Void context) {
    ExecutionPlan input = compile(plan.getChild().get(0));
    Schema schema = input.getSchema();
    List<ReferenceExpression> partitionKeys = plan.getPartitionByList();
    for (ReferenceExpression key : partitionKeys) {
      typeChecker.check(key, schema);
    }
    for (SortKey key : plan.getSortList()) {
      checkSortKey(key, schema);
    }
    for (WindowCall window : plan.getWindowList()) {
      typeChecker.checkWindow(window, plan.getSortList(), schema);
    }

    Distribution required =
        partitionKeys.isEmpty() || target() == 1
            ? Distribution.singlePartition()
            : Distribution.hash(partitionKeys);
    ExecutionPlan distributed = enforcer.distribute(input, required);
    List<SortKey> ordering = WindowAggExec.inputOrdering(partitionKeys, plan.getSortList());
    ExecutionPlan sorted = distributed;
    if (!ordering.isEmpty() && !ordering.equals(distributed.getOutputOrdering())) {
      boolean partitioned = distributed.getOutputPartitioning().getPartitionCount() > 1;
      sorted = new SortExec(distributed, ordering, null, partitioned);
    }
    return enforcer.enforce(
        new WindowAggExec(
            sorted, partitionKeys, plan.getSortList(), plan.getWindowList(), plan.getSchema()));
  }
}
