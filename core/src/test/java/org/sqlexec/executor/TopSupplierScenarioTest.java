/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.sqlexec.expression.DSL.and;
import static org.sqlexec.expression.DSL.greaterOrEqual;
import static org.sqlexec.expression.DSL.less;
import static org.sqlexec.expression.DSL.literal;
import static org.sqlexec.expression.DSL.multiply;
import static org.sqlexec.expression.DSL.named;
import static org.sqlexec.expression.DSL.ref;
import static org.sqlexec.expression.DSL.subtract;
import static org.sqlexec.planner.logical.LogicalPlanDSL.aggregation;
import static org.sqlexec.planner.logical.LogicalPlanDSL.filter;
import static org.sqlexec.planner.logical.LogicalPlanDSL.join;
import static org.sqlexec.planner.logical.LogicalPlanDSL.project;
import static org.sqlexec.planner.logical.LogicalPlanDSL.scan;
import static org.sqlexec.planner.logical.LogicalPlanDSL.sort;
import static org.sqlexec.util.TestData.config;
import static org.sqlexec.util.TestData.row;
import static org.sqlexec.util.TestData.table;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.sqlexec.config.SessionContext;
import org.sqlexec.expression.aggregation.AggregateCall;
import org.sqlexec.expression.aggregation.AggregateFunction;
import org.sqlexec.planner.logical.LogicalPlan;
import org.sqlexec.planner.physical.join.JoinType;
import org.sqlexec.planner.physical.operator.SortKey;
import org.sqlexec.planner.physical.page.Block.BlockType;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.planner.physical.page.Schema.Field;
import org.sqlexec.storage.memory.InMemoryStorageEngine;
import org.sqlexec.storage.memory.InMemoryTable;

/**
 * Suppliers with the highest revenue in the first quarter of 1996: lineitem revenue per supplier,
 * joined to the supplier table and restricted to the maximum revenue.
 */
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class TopSupplierScenarioTest {

  private static final Schema LINEITEM =
      Schema.of(
          Field.of("l_suppkey", BlockType.LONG),
          Field.of("l_extendedprice", BlockType.DECIMAL),
          Field.of("l_discount", BlockType.DECIMAL),
          Field.of("l_shipdate", BlockType.DATE));

  private static final Schema SUPPLIER =
      Schema.of(
          Field.of("s_suppkey", BlockType.LONG),
          Field.of("s_name", BlockType.STRING),
          Field.of("s_address", BlockType.STRING),
          Field.of("s_phone", BlockType.STRING));

  private final InMemoryTable lineitem =
      table(
          "lineitem",
          LINEITEM,
          2,
          row(1L, decimal("100.00"), decimal("0.10"), date("1996-01-15")),
          row(2L, decimal("200.00"), decimal("0.00"), date("1996-02-01")),
          row(1L, decimal("50.00"), decimal("0.00"), date("1996-03-31")),
          row(3L, decimal("150.00"), decimal("0.00"), date("1996-01-01")),
          row(3L, decimal("50.00"), decimal("0.00"), date("1996-03-01")),
          row(4L, decimal("500.00"), decimal("0.00"), date("1996-04-01")),
          row(4L, decimal("10.00"), decimal("0.00"), date("1995-12-31")),
          row(2L, decimal("999.00"), decimal("0.50"), date("1997-01-01")));

  private final InMemoryTable supplier =
      table(
              "supplier",
              SUPPLIER,
              2,
              row(1L, "Supplier#1", "1 Main St", "11-111"),
              row(2L, "Supplier#2", "2 Main St", "22-222"),
              row(3L, "Supplier#3", "3 Main St", "33-333"),
              row(4L, "Supplier#4", "4 Main St", "44-444"))
          .withEstimatedRowCount(1_000_000L);

  private final ExecutionDriver driver =
      new ExecutionDriver(
          new SessionContext(
              config(2), new InMemoryStorageEngine().register(lineitem).register(supplier)));

  @Test
  void should_compile_into_two_aggregate_pipelines_and_two_join_modes() {
    String revenue =
        "SUM((l_extendedprice@1 * (1 - l_discount@2))) AS total_revenue]";
    String max = "aggr=[MAX(total_revenue@1) AS max_revenue]";
    String filter =
        "FilterExec: predicate=(l_shipdate@3 >= DATE '1996-01-01'"
            + " AND l_shipdate@3 < DATE '1996-04-01')";
    String lineitemScan =
        "ScanExec: table=lineitem, partitions=2,"
            + " projection=[l_suppkey, l_extendedprice, l_discount, l_shipdate]";

    assertEquals(
        String.join(
            "\n",
            "SortPreservingMergeExec: [s_suppkey@0 ASC NULLS LAST]",
            "  SortExec: expr=[s_suppkey@0 ASC NULLS LAST], preserve_partitioning=true",
            "    ProjectionExec: expr=[s_suppkey@1, s_name@2, s_address@3, s_phone@4,"
                + " total_revenue@6]",
            "      CoalesceBatchesExec: target_batch_size=8192",
            "        HashJoinExec: mode=CollectLeft, join_type=Inner,"
                + " on=[(max_revenue@0, total_revenue@5)]",
            "          AggregateExec: mode=Final, gby=[], " + max,
            "            CoalescePartitionsExec",
            "              AggregateExec: mode=Partial, gby=[], " + max,
            "                AggregateExec: mode=FinalPartitioned, gby=[supplier_no@0], aggr=["
                + revenue,
            "                  CoalesceBatchesExec: target_batch_size=8192",
            "                    RepartitionExec: partitioning=Hash([supplier_no@0], 2),"
                + " input_partitions=2",
            "                      AggregateExec: mode=Partial,"
                + " gby=[l_suppkey@0 AS supplier_no], aggr=["
                + revenue,
            "                        CoalesceBatchesExec: target_batch_size=8192",
            "                          " + filter,
            "                            " + lineitemScan,
            "          CoalesceBatchesExec: target_batch_size=8192",
            "            HashJoinExec: mode=Partitioned, join_type=Inner,"
                + " on=[(s_suppkey@0, supplier_no@0)]",
            "              CoalesceBatchesExec: target_batch_size=8192",
            "                RepartitionExec: partitioning=Hash([s_suppkey@0], 2),"
                + " input_partitions=2",
            "                  ScanExec: table=supplier, partitions=2,"
                + " projection=[s_suppkey, s_name, s_address, s_phone]",
            "              AggregateExec: mode=FinalPartitioned, gby=[supplier_no@0], aggr=["
                + revenue,
            "                CoalesceBatchesExec: target_batch_size=8192",
            "                  RepartitionExec: partitioning=Hash([supplier_no@0], 2),"
                + " input_partitions=2",
            "                    AggregateExec: mode=Partial,"
                + " gby=[l_suppkey@0 AS supplier_no], aggr=["
                + revenue,
            "                      CoalesceBatchesExec: target_batch_size=8192",
            "                        " + filter,
            "                          " + lineitemScan,
            ""),
        driver.explain(topSuppliers()));
  }

  @Test
  void should_return_suppliers_tied_on_maximum_revenue_in_key_order() {
    // When
    QueryResult result = driver.run(topSuppliers());

    // Then: suppliers 2 and 3 both reach 200, supplier 1 only 140
    List<List<Object>> rows = result.getRows();
    assertEquals(2, rows.size());
    assertEquals(List.of(2L, "Supplier#2", "2 Main St", "22-222"), rows.get(0).subList(0, 4));
    assertEquals(List.of(3L, "Supplier#3", "3 Main St", "33-333"), rows.get(1).subList(0, 4));
    for (List<Object> row : rows) {
      assertEquals(0, decimal("200").compareTo((BigDecimal) row.get(4)));
    }
  }

  private LogicalPlan revenue() {
    return aggregation(
        filter(
            scan(lineitem),
            and(
                greaterOrEqual(
                    ref("l_shipdate", 3, BlockType.DATE), literal(date("1996-01-01"))),
                less(ref("l_shipdate", 3, BlockType.DATE), literal(date("1996-04-01"))))),
        List.of(
            AggregateCall.of(
                AggregateFunction.SUM,
                multiply(
                    ref("l_extendedprice", 1, BlockType.DECIMAL),
                    subtract(literal(BigDecimal.ONE), ref("l_discount", 2, BlockType.DECIMAL))),
                "total_revenue")),
        List.of(named("supplier_no", ref("l_suppkey", 0, BlockType.LONG))));
  }

  private LogicalPlan topSuppliers() {
    LogicalPlan revenue = revenue();
    LogicalPlan maxRevenue =
        aggregation(
            revenue,
            List.of(
                AggregateCall.of(
                    AggregateFunction.MAX,
                    ref("total_revenue", 1, BlockType.DECIMAL),
                    "max_revenue")),
            List.of());
    LogicalPlan supplierRevenue =
        join(
            scan(supplier),
            revenue,
            JoinType.INNER,
            List.of(ref("s_suppkey", 0, BlockType.LONG)),
            List.of(ref("supplier_no", 0, BlockType.LONG)));
    LogicalPlan best =
        join(
            maxRevenue,
            supplierRevenue,
            JoinType.INNER,
            List.of(ref("max_revenue", 0, BlockType.DECIMAL)),
            List.of(ref("total_revenue", 5, BlockType.DECIMAL)));
    return sort(
        project(
            best,
            named(ref("s_suppkey", 1, BlockType.LONG)),
            named(ref("s_name", 2, BlockType.STRING)),
            named(ref("s_address", 3, BlockType.STRING)),
            named(ref("s_phone", 4, BlockType.STRING)),
            named(ref("total_revenue", 6, BlockType.DECIMAL))),
        SortKey.asc("s_suppkey", 0));
  }

  private static BigDecimal decimal(String value) {
    return new BigDecimal(value);
  }

  private static LocalDate date(String value) {
    return LocalDate.parse(value);
  }
}
