/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.expression.window;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.sqlexec.expression.DSL.ref;
import static org.sqlexec.expression.window.WindowFrameBound.currentRow;
import static org.sqlexec.expression.window.WindowFrameBound.following;
import static org.sqlexec.expression.window.WindowFrameBound.preceding;
import static org.sqlexec.expression.window.WindowFrameBound.unboundedFollowing;
import static org.sqlexec.expression.window.WindowFrameBound.unboundedPreceding;

import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.sqlexec.expression.Expression;
import org.sqlexec.planner.physical.page.Block.BlockType;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class WindowFrameTest {

  private final Expression amount = ref("amount", 2, BlockType.INT);

  @Test
  void should_render_units_and_bounds() {
    assertEquals(
        "ROWS BETWEEN 3 PRECEDING AND 2 FOLLOWING",
        WindowFrame.rows(preceding(3), following(2)).toString());
    assertEquals(
        "RANGE BETWEEN UNBOUNDED PRECEDING AND CURRENT ROW", WindowFrame.DEFAULT.toString());
    assertEquals(
        "GROUPS BETWEEN CURRENT ROW AND UNBOUNDED FOLLOWING",
        WindowFrame.groups(currentRow(), unboundedFollowing()).toString());
  }

  @Test
  void should_reject_unbounded_bounds_on_the_wrong_side() {
    IllegalArgumentException start =
        assertThrows(
            IllegalArgumentException.class,
            () -> WindowFrame.rows(unboundedFollowing(), unboundedFollowing()));
    IllegalArgumentException end =
        assertThrows(
            IllegalArgumentException.class,
            () -> WindowFrame.rows(unboundedPreceding(), unboundedPreceding()));

    assertEquals(
        "Invalid window frame: start bound cannot be UNBOUNDED FOLLOWING", start.getMessage());
    assertEquals(
        "Invalid window frame: end bound cannot be UNBOUNDED PRECEDING", end.getMessage());
  }

  @Test
  void should_reject_negative_and_fractional_row_offsets() {
    assertThrows(IllegalArgumentException.class, () -> preceding(-1));
    assertThrows(
        IllegalArgumentException.class,
        () -> WindowFrame.rows(preceding(new BigDecimal("0.5")), currentRow()));
    assertThrows(
        IllegalArgumentException.class,
        () -> WindowFrame.groups(currentRow(), following(1.5)));

    // RANGE offsets are distances between values
    assertEquals(
        new BigDecimal("0.5"),
        WindowFrame.range(preceding(new BigDecimal("0.5")), currentRow())
            .getStart()
            .getOffset());
  }

  @Test
  void should_classify_frames() {
    assertTrue(WindowFrame.DEFAULT.isFreeRange());
    assertTrue(WindowFrame.DEFAULT.isEverExpanding());
    assertFalse(WindowFrame.range(preceding(1), currentRow()).isFreeRange());
    assertFalse(WindowFrame.rows(currentRow(), unboundedFollowing()).isEverExpanding());
  }

  @Test
  void should_validate_window_call_arguments() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new WindowCall(WindowFunction.RANK, amount, null, "r"));
    assertThrows(
        IllegalArgumentException.class, () -> WindowCall.of(WindowFunction.SUM, null, "s"));
  }

  @Test
  void should_derive_types_and_default_frame_of_window_calls() {
    WindowCall sum = WindowCall.of(WindowFunction.SUM, amount, "total");
    WindowCall rank = WindowCall.ranking(WindowFunction.DENSE_RANK, "dr");
    WindowCall avg =
        WindowCall.of(
            WindowFunction.AVG, amount, WindowFrame.rows(preceding(1), currentRow()), "avg");

    assertEquals(BlockType.LONG, sum.getReturnType());
    assertEquals(WindowFrame.DEFAULT, sum.getFrame());
    assertEquals(BlockType.LONG, rank.getReturnType());
    assertEquals(BlockType.DOUBLE, avg.getReturnType());
    assertNull(
        WindowCall.of(WindowFunction.SUM, ref("s", 0, BlockType.STRING), "x").getReturnType());
    assertEquals(
        "SUM(amount@2) RANGE BETWEEN UNBOUNDED PRECEDING AND CURRENT ROW AS total",
        sum.toString());
    assertEquals("DENSE_RANK() AS dr", rank.toString());
  }
}
