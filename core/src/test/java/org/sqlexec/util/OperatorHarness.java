/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.util;

import java.util.ArrayList;
import java.util.List;
import org.sqlexec.planner.physical.operator.Operator;
import org.sqlexec.planner.physical.page.Page;

/** Pushes pages through a single operator the way a pipeline driver does. */
public final class OperatorHarness {

  private OperatorHarness() {}

  public static List<Page> run(Operator operator, Page... inputs) {
    List<Page> outputs = new ArrayList<>();
    for (Page input : inputs) {
      drainReady(operator, outputs);
      if (operator.isFinished()) {
        break;
      }
      if (operator.needsInput()) {
        operator.addInput(input);
      }
    }
    drainReady(operator, outputs);
    operator.finish();
    while (!operator.isFinished()) {
      Page page = operator.getOutput();
      if (page != null) {
        outputs.add(page);
      }
    }
    return outputs;
  }

  private static void drainReady(Operator operator, List<Page> outputs) {
    Page page;
    while ((page = operator.getOutput()) != null) {
      outputs.add(page);
    }
  }
}
