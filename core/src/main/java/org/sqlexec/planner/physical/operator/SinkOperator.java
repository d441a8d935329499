/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.operator;

import org.sqlexec.planner.physical.page.Page;

/**
 * Tail of an operator chain that hands pages out of the chain instead of emitting them, such as the
 * exchange sink writing into a repartition buffer. Chains ending with a sink are driven with
 * {@link org.sqlexec.planner.physical.pipeline.PipelineDriver#run()}.
 */
public interface SinkOperator extends Operator {

  @Override
  default Page getOutput() {
    return null;
  }
}
