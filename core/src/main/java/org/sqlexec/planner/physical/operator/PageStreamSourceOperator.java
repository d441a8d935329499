/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.operator;

import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.stream.PageStream;

/** Source operator reading the pages of a child partition's {@link PageStream}. */
public class PageStreamSourceOperator implements SourceOperator {

  private final PageStream input;
  private final OperatorContext context;
  private boolean finished;

  public PageStreamSourceOperator(PageStream input, OperatorContext context) {
    this.input = input;
    this.context = context;
  }

  @Override
  public Page getOutput() {
    if (finished) {
      return null;
    }
    Page page = input.next();
    if (page == null) {
      finished = true;
    }
    return page;
  }

  @Override
  public boolean isFinished() {
    return finished;
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }

  @Override
  public void close() {
    input.close();
  }
}
