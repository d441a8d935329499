/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.stream;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.sqlexec.executor.TaskContext;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.Schema;

/** Factory and helper methods for {@link PageStream}s. */
public final class PageStreams {

  private PageStreams() {}

  /** Returns a stream over fixed pages. Empty pages are skipped. */
  public static PageStream fromPages(Schema schema, List<Page> pages, TaskContext taskContext) {
    Iterator<Page> iterator = List.copyOf(pages).iterator();
    return new AbstractPageStream(schema, taskContext) {
      @Override
      protected Page computeNext() {
        while (iterator.hasNext()) {
          Page page = iterator.next();
          if (page.getPositionCount() > 0) {
            return page;
          }
        }
        return null;
      }
    };
  }

  /** Returns a stream without pages. */
  public static PageStream empty(Schema schema, TaskContext taskContext) {
    return fromPages(schema, List.of(), taskContext);
  }

  /** Reads the stream to the end and closes it. */
  public static List<Page> drain(PageStream stream) {
    List<Page> pages = new ArrayList<>();
    try {
      Page page;
      while ((page = stream.next()) != null) {
        pages.add(page);
      }
    } finally {
      stream.close();
    }
    return pages;
  }
}
