/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.join;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.sqlexec.data.KeyHasher;
import org.sqlexec.expression.Expression;
import org.sqlexec.planner.physical.operator.OperatorContext;
import org.sqlexec.planner.physical.page.Page;
import org.sqlexec.planner.physical.page.Schema;
import org.sqlexec.planner.physical.stream.PageStream;

/** Collects the build side of a hash join and indexes it into a {@link LookupSource}. */
@Log4j2
public class LookupSourceBuilder {

  private static final long ENTRY_OVERHEAD_BYTES = 48L;

  private final Schema buildSchema;
  private final List<Expression> buildKeys;
  private final OperatorContext context;
  private final List<Page> pages = new ArrayList<>();
  private long retainedBytes;

  public LookupSourceBuilder(
      Schema buildSchema, List<Expression> buildKeys, OperatorContext context) {
    this.buildSchema = buildSchema;
    this.buildKeys = ImmutableList.copyOf(buildKeys);
    this.context = context;
  }

  /** Adds a build page; fails once the retained rows exceed the operator memory limit. */
  public void addPage(Page page) {
    retainedBytes += page.getRetainedSizeBytes() + ENTRY_OVERHEAD_BYTES * page.getPositionCount();
    context.checkMemory(retainedBytes);
    pages.add(page);
  }

  /** Reads the build stream to the end, closes it and builds the lookup source. */
  public LookupSource buildFrom(PageStream buildStream) {
    try {
      Page page;
      while ((page = buildStream.next()) != null) {
        addPage(page);
      }
    } finally {
      buildStream.close();
    }
    return build();
  }

  public LookupSource build() {
    Page buildPage = pages.isEmpty() ? Page.empty(buildSchema) : Page.concat(buildSchema, pages);
    pages.clear();
    int rows = buildPage.getPositionCount();
    Map<List<Object>, Integer> heads = new HashMap<>();
    int[] next = new int[rows];
    // insert backwards so each chain starts at its earliest row
    for (int position = rows - 1; position >= 0; position--) {
      List<Object> key = KeyHasher.extractJoinKey(buildKeys, buildPage, position);
      if (key == null) {
        next[position] = -1;
        continue;
      }
      Integer previous = heads.put(key, position);
      next[position] = previous == null ? -1 : previous;
    }
    log.debug(
        "{} built lookup source: {} rows, {} keys, {} bytes",
        context,
        rows,
        heads.size(),
        retainedBytes);
    return new LookupSource(buildPage, heads, next);
  }
}
