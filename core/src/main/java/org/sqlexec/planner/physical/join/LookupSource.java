/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.planner.physical.join;

import java.util.BitSet;
import java.util.List;
import java.util.Map;
import org.sqlexec.planner.physical.page.Page;

/**
 * The build side of a hash join: all build rows in one page plus a hash table from normalized join
 * key to a chain of row positions. Chains list rows in build input order. Rows with a null key
 * are kept in the page but are never reachable through the table.
 *
 * <p>The table is read-only once built. The match bitmap is only written by joins whose type
 * tracks build matches, which never share a lookup source between probe threads.
 */
public class LookupSource {

  private final Page buildPage;
  private final Map<List<Object>, Integer> heads;
  private final int[] next;
  private final BitSet matched;

  LookupSource(Page buildPage, Map<List<Object>, Integer> heads, int[] next) {
    this.buildPage = buildPage;
    this.heads = heads;
    this.next = next;
    this.matched = new BitSet(buildPage.getPositionCount());
  }

  /** Returns every build row. */
  public Page getBuildPage() {
    return buildPage;
  }

  /** Returns the first build position with the given normalized key, or -1. */
  public int getFirstPosition(List<Object> key) {
    Integer head = heads.get(key);
    return head == null ? -1 : head;
  }

  /** Returns the next build position with the same key, or -1. */
  public int getNextPosition(int position) {
    return next[position];
  }

  public void markMatched(int position) {
    matched.set(position);
  }

  public boolean isMatched(int position) {
    return matched.get(position);
  }

  public int getPositionCount() {
    return buildPage.getPositionCount();
  }
}
