/*
 * Copyright 2013 Cloudera Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.csvcodec.spi;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * <p>
 * A queue of code points that were read but not yet handed to the parser.
 * </p>
 * <p>
 * Look-ahead code, such as delimiter inference or the check for a
 * multi-character delimiter, reads past the point it needs and puts the extra
 * code points back. {@link #prepend(int)} puts them in front of everything
 * already queued; {@link #append(int)} queues them behind. Either way, the
 * order returned by {@link #next()} is the order of the original input.
 * </p>
 */
@NotThreadSafe
public class ScalarBuffer {

  private final Deque<Integer> queue = new ArrayDeque<Integer>();

  /**
   * @return the first queued code point, or {@link CodePointSource#END} if the
   *         buffer is empty
   */
  public int next() {
    Integer c = queue.pollFirst();
    return c == null ? CodePointSource.END : c;
  }

  public void prepend(int codePoint) {
    queue.addFirst(codePoint);
  }

  /**
   * Inserts the code points before everything queued, keeping their order.
   */
  public void prepend(List<Integer> codePoints) {
    ListIterator<Integer> reversed = codePoints.listIterator(codePoints.size());
    while (reversed.hasPrevious()) {
      queue.addFirst(reversed.previous());
    }
  }

  public void prepend(int[] codePoints) {
    for (int i = codePoints.length - 1; i >= 0; i -= 1) {
      queue.addFirst(codePoints[i]);
    }
  }

  public void append(int codePoint) {
    queue.addLast(codePoint);
  }

  /**
   * Inserts the code points after everything queued, keeping their order.
   */
  public void append(List<Integer> codePoints) {
    queue.addAll(codePoints);
  }

  public void append(int[] codePoints) {
    for (int c : codePoints) {
      queue.addLast(c);
    }
  }

  public boolean isEmpty() {
    return queue.isEmpty();
  }

  public int size() {
    return queue.size();
  }
}
