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

package org.csvcodec;

/**
 * <p>
 * How many parsed rows a decoding buffer keeps so that rows can be requested
 * out of order.
 * </p>
 * <p>
 * Parsing is sequential: row 2 can only be read after row 1. A structured
 * decoder may still ask for row 24 and then for row 3, so parsed rows are kept
 * in a buffer. The strategy trades memory for how far back such jumps may go.
 * Within the current row, fields can always be read in any order.
 * </p>
 */
public enum BufferingStrategy {
  /**
   * Every parsed row is kept. Rows may be requested again, forward or
   * backward.
   */
  KEEP_ALL,
  /**
   * Only the row being decoded is kept. A forward jump discards the rows in
   * between, and asking for a discarded row fails.
   */
  SEQUENTIAL
}
