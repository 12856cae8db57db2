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
 * Thrown when the input violates the quoting rules: text after a closing
 * quote, or a quoted field still open at the end of the input.
 */
public class MalformedCSVException extends CSVException {

  /** Marks a failure that was not caused by a specific code point. */
  public static final int NO_CODE_POINT = -1;

  private final long row;
  private final int column;
  private final int codePoint;

  public MalformedCSVException(String reason, long row, int column,
                               int codePoint) {
    super(format("%s (row %s, column %s%s)", reason, row, column,
        codePoint == NO_CODE_POINT ? "" : ", found " + describe(codePoint)));
    this.row = row;
    this.column = column;
    this.codePoint = codePoint;
  }

  /**
   * @return the 0-based position of the row in the stream, header included
   */
  public long getRow() {
    return row;
  }

  /**
   * @return the 0-based index of the field within its row
   */
  public int getColumn() {
    return column;
  }

  /**
   * @return the offending code point or {@link #NO_CODE_POINT}
   */
  public int getCodePoint() {
    return codePoint;
  }
}
