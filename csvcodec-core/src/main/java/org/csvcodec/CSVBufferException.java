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
 * Thrown when a decoding buffer cannot serve a row or field: the row was
 * already discarded, it lies past the end of the input, or the column does not
 * exist.
 */
public class CSVBufferException extends CSVException {

  private final BufferingStrategy strategy;
  private final int requestedRow;
  private final int firstRetainedRow;

  public CSVBufferException(String reason, BufferingStrategy strategy,
                            int requestedRow, int firstRetainedRow) {
    super(format("%s (requested row %s, first retained row %s, strategy %s)",
        reason, requestedRow, firstRetainedRow, strategy));
    this.strategy = strategy;
    this.requestedRow = requestedRow;
    this.firstRetainedRow = firstRetainedRow;
  }

  public BufferingStrategy getStrategy() {
    return strategy;
  }

  public int getRequestedRow() {
    return requestedRow;
  }

  public int getFirstRetainedRow() {
    return firstRetainedRow;
  }
}
