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

package org.csvcodec.decoder;

import java.util.List;
import org.csvcodec.BufferingStrategy;
import org.csvcodec.Row;

/**
 * <p>
 * Serves parsed rows to a structured decoder that may ask for them out of
 * order.
 * </p>
 * <p>
 * Rows are parsed on demand: asking for a row past the last parsed one
 * advances the underlying reader until it is reached. Which earlier rows are
 * still available depends on the {@link BufferingStrategy}. Every failure is a
 * {@link org.csvcodec.CSVBufferException}, except errors raised by the reader
 * itself, which propagate unchanged.
 * </p>
 */
public interface DecodingBuffer {

  BufferingStrategy getStrategy();

  /**
   * @return the header fields, or an empty list when the input has no header
   */
  List<String> getHeaders();

  /**
   * @return whether the data row exists; rows past the end of the input do not
   * @throws org.csvcodec.CSVBufferException if the row was discarded
   */
  boolean hasRow(int index);

  /**
   * @throws org.csvcodec.CSVBufferException if the row was discarded or lies
   *         past the end of the input
   */
  Row getRow(int index);

  /**
   * @throws org.csvcodec.CSVBufferException if the row cannot be served or has
   *         no such column
   */
  String getField(int row, int column);

  /**
   * Looks a field up by header name. When a name repeats, the first column
   * with that name is used.
   *
   * @throws org.csvcodec.CSVBufferException if the row cannot be served or no
   *         header has that name
   */
  String getField(int row, String header);

  /**
   * @return the number of data rows parsed so far
   */
  int getRowsParsed();
}
