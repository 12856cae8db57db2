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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import org.csvcodec.BufferingStrategy;
import org.csvcodec.CSVBufferException;
import org.csvcodec.Row;
import org.csvcodec.reader.CSVReader;

/**
 * Field and header lookups shared by the buffering strategies. Subclasses
 * decide which rows are retained.
 */
@NotThreadSafe
abstract class AbstractDecodingBuffer implements DecodingBuffer {

  private final CSVReader reader;
  private final BufferingStrategy strategy;
  private final Map<String, Integer> columns;
  private int rowsParsed = 0;

  AbstractDecodingBuffer(CSVReader reader, BufferingStrategy strategy) {
    Preconditions.checkNotNull(reader, "Reader cannot be null");
    Preconditions.checkArgument(reader.isOpen(),
        "Reader must be initialized before decoding");
    this.reader = reader;
    this.strategy = strategy;
    this.columns = columns(reader.getHeaders());
  }

  @Override
  public BufferingStrategy getStrategy() {
    return strategy;
  }

  @Override
  public List<String> getHeaders() {
    return reader.getHeaders();
  }

  @Override
  public int getRowsParsed() {
    return rowsParsed;
  }

  @Override
  public Row getRow(int index) {
    Row row = row(index);
    if (row == null) {
      throw failure("Row is past the end of the input", index);
    }
    return row;
  }

  @Override
  public boolean hasRow(int index) {
    return row(index) != null;
  }

  @Override
  public String getField(int row, int column) {
    Row fields = getRow(row);
    if (column < 0 || column >= fields.size()) {
      throw failure("Column " + column + " is out of range for a row of " +
          fields.size() + " field(s)", row);
    }
    return fields.get(column);
  }

  @Override
  public String getField(int row, String header) {
    Preconditions.checkNotNull(header, "Header name cannot be null");
    Integer column = columns.get(header);
    if (column == null) {
      throw failure("No column has header \"" + header + "\"", row);
    }
    return getField(row, column);
  }

  /**
   * @return the row, or {@code null} if the input ends before it
   * @throws CSVBufferException if the row is no longer retained
   */
  @Nullable
  abstract Row row(int index);

  /**
   * @return the lowest row index still available
   */
  abstract int firstRetainedRow();

  /**
   * @return the next row from the reader, or {@code null} at the end of the
   *         input
   */
  @Nullable
  Row parseNext() {
    Row row = reader.readRow();
    if (row != null) {
      rowsParsed += 1;
    }
    return row;
  }

  CSVBufferException failure(String reason, int index) {
    return new CSVBufferException(reason, strategy, index, firstRetainedRow());
  }

  void checkIndex(int index) {
    if (index < 0) {
      throw failure("Row index cannot be negative", index);
    }
  }

  private static Map<String, Integer> columns(List<String> headers) {
    ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
    for (int i = 0; i < headers.size(); i += 1) {
      if (headers.indexOf(headers.get(i)) == i) {
        builder.put(headers.get(i), i);
      }
    }
    return builder.build();
  }
}
