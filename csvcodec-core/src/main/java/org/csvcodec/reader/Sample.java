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

package org.csvcodec.reader;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.List;
import java.util.Set;
import org.csvcodec.Delimiters;
import org.csvcodec.MalformedCSVException;
import org.csvcodec.spi.BufferedCodePointSource;
import org.csvcodec.spi.CodePointSource;

/**
 * A bounded prefix of the input, read for inference and then pushed back in
 * front of the source so parsing starts from the untouched stream.
 */
class Sample {

  @VisibleForTesting
  static final int MAX_CODE_POINTS = 64 * 1024;
  static final int MAX_ROWS = 25;

  private final List<Integer> codePoints;
  private final boolean complete;

  private Sample(List<Integer> codePoints, boolean complete) {
    this.codePoints = codePoints;
    this.complete = complete;
  }

  static Sample take(BufferedCodePointSource source) {
    return take(source, MAX_CODE_POINTS);
  }

  static Sample take(BufferedCodePointSource source, int limit) {
    List<Integer> read = Lists.newArrayList();
    boolean complete = false;
    try {
      while (read.size() < limit) {
        int c = source.read();
        if (c == CodePointSource.END) {
          complete = true;
          break;
        }
        read.add(c);
      }
    } finally {
      source.getBuffer().prepend(read);
    }
    return new Sample(ImmutableList.copyOf(read), complete);
  }

  /**
   * @return {@code true} if the whole input fit in the sample
   */
  boolean isComplete() {
    return complete;
  }

  boolean isEmpty() {
    return codePoints.isEmpty();
  }

  List<Integer> codePoints() {
    return codePoints;
  }

  /**
   * Parses up to {@link #MAX_ROWS} non-empty rows from the sample. When the
   * sample is a truncated prefix, the last row may be cut short and is
   * dropped.
   *
   * @throws MalformedCSVException if the sample breaks the quoting rules
   */
  List<List<String>> rows(Delimiters delimiters, Set<Integer> trim) {
    CSVRowParser parser = new CSVRowParser(
        new BufferedCodePointSource(new ListSource(codePoints)),
        new CSVReaderConfiguration(delimiters, false, trim));
    List<List<String>> rows = Lists.newArrayList();
    try {
      List<String> row;
      while ((row = parser.nextRow()) != null) {
        if (!row.isEmpty()) {
          rows.add(row);
        }
        if (rows.size() > MAX_ROWS) {
          return rows.subList(0, MAX_ROWS);
        }
      }
    } catch (MalformedCSVException e) {
      if (complete || e.getCodePoint() != MalformedCSVException.NO_CODE_POINT) {
        throw e;
      }
      // the sample ended inside a quoted field
      return rows;
    }
    if (!complete && !rows.isEmpty()) {
      rows.remove(rows.size() - 1);
    }
    return rows;
  }

  private static class ListSource implements CodePointSource {
    private final List<Integer> codePoints;
    private int position = 0;

    ListSource(List<Integer> codePoints) {
      this.codePoints = codePoints;
    }

    @Override
    public int read() {
      if (position < codePoints.size()) {
        return codePoints.get(position++);
      }
      return END;
    }
  }
}
