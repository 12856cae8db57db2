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

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import org.csvcodec.MalformedCSVException;
import org.csvcodec.spi.BufferedCodePointSource;
import org.csvcodec.spi.CodePointSource;

/**
 * <p>
 * Splits a stream of code points into rows of fields.
 * </p>
 * <p>
 * A field that starts with the quote character runs until the next lone
 * quote; inside it, delimiters and line breaks are literal and a doubled quote
 * stands for one quote. After the closing quote only a delimiter (or, when
 * trimming, a trim character) may follow. Unquoted fields end at the next
 * delimiter and lose leading and trailing trim characters; quoted fields are
 * never trimmed. A line holding only trim characters is a row with one empty
 * field. The last row does not need a row delimiter.
 * </p>
 * <p>
 * Any malformed input is fatal: once {@link #nextRow()} throws, the parser
 * refuses to continue.
 * </p>
 */
@NotThreadSafe
public class CSVRowParser {

  enum State {
    BETWEEN_ROWS,
    BETWEEN_FIELDS,
    IN_UNQUOTED_FIELD,
    IN_QUOTED_FIELD,
    AFTER_CLOSING_QUOTE,
    ROW_COMPLETE,
    END_OF_INPUT,
    FAILED
  }

  private enum Match {
    FIELD, ROW, NONE
  }

  private final BufferedCodePointSource source;
  private final int quote;
  private final int[] fieldDelimiter;
  private final int[] rowDelimiter;
  private final boolean fieldDelimiterFirst;
  private final Set<Integer> trim;

  private State state = State.BETWEEN_ROWS;
  private long rowsParsed = 0;

  public CSVRowParser(BufferedCodePointSource source,
                      CSVReaderConfiguration config) {
    Preconditions.checkNotNull(source, "Source cannot be null");
    Preconditions.checkNotNull(config, "Configuration cannot be null");
    this.source = source;
    this.quote = config.getQuote();
    this.fieldDelimiter = config.getDelimiters().field();
    this.rowDelimiter = config.getDelimiters().row();
    // the longer delimiter is tried first so a shared prefix is not cut short
    this.fieldDelimiterFirst = fieldDelimiter.length >= rowDelimiter.length;
    this.trim = config.getTrim();
  }

  /**
   * @return the fields of the next row, an empty list for an empty line, or
   *         {@code null} once the input is exhausted
   * @throws MalformedCSVException if the row breaks the quoting rules
   */
  @Nullable
  public List<String> nextRow() {
    Preconditions.checkState(state != State.FAILED,
        "Cannot parse after a malformed row");
    if (state == State.END_OF_INPUT) {
      return null;
    }

    state = State.BETWEEN_ROWS;
    List<String> fields = Lists.newArrayList();
    StringBuilder field = new StringBuilder();

    while (state != State.ROW_COMPLETE) {
      int c = source.read();
      if (c == CodePointSource.END) {
        return endOfInput(fields, field);
      }

      switch (state) {
        case BETWEEN_ROWS:
        case BETWEEN_FIELDS:
          if (c == quote) {
            state = State.IN_QUOTED_FIELD;
            break;
          }
          Match start = match(c);
          if (start == Match.FIELD) {
            fields.add("");
            state = State.BETWEEN_FIELDS;
          } else if (start == Match.ROW) {
            if (state == State.BETWEEN_FIELDS) {
              fields.add("");
            }
            state = State.ROW_COMPLETE;
          } else if (!trim.contains(c)) {
            field.appendCodePoint(c);
            state = State.IN_UNQUOTED_FIELD;
          } else {
            // leading trim starts the first field of the row
            state = State.BETWEEN_FIELDS;
          }
          break;

        case IN_UNQUOTED_FIELD:
          Match end = match(c);
          if (end == Match.NONE) {
            field.appendCodePoint(c);
          } else {
            fields.add(trimTrailing(field));
            field.setLength(0);
            state = end == Match.FIELD ?
                State.BETWEEN_FIELDS : State.ROW_COMPLETE;
          }
          break;

        case IN_QUOTED_FIELD:
          if (c == quote) {
            state = State.AFTER_CLOSING_QUOTE;
          } else {
            field.appendCodePoint(c);
          }
          break;

        case AFTER_CLOSING_QUOTE:
          if (c == quote) {
            field.appendCodePoint(quote);
            state = State.IN_QUOTED_FIELD;
            break;
          }
          Match after = match(c);
          if (after != Match.NONE) {
            fields.add(field.toString());
            field.setLength(0);
            state = after == Match.FIELD ?
                State.BETWEEN_FIELDS : State.ROW_COMPLETE;
          } else if (!trim.contains(c)) {
            throw malformed("Unexpected character after a closing quote",
                fields.size(), c);
          }
          break;

        default:
          throw new IllegalStateException("Unexpected parser state: " + state);
      }
    }

    rowsParsed += 1;
    return fields;
  }

  /**
   * @return the number of rows returned so far, header included
   */
  public long getRowsParsed() {
    return rowsParsed;
  }

  State getState() {
    return state;
  }

  @Nullable
  private List<String> endOfInput(List<String> fields, StringBuilder field) {
    switch (state) {
      case BETWEEN_ROWS:
        state = State.END_OF_INPUT;
        return null;
      case BETWEEN_FIELDS:
        fields.add("");
        break;
      case IN_UNQUOTED_FIELD:
        fields.add(trimTrailing(field));
        break;
      case AFTER_CLOSING_QUOTE:
        fields.add(field.toString());
        break;
      case IN_QUOTED_FIELD:
        throw malformed("Unterminated quoted field at end of input",
            fields.size(), MalformedCSVException.NO_CODE_POINT);
      default:
        throw new IllegalStateException("Unexpected parser state: " + state);
    }
    state = State.END_OF_INPUT;
    rowsParsed += 1;
    return fields;
  }

  private Match match(int c) {
    if (fieldDelimiterFirst) {
      if (matches(c, fieldDelimiter)) {
        return Match.FIELD;
      } else if (matches(c, rowDelimiter)) {
        return Match.ROW;
      }
    } else {
      if (matches(c, rowDelimiter)) {
        return Match.ROW;
      } else if (matches(c, fieldDelimiter)) {
        return Match.FIELD;
      }
    }
    return Match.NONE;
  }

  /**
   * Checks whether {@code c} starts the delimiter, reading ahead as needed.
   * Code points read past {@code c} are pushed back when the match fails.
   */
  private boolean matches(int c, int[] delimiter) {
    if (c != delimiter[0]) {
      return false;
    }
    for (int i = 1; i < delimiter.length; i += 1) {
      int next = source.read();
      if (next != delimiter[i]) {
        int[] overRead;
        if (next == CodePointSource.END) {
          overRead = new int[i - 1];
          System.arraycopy(delimiter, 1, overRead, 0, i - 1);
        } else {
          overRead = new int[i];
          System.arraycopy(delimiter, 1, overRead, 0, i - 1);
          overRead[i - 1] = next;
        }
        source.getBuffer().prepend(overRead);
        return false;
      }
    }
    return true;
  }

  private String trimTrailing(StringBuilder field) {
    int end = field.length();
    while (end > 0) {
      int c = Character.codePointBefore(field, end);
      if (!trim.contains(c)) {
        break;
      }
      end -= Character.charCount(c);
    }
    return field.substring(0, end);
  }

  private MalformedCSVException malformed(String reason, int column,
                                          int codePoint) {
    state = State.FAILED;
    return new MalformedCSVException(reason, rowsParsed, column, codePoint);
  }
}
