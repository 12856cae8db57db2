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

package org.csvcodec.writer;

import com.google.common.base.Preconditions;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.WritableByteChannel;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;
import org.csvcodec.CSVException;
import org.csvcodec.CSVIOException;
import org.csvcodec.CSVProperties;
import org.csvcodec.Delimiters;
import org.csvcodec.TextEncoding;
import org.csvcodec.spi.ReaderWriterState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Writes rows of text fields as CSV.
 * </p>
 * <p>
 * Delimiters left for inference in the {@link CSVProperties} fall back to
 * {@code ,} and {@code \n}. A field is quoted when it contains the quote or
 * any character of either delimiter, starts or ends with a trim character, or
 * is the only field of its row and empty; quotes inside it are doubled. Every
 * row, the last included, ends with the row delimiter.
 * </p>
 * <p>
 * The caller owns the sink: {@link #close()} flushes a stream but leaves the
 * channel or stream open. A row with a {@code null} field is rejected before
 * any of it is written; any other failure mid-row moves the writer to the
 * error state.
 * </p>
 */
public class CSVWriter implements Closeable {

  private static final Logger LOG = LoggerFactory.getLogger(CSVWriter.class);

  private final CSVProperties props;
  private final ChannelWriter out;
  @Nullable
  private final OutputStream stream;

  private Delimiters delimiters = null;
  private Set<Integer> trim = null;
  private ScalarEncoder encoder = null;

  // state
  private ReaderWriterState state = ReaderWriterState.NEW;
  private long rowsWritten = 0;

  public CSVWriter(WritableByteChannel channel, CSVProperties props) {
    this(channel, null, props);
  }

  public CSVWriter(OutputStream stream, CSVProperties props) {
    this(Channels.newChannel(stream), stream, props);
  }

  private CSVWriter(WritableByteChannel channel, @Nullable OutputStream stream,
                    CSVProperties props) {
    Preconditions.checkNotNull(props, "Properties cannot be null");
    this.out = new ChannelWriter(channel);
    this.stream = stream;
    this.props = props;
  }

  /**
   * Resolves the encoding and writes the byte order mark if the
   * {@link org.csvcodec.BOMStrategy} asks for one.
   *
   * @throws org.csvcodec.CSVEncodingException if the charset is not supported;
   *         nothing is written in that case
   */
  public void initialize() {
    Preconditions.checkState(state.equals(ReaderWriterState.NEW),
        "A writer may not be opened more than once - current state:%s", state);

    try {
      TextEncoding encoding = TextEncoding.forName(props.charset);
      this.delimiters = Delimiters.of(
          props.fieldDelimiter == null ?
              CSVProperties.DEFAULT_FIELD_DELIMITER : props.fieldDelimiter,
          props.rowDelimiter == null ?
              CSVProperties.DEFAULT_ROW_DELIMITER : props.rowDelimiter);
      this.trim = props.trimScalars(delimiters);
      this.encoder = ScalarEncoders.newEncoder(
          out, encoding, props.bom.preamble(encoding));
      LOG.debug("Opened writer with encoding:{} delimiters:{}",
          encoding, delimiters);
    } catch (CSVException e) {
      this.state = ReaderWriterState.ERROR;
      throw e;
    }

    this.state = ReaderWriterState.OPEN;
  }

  /**
   * Writes the header row. It must be the first row written.
   */
  public void writeHeaders(List<String> headers) {
    Preconditions.checkState(rowsWritten == 0,
        "Headers must be written before any row");
    writeRow(headers);
  }

  public void writeRow(String... fields) {
    writeRow(Arrays.asList(fields));
  }

  public void writeRow(List<String> fields) {
    Preconditions.checkState(state.equals(ReaderWriterState.OPEN),
        "Attempt to write in state:%s", state);
    Preconditions.checkNotNull(fields, "Fields cannot be null");
    for (int i = 0; i < fields.size(); i += 1) {
      Preconditions.checkArgument(fields.get(i) != null,
          "Field %s cannot be null", i);
    }

    try {
      for (int i = 0; i < fields.size(); i += 1) {
        if (i > 0) {
          writeScalars(delimiters.field());
        }
        writeField(fields.get(i), fields.size() == 1);
      }
      writeScalars(delimiters.row());
    } catch (RuntimeException e) {
      // part of the row may already be in the sink
      this.state = ReaderWriterState.ERROR;
      throw e;
    }
    this.rowsWritten += 1;
  }

  public long getRowsWritten() {
    return rowsWritten;
  }

  private void writeField(String field, boolean onlyField) {
    if (!needsQuotes(field, onlyField)) {
      writeScalars(field);
      return;
    }
    encoder.encode(Delimiters.QUOTE);
    for (int i = 0; i < field.length(); ) {
      int c = field.codePointAt(i);
      if (c == Delimiters.QUOTE) {
        encoder.encode(Delimiters.QUOTE);
      }
      encoder.encode(c);
      i += Character.charCount(c);
    }
    encoder.encode(Delimiters.QUOTE);
  }

  boolean needsQuotes(String field, boolean onlyField) {
    if (field.isEmpty()) {
      return onlyField;
    }
    if (trim.contains(field.codePointAt(0)) ||
        trim.contains(field.codePointBefore(field.length()))) {
      return true;
    }
    for (int i = 0; i < field.length(); ) {
      int c = field.codePointAt(i);
      if (c == Delimiters.QUOTE || delimiters.isDelimiterScalar(c)) {
        return true;
      }
      i += Character.charCount(c);
    }
    return false;
  }

  private void writeScalars(String text) {
    for (int i = 0; i < text.length(); ) {
      int c = text.codePointAt(i);
      encoder.encode(c);
      i += Character.charCount(c);
    }
  }

  private void writeScalars(int[] scalars) {
    for (int c : scalars) {
      encoder.encode(c);
    }
  }

  /**
   * Flushes the underlying stream when the writer was created from one.
   */
  public void flush() {
    Preconditions.checkState(state.equals(ReaderWriterState.OPEN),
        "Attempt to flush a writer in state:%s", state);
    if (stream != null) {
      try {
        stream.flush();
      } catch (IOException e) {
        throw new CSVIOException("Failed to flush output", e);
      }
    }
  }

  public boolean isOpen() {
    return state.equals(ReaderWriterState.OPEN);
  }

  @Override
  public void close() {
    if (state.equals(ReaderWriterState.CLOSED)) {
      return;
    }

    LOG.debug("Closing writer after {} rows", rowsWritten);

    try {
      if (stream != null && state.equals(ReaderWriterState.OPEN)) {
        stream.flush();
      }
    } catch (IOException e) {
      throw new CSVIOException("Unable to close writer", e);
    } finally {
      state = ReaderWriterState.CLOSED;
    }
  }
}
