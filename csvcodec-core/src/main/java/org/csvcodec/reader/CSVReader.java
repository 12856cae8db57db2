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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.Charset;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.csvcodec.CSVException;
import org.csvcodec.CSVIOException;
import org.csvcodec.CSVProperties;
import org.csvcodec.Row;
import org.csvcodec.spi.BufferedCodePointSource;
import org.csvcodec.spi.ReaderCodePointSource;
import org.csvcodec.spi.ReaderWriterState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Reads {@link Row rows} from CSV text.
 * </p>
 * <p>
 * {@link #initialize()} resolves the configuration, inferring whatever the
 * {@link CSVProperties} leave open, and consumes the header row when there is
 * one. The header is the first non-empty row. Data rows are then numbered from 0. A failure while parsing moves the
 * reader to the error state; it cannot be read from afterward.
 * </p>
 */
public class CSVReader implements Iterator<Row>, Closeable {

  private static final Logger LOG = LoggerFactory.getLogger(CSVReader.class);

  private final CSVProperties props;
  private final ReaderCodePointSource codePoints;
  private final BufferedCodePointSource source;

  private CSVReaderConfiguration config = null;
  private CSVRowParser parser = null;
  private List<String> headers = ImmutableList.of();

  // state
  private ReaderWriterState state = ReaderWriterState.NEW;
  private boolean fetched = false;
  private List<String> next = null;
  private long dataRows = 0;

  public CSVReader(Reader reader, CSVProperties props) {
    Preconditions.checkNotNull(reader, "Reader cannot be null");
    Preconditions.checkNotNull(props, "Properties cannot be null");
    this.props = props;
    this.codePoints = new ReaderCodePointSource(reader);
    this.source = new BufferedCodePointSource(codePoints);
  }

  public CSVReader(InputStream incoming, CSVProperties props) {
    this(new InputStreamReader(incoming, Charset.forName(props.charset)),
        props);
  }

  public CSVReader(String content, CSVProperties props) {
    this(new StringReader(content), props);
  }

  public void initialize() {
    Preconditions.checkState(state.equals(ReaderWriterState.NEW),
        "A reader may not be opened more than once - current state:%s", state);

    try {
      this.config = CSVReaderConfiguration.resolve(props, source);
      this.parser = new CSVRowParser(source, config);
      if (config.hasHeader()) {
        // empty lines before the header are skipped, as when sampling
        List<String> header = parser.nextRow();
        while (header != null && header.isEmpty()) {
          header = parser.nextRow();
        }
        if (header != null) {
          this.headers = ImmutableList.copyOf(header);
        }
      }
    } catch (CSVException e) {
      this.state = ReaderWriterState.ERROR;
      throw e;
    }

    LOG.debug("Opened reader with headers:{}", headers);
    this.state = ReaderWriterState.OPEN;
  }

  /**
   * @return the resolved configuration, once {@link #initialize()} has run
   */
  public CSVReaderConfiguration getConfiguration() {
    Preconditions.checkState(config != null,
        "Configuration is resolved by initialize - current state:%s", state);
    return config;
  }

  /**
   * @return the header fields, or an empty list when the input has no header
   */
  public List<String> getHeaders() {
    Preconditions.checkState(!state.equals(ReaderWriterState.NEW),
        "Headers are read by initialize - current state:%s", state);
    return headers;
  }

  @Override
  public boolean hasNext() {
    Preconditions.checkState(state.equals(ReaderWriterState.OPEN),
        "Attempt to read in state:%s", state);
    if (!fetched) {
      advance();
    }
    return next != null;
  }

  @Override
  public Row next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    Row row = new Row(dataRows, next);
    this.dataRows += 1;
    this.fetched = false;
    this.next = null;
    return row;
  }

  /**
   * @return the next row, or {@code null} at the end of the input
   */
  public Row readRow() {
    return hasNext() ? next() : null;
  }

  /**
   * Reads every remaining row.
   */
  public List<Row> readAll() {
    List<Row> rows = Lists.newArrayList();
    while (hasNext()) {
      rows.add(next());
    }
    return rows;
  }

  @Override
  public void remove() {
    throw new UnsupportedOperationException("Rows cannot be removed");
  }

  private void advance() {
    try {
      this.next = parser.nextRow();
      this.fetched = true;
    } catch (CSVException e) {
      this.state = ReaderWriterState.ERROR;
      throw e;
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

    LOG.debug("Closing reader after {} data rows", dataRows);

    try {
      codePoints.close();
    } catch (IOException e) {
      throw new CSVIOException("Unable to close reader", e);
    }

    state = ReaderWriterState.CLOSED;
  }
}
