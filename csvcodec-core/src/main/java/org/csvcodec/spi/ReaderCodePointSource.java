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

import com.google.common.base.Preconditions;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import org.csvcodec.CSVIOException;

/**
 * Reads code points from a {@link Reader}, joining surrogate pairs. A lone
 * surrogate is passed through as its own code point.
 */
public class ReaderCodePointSource implements CodePointSource, Closeable {

  private static final int UNREAD = -2;

  private final Reader reader;
  private int pending = UNREAD;
  private boolean exhausted = false;

  public ReaderCodePointSource(Reader reader) {
    Preconditions.checkNotNull(reader, "Reader cannot be null");
    this.reader = reader;
  }

  public static ReaderCodePointSource of(String data) {
    return new ReaderCodePointSource(new StringReader(data));
  }

  @Override
  public int read() {
    if (exhausted) {
      return END;
    }
    int c = nextChar();
    if (c == -1) {
      exhausted = true;
      return END;
    }
    if (Character.isHighSurrogate((char) c)) {
      int low = nextChar();
      if (low != -1 && Character.isLowSurrogate((char) low)) {
        return Character.toCodePoint((char) c, (char) low);
      }
      pending = low == -1 ? UNREAD : low;
      if (low == -1) {
        exhausted = true;
      }
    }
    return c;
  }

  private int nextChar() {
    if (pending != UNREAD) {
      int c = pending;
      pending = UNREAD;
      return c;
    }
    try {
      return reader.read();
    } catch (IOException e) {
      throw new CSVIOException("Could not read CSV input", e);
    }
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }
}
