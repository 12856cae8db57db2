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
import java.io.Reader;
import org.csvcodec.BufferingStrategy;
import org.csvcodec.reader.CSVReader;

/**
 * Creates {@link DecodingBuffer decoding buffers} for a buffering strategy.
 */
public class DecodingBuffers {

  private DecodingBuffers() {
  }

  /**
   * @param reader an initialized reader; the buffer takes over reading from it
   */
  public static DecodingBuffer newBuffer(CSVReader reader,
                                         BufferingStrategy strategy) {
    Preconditions.checkNotNull(strategy, "Buffering strategy cannot be null");
    switch (strategy) {
      case KEEP_ALL:
        return new KeepAllDecodingBuffer(reader);
      case SEQUENTIAL:
        return new SequentialDecodingBuffer(reader);
      default:
        throw new IllegalArgumentException(
            "Unknown buffering strategy: " + strategy);
    }
  }

  /**
   * Opens a reader over the input and wraps it in the configured buffer.
   */
  public static DecodingBuffer open(Reader input,
                                    CSVDecoderConfiguration config) {
    Preconditions.checkNotNull(config, "Configuration cannot be null");
    CSVReader reader = new CSVReader(input, config.getReaderProperties());
    reader.initialize();
    return newBuffer(reader, config.getBuffering());
  }

  public static DecodingBuffer open(String input,
                                    CSVDecoderConfiguration config) {
    Preconditions.checkNotNull(config, "Configuration cannot be null");
    CSVReader reader = new CSVReader(input, config.getReaderProperties());
    reader.initialize();
    return newBuffer(reader, config.getBuffering());
  }
}
