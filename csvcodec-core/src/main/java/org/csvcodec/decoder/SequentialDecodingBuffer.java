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

import javax.annotation.concurrent.NotThreadSafe;
import org.csvcodec.BufferingStrategy;
import org.csvcodec.Row;
import org.csvcodec.reader.CSVReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps only the current row. Moving forward discards the rows skipped over,
 * and asking for any row before the current one fails.
 */
@NotThreadSafe
class SequentialDecodingBuffer extends AbstractDecodingBuffer {

  private static final Logger LOG = LoggerFactory
      .getLogger(SequentialDecodingBuffer.class);

  private Row current = null;
  private boolean exhausted = false;

  SequentialDecodingBuffer(CSVReader reader) {
    super(reader, BufferingStrategy.SEQUENTIAL);
  }

  @Override
  Row row(int index) {
    checkIndex(index);
    if (current != null && index < current.getIndex()) {
      throw failure("Row was discarded by sequential buffering", index);
    }

    int discarded = 0;
    while ((current == null || current.getIndex() < index) && !exhausted) {
      Row row = parseNext();
      if (row == null) {
        exhausted = true;
      } else {
        if (current != null) {
          discarded += 1;
        }
        current = row;
      }
    }
    if (discarded > 0) {
      LOG.debug("Discarded {} row(s) moving to row {}", discarded, index);
    }

    if (current != null && current.getIndex() == index) {
      return current;
    }
    return null;
  }

  @Override
  int firstRetainedRow() {
    return current == null ? 0 : (int) current.getIndex();
  }
}
