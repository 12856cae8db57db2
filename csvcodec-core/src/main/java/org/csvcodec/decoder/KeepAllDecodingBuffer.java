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

import com.google.common.collect.Lists;
import java.util.List;
import javax.annotation.concurrent.NotThreadSafe;
import org.csvcodec.BufferingStrategy;
import org.csvcodec.Row;
import org.csvcodec.reader.CSVReader;

/**
 * Keeps every parsed row, so any row up to the highest one reached can be
 * served again.
 */
@NotThreadSafe
class KeepAllDecodingBuffer extends AbstractDecodingBuffer {

  private final List<Row> rows = Lists.newArrayList();
  private boolean exhausted = false;

  KeepAllDecodingBuffer(CSVReader reader) {
    super(reader, BufferingStrategy.KEEP_ALL);
  }

  @Override
  Row row(int index) {
    checkIndex(index);
    while (rows.size() <= index && !exhausted) {
      Row row = parseNext();
      if (row == null) {
        exhausted = true;
      } else {
        rows.add(row);
      }
    }
    return index < rows.size() ? rows.get(index) : null;
  }

  @Override
  int firstRetainedRow() {
    return 0;
  }
}
