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

/**
 * A sequential supplier of Unicode code points. A source can be read only
 * once.
 */
public interface CodePointSource {

  /** Returned by {@link #read()} once the source is exhausted. */
  int END = -1;

  /**
   * @return the next code point, or {@link #END}
   * @throws org.csvcodec.CSVIOException if the underlying text cannot be read
   */
  int read();
}
