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

/**
 * Encodes one code point at a time and writes the bytes to the output. A code
 * point is either written completely or not at all.
 */
public interface ScalarEncoder {

  /**
   * @param codePoint a valid Unicode code point
   * @throws org.csvcodec.CSVEncodingException if the output encoding cannot
   *         represent the code point
   * @throws org.csvcodec.CSVStreamException if the bytes cannot be written
   */
  void encode(int codePoint);
}
