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

package org.csvcodec;

/**
 * When a writer emits a byte order mark before the first field.
 */
public enum BOMStrategy {
  /** Only for encodings whose byte order is otherwise unmarked. */
  CONVENTION,
  /** Whenever the encoding defines a byte order mark. */
  ALWAYS,
  /** Never. */
  NEVER;

  /**
   * @param encoding the output encoding
   * @return the bytes to write before the first field, possibly empty
   */
  public byte[] preamble(TextEncoding encoding) {
    switch (this) {
      case ALWAYS:
        return encoding.byteOrderMark();
      case CONVENTION:
        return encoding.isByteOrderUnmarked() ?
            encoding.byteOrderMark() : new byte[0];
      default:
        return new byte[0];
    }
  }
}
