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

import javax.annotation.Nullable;

/**
 * Thrown when a code point cannot be represented in the output encoding, or
 * when the requested encoding is not supported at all.
 */
public class CSVEncodingException extends CSVException {

  /** Marks an unsupported-encoding failure, where no code point is involved. */
  public static final int NO_CODE_POINT = -1;

  private final String encoding;
  private final int codePoint;

  public CSVEncodingException(String encoding, int codePoint,
                              @Nullable Throwable cause) {
    super(format("Cannot encode %s as %s", describe(codePoint), encoding),
        cause);
    this.encoding = encoding;
    this.codePoint = codePoint;
  }

  private CSVEncodingException(String message, String encoding) {
    super(message);
    this.encoding = encoding;
    this.codePoint = NO_CODE_POINT;
  }

  public static CSVEncodingException unsupported(String encoding) {
    return new CSVEncodingException(
        format("Unsupported encoding: %s", encoding), encoding);
  }

  public String getEncoding() {
    return encoding;
  }

  /**
   * @return the offending code point or {@link #NO_CODE_POINT}
   */
  public int getCodePoint() {
    return codePoint;
  }

  public boolean isUnsupportedEncoding() {
    return codePoint == NO_CODE_POINT;
  }
}
