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
 * <p>
 * The base exception for every failure raised while reading or writing CSV.
 * </p>
 * <p>
 * All subclasses are fatal for the session that raised them: a reader,
 * decoding buffer or writer that has thrown one should not be used again.
 * </p>
 */
public class CSVException extends RuntimeException {

  public CSVException() {
    super();
  }

  public CSVException(String message) {
    super(message);
  }

  public CSVException(String message, Throwable t) {
    super(message, t);
  }

  public CSVException(Throwable t) {
    super(t);
  }

  protected static String format(String message, Object... args) {
    String[] argStrings = new String[args.length];
    for (int i = 0; i < args.length; i += 1) {
      argStrings[i] = String.valueOf(args[i]);
    }
    return String.format(String.valueOf(message), (Object[]) argStrings);
  }

  /**
   * Renders a code point as {@code U+XXXX} for error messages.
   */
  protected static String describe(int codePoint) {
    return String.format("U+%04X", codePoint);
  }
}
