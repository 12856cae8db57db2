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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.Map;

/**
 * The text encodings a CSV writer can produce.
 */
public enum TextEncoding {
  ASCII("US-ASCII", false),
  UTF_8("UTF-8", false, 0xEF, 0xBB, 0xBF),
  /** UTF-16 without an explicit byte order: big-endian behind a BOM. */
  UTF_16("UTF-16", true, 0xFE, 0xFF),
  UTF_16BE("UTF-16BE", false, 0xFE, 0xFF),
  UTF_16LE("UTF-16LE", false, 0xFF, 0xFE),
  /** UTF-32 without an explicit byte order: big-endian behind a BOM. */
  UTF_32("UTF-32", true, 0x00, 0x00, 0xFE, 0xFF),
  UTF_32BE("UTF-32BE", false, 0x00, 0x00, 0xFE, 0xFF),
  UTF_32LE("UTF-32LE", false, 0xFF, 0xFE, 0x00, 0x00),
  SHIFT_JIS("Shift_JIS", false);

  private static final Map<String, TextEncoding> BY_CHARSET_NAME;

  static {
    ImmutableMap.Builder<String, TextEncoding> builder = ImmutableMap.builder();
    for (TextEncoding encoding : values()) {
      builder.put(encoding.charsetName, encoding);
    }
    BY_CHARSET_NAME = builder.build();
  }

  private final String charsetName;
  private final boolean byteOrderUnmarked;
  private final byte[] bom;

  TextEncoding(String charsetName, boolean byteOrderUnmarked, int... bom) {
    this.charsetName = charsetName;
    this.byteOrderUnmarked = byteOrderUnmarked;
    this.bom = new byte[bom.length];
    for (int i = 0; i < bom.length; i += 1) {
      this.bom[i] = (byte) bom[i];
    }
  }

  /**
   * @return the canonical Java charset name
   */
  public String charsetName() {
    return charsetName;
  }

  /**
   * @return a copy of the byte order mark, empty when the encoding has none
   */
  public byte[] byteOrderMark() {
    return bom.clone();
  }

  /**
   * @return {@code true} if readers rely on a byte order mark to learn the
   *         byte order of this encoding
   */
  public boolean isByteOrderUnmarked() {
    return byteOrderUnmarked;
  }

  public Charset charset() {
    return Charset.forName(charsetName);
  }

  /**
   * Resolves a charset name or alias, such as {@code "utf8"} or
   * {@code "unicode"}.
   *
   * @throws CSVEncodingException if the encoding is not supported
   */
  public static TextEncoding forName(String name) {
    Preconditions.checkNotNull(name, "Encoding name cannot be null");
    Charset charset;
    try {
      if (!Charset.isSupported(name)) {
        throw CSVEncodingException.unsupported(name);
      }
      charset = Charset.forName(name);
    } catch (IllegalCharsetNameException e) {
      throw CSVEncodingException.unsupported(name);
    }
    return forCharset(charset);
  }

  /**
   * @throws CSVEncodingException if the charset is not supported
   */
  public static TextEncoding forCharset(Charset charset) {
    Preconditions.checkNotNull(charset, "Charset cannot be null");
    TextEncoding encoding = BY_CHARSET_NAME.get(charset.name());
    if (encoding == null) {
      throw CSVEncodingException.unsupported(charset.name());
    }
    return encoding;
  }
}
