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

import com.google.common.base.Preconditions;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import javax.annotation.concurrent.NotThreadSafe;
import org.csvcodec.CSVEncodingException;
import org.csvcodec.TextEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Creates {@link ScalarEncoder scalar encoders} bound to one output channel.
 * </p>
 * <p>
 * The encoding is resolved and the channel checked before anything is
 * written; then the preamble, if any, is written once. Each encoder computes
 * all bytes of a code point before writing them, so a code point that cannot
 * be encoded leaves the output untouched.
 * </p>
 */
public class ScalarEncoders {

  private static final Logger LOG = LoggerFactory
      .getLogger(ScalarEncoders.class);

  private ScalarEncoders() {
  }

  /**
   * @throws CSVEncodingException if the encoding is not supported; nothing is
   *         written in that case
   * @throws org.csvcodec.CSVStreamException if the channel is not open or the
   *         preamble cannot be written
   */
  public static ScalarEncoder newEncoder(ChannelWriter out, String encoding,
                                         byte[] preamble) {
    return newEncoder(out, TextEncoding.forName(encoding), preamble);
  }

  /**
   * @throws org.csvcodec.CSVStreamException if the channel is not open or the
   *         preamble cannot be written
   */
  public static ScalarEncoder newEncoder(ChannelWriter out,
                                         TextEncoding encoding,
                                         byte[] preamble) {
    Preconditions.checkNotNull(out, "Output cannot be null");
    Preconditions.checkNotNull(encoding, "Encoding cannot be null");
    Preconditions.checkNotNull(preamble, "Preamble cannot be null");

    ScalarEncoder encoder;
    switch (encoding) {
      case ASCII:
        encoder = new AsciiEncoder(out);
        break;
      case UTF_8:
        encoder = new Utf8Encoder(out);
        break;
      case UTF_16:
      case UTF_16BE:
        encoder = new Utf16Encoder(out, encoding, true);
        break;
      case UTF_16LE:
        encoder = new Utf16Encoder(out, encoding, false);
        break;
      case UTF_32:
      case UTF_32BE:
        encoder = new Utf32Encoder(out, encoding, true);
        break;
      case UTF_32LE:
        encoder = new Utf32Encoder(out, encoding, false);
        break;
      case SHIFT_JIS:
        encoder = new CharsetScalarEncoder(out, encoding);
        break;
      default:
        throw CSVEncodingException.unsupported(encoding.charsetName());
    }

    out.checkOpen();
    if (preamble.length > 0) {
      LOG.debug("Writing {} preamble byte(s) for {}",
          preamble.length, encoding.charsetName());
      out.write(preamble);
    }
    return encoder;
  }

  private abstract static class ByteEncoder implements ScalarEncoder {
    private final ChannelWriter out;
    final TextEncoding encoding;

    ByteEncoder(ChannelWriter out, TextEncoding encoding) {
      this.out = out;
      this.encoding = encoding;
    }

    @Override
    public void encode(int codePoint) {
      Preconditions.checkArgument(Character.isValidCodePoint(codePoint),
          "Invalid code point: %s", codePoint);
      out.write(bytes(codePoint));
    }

    abstract byte[] bytes(int codePoint);

    CSVEncodingException unencodable(int codePoint) {
      return new CSVEncodingException(encoding.charsetName(), codePoint, null);
    }

    void checkNotSurrogate(int codePoint) {
      if (codePoint >= Character.MIN_SURROGATE &&
          codePoint <= Character.MAX_SURROGATE) {
        throw unencodable(codePoint);
      }
    }
  }

  @NotThreadSafe
  private static class AsciiEncoder extends ByteEncoder {
    AsciiEncoder(ChannelWriter out) {
      super(out, TextEncoding.ASCII);
    }

    @Override
    byte[] bytes(int codePoint) {
      if (codePoint > 0x7F) {
        throw unencodable(codePoint);
      }
      return new byte[] {(byte) codePoint};
    }
  }

  @NotThreadSafe
  private static class Utf8Encoder extends ByteEncoder {
    Utf8Encoder(ChannelWriter out) {
      super(out, TextEncoding.UTF_8);
    }

    @Override
    byte[] bytes(int codePoint) {
      checkNotSurrogate(codePoint);
      if (codePoint < 0x80) {
        return new byte[] {(byte) codePoint};
      } else if (codePoint < 0x800) {
        return new byte[] {
            (byte) (0xC0 | (codePoint >> 6)),
            (byte) (0x80 | (codePoint & 0x3F))};
      } else if (codePoint < 0x10000) {
        return new byte[] {
            (byte) (0xE0 | (codePoint >> 12)),
            (byte) (0x80 | ((codePoint >> 6) & 0x3F)),
            (byte) (0x80 | (codePoint & 0x3F))};
      }
      return new byte[] {
          (byte) (0xF0 | (codePoint >> 18)),
          (byte) (0x80 | ((codePoint >> 12) & 0x3F)),
          (byte) (0x80 | ((codePoint >> 6) & 0x3F)),
          (byte) (0x80 | (codePoint & 0x3F))};
    }
  }

  @NotThreadSafe
  private static class Utf16Encoder extends ByteEncoder {
    private final boolean bigEndian;

    Utf16Encoder(ChannelWriter out, TextEncoding encoding, boolean bigEndian) {
      super(out, encoding);
      this.bigEndian = bigEndian;
    }

    @Override
    byte[] bytes(int codePoint) {
      checkNotSurrogate(codePoint);
      char[] units = Character.toChars(codePoint);
      byte[] bytes = new byte[units.length * 2];
      for (int i = 0; i < units.length; i += 1) {
        byte high = (byte) (units[i] >> 8);
        byte low = (byte) units[i];
        bytes[2 * i] = bigEndian ? high : low;
        bytes[2 * i + 1] = bigEndian ? low : high;
      }
      return bytes;
    }
  }

  @NotThreadSafe
  private static class Utf32Encoder extends ByteEncoder {
    private final boolean bigEndian;

    Utf32Encoder(ChannelWriter out, TextEncoding encoding, boolean bigEndian) {
      super(out, encoding);
      this.bigEndian = bigEndian;
    }

    @Override
    byte[] bytes(int codePoint) {
      checkNotSurrogate(codePoint);
      byte[] bytes = new byte[4];
      for (int i = 0; i < 4; i += 1) {
        byte b = (byte) (codePoint >> (8 * (3 - i)));
        bytes[bigEndian ? i : 3 - i] = b;
      }
      return bytes;
    }
  }

  /**
   * Encodes through the JDK's table for the charset, reporting any character
   * the table does not map.
   */
  @NotThreadSafe
  private static class CharsetScalarEncoder extends ByteEncoder {
    private final CharsetEncoder encoder;

    CharsetScalarEncoder(ChannelWriter out, TextEncoding encoding) {
      super(out, encoding);
      this.encoder = encoding.charset().newEncoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    @Override
    byte[] bytes(int codePoint) {
      ByteBuffer encoded;
      try {
        encoded = encoder.encode(CharBuffer.wrap(Character.toChars(codePoint)));
      } catch (CharacterCodingException e) {
        throw new CSVEncodingException(encoding.charsetName(), codePoint, e);
      }
      byte[] bytes = new byte[encoded.remaining()];
      encoded.get(bytes);
      return bytes;
    }
  }
}
