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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.channels.Channels;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.Charset;
import java.util.Arrays;
import java.util.List;
import org.csvcodec.BOMStrategy;
import org.csvcodec.CSVEncodingException;
import org.csvcodec.CSVProperties;
import org.csvcodec.CSVStreamException;
import org.csvcodec.Row;
import org.csvcodec.TestHelpers;
import org.csvcodec.reader.CSVReader;
import org.junit.Assert;
import org.junit.Test;

public class TestCSVWriter {

  private static final CSVProperties DEFAULTS =
      new CSVProperties.Builder().build();

  @Test
  public void testPlainRows() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    CSVWriter writer = new CSVWriter(bytes, DEFAULTS);
    writer.initialize();
    writer.writeHeaders(ImmutableList.of("id", "name"));
    writer.writeRow("1", "ann");
    writer.flush();
    Assert.assertEquals("id,name\n1,ann\n", decode(bytes, "UTF-8"));
    Assert.assertEquals(2, writer.getRowsWritten());
    writer.close();
    Assert.assertFalse(writer.isOpen());
  }

  @Test
  public void testQuoting() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    CSVWriter writer = new CSVWriter(bytes, DEFAULTS);
    writer.initialize();
    writer.writeRow("a,b", "say \"hi\"", "two\nlines", "plain");
    writer.writeRow("");
    writer.writeRow("", "");
    writer.writeRow(ImmutableList.<String>of());
    writer.close();
    Assert.assertEquals(
        "\"a,b\",\"say \"\"hi\"\"\",\"two\nlines\",plain\n" +
        "\"\"\n" +
        ",\n" +
        "\n",
        decode(bytes, "UTF-8"));
  }

  @Test
  public void testQuotesTrimmedEnds() {
    CSVProperties props = new CSVProperties.Builder()
        .trimWhitespace()
        .build();
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    CSVWriter writer = new CSVWriter(bytes, props);
    writer.initialize();
    writer.writeRow(" padded", "inner space", "tail ");
    writer.close();
    Assert.assertEquals("\" padded\",inner space,\"tail \"\n",
        decode(bytes, "UTF-8"));
  }

  @Test
  public void testByteOrderMark() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    CSVWriter writer = new CSVWriter(bytes,
        new CSVProperties.Builder().charset("UTF-16").build());
    writer.initialize();
    writer.writeRow("A");
    writer.close();
    Assert.assertArrayEquals(
        new byte[] {(byte) 0xFE, (byte) 0xFF, 0x00, 0x41, 0x00, 0x0A},
        bytes.toByteArray());

    bytes = new ByteArrayOutputStream();
    writer = new CSVWriter(bytes, new CSVProperties.Builder()
        .charset("UTF-8").bom(BOMStrategy.ALWAYS).build());
    writer.initialize();
    writer.close();
    Assert.assertArrayEquals(
        new byte[] {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF},
        bytes.toByteArray());
  }

  @Test
  public void testUnsupportedCharset() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    final CSVWriter writer = new CSVWriter(bytes,
        new CSVProperties.Builder()
            .charset("ISO-8859-1").bom(BOMStrategy.ALWAYS).build());
    TestHelpers.assertThrows("Should reject an unsupported charset",
        CSVEncodingException.class, new Runnable() {
          @Override
          public void run() {
            writer.initialize();
          }
        });
    Assert.assertEquals(0, bytes.size());
    TestHelpers.assertThrows("Should not write after a failure",
        IllegalStateException.class, new Runnable() {
          @Override
          public void run() {
            writer.writeRow("a");
          }
        });
  }

  @Test
  public void testUnencodableFieldIsFatal() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    final CSVWriter writer = new CSVWriter(bytes,
        new CSVProperties.Builder().charset("US-ASCII").build());
    writer.initialize();
    CSVEncodingException e = TestHelpers.assertThrows(
        "Should reject a non-ASCII field",
        CSVEncodingException.class, new Runnable() {
          @Override
          public void run() {
            writer.writeRow("ok", "caf\u00e9");
          }
        });
    Assert.assertEquals(0xE9, e.getCodePoint());
    Assert.assertFalse(writer.isOpen());
  }

  @Test
  public void testStalledChannel() {
    TestChannelWriter.TrickleChannel channel =
        new TestChannelWriter.TrickleChannel(0, false);
    final CSVWriter writer = new CSVWriter(channel, DEFAULTS);
    writer.initialize();
    CSVStreamException e = TestHelpers.assertThrows(
        "Should fail when the channel accepts nothing",
        CSVStreamException.class, new Runnable() {
          @Override
          public void run() {
            writer.writeRow("a");
          }
        });
    Assert.assertEquals(2, e.getAttempts());
    Assert.assertEquals(2, channel.calls);
  }

  @Test
  public void testRoundTrip() {
    List<List<String>> rows = Lists.newArrayList();
    rows.add(ImmutableList.of("plain", "with,comma", "with \"quote\""));
    rows.add(ImmutableList.of("multi\r\nline", "", "\"\"\""));
    rows.add(ImmutableList.of(""));
    rows.add(ImmutableList.<String>of());
    rows.add(ImmutableList.of("emoji \uD83D\uDE00", " lead", "trail ", ";;"));

    List<CSVProperties> settings = ImmutableList.of(
        DEFAULTS,
        new CSVProperties.Builder()
            .fieldDelimiter(";;").rowDelimiter("\r\n").build(),
        new CSVProperties.Builder()
            .charset("UTF-16").trimWhitespace().build(),
        new CSVProperties.Builder()
            .charset("UTF-32LE").fieldDelimiter("\t").build(),
        new CSVProperties.Builder()
            .charset("UTF-16LE").fieldDelimiter("|").rowDelimiter("\r")
            .trim("_").build());

    for (CSVProperties props : settings) {
      ByteArrayOutputStream bytes = new ByteArrayOutputStream();
      CSVWriter writer = new CSVWriter(bytes, props);
      writer.initialize();
      for (List<String> row : rows) {
        writer.writeRow(row);
      }
      writer.close();

      CSVReader reader = new CSVReader(
          new ByteArrayInputStream(bytes.toByteArray()), props);
      reader.initialize();
      List<List<String>> read = Lists.newArrayList();
      for (Row row : reader.readAll()) {
        read.add(row.getFields());
      }
      reader.close();
      Assert.assertEquals("Round trip with " + props, rows, read);
    }
  }

  @Test
  public void testLifecycle() {
    final CSVWriter writer = new CSVWriter(new ByteArrayOutputStream(),
        DEFAULTS);
    TestHelpers.assertThrows("Should not write before initialize",
        IllegalStateException.class, new Runnable() {
          @Override
          public void run() {
            writer.writeRow("a");
          }
        });
    writer.initialize();
    writer.writeRow("a");
    TestHelpers.assertThrows("Headers must come first",
        IllegalStateException.class, new Runnable() {
          @Override
          public void run() {
            writer.writeHeaders(ImmutableList.of("h"));
          }
        });
    writer.close();
    writer.close();
    TestHelpers.assertThrows("Should not write after close",
        IllegalStateException.class, new Runnable() {
          @Override
          public void run() {
            writer.writeRow("b");
          }
        });
  }

  @Test
  public void testNullFieldRejectedBeforeWriting() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    final CSVWriter writer = new CSVWriter(bytes, DEFAULTS);
    writer.initialize();
    TestHelpers.assertThrows("Null fields are rejected",
        IllegalArgumentException.class, new Runnable() {
          @Override
          public void run() {
            writer.writeRow(Arrays.asList("abc", null));
          }
        });
    Assert.assertTrue(writer.isOpen());
    writer.writeRow("x", "y");
    writer.flush();
    Assert.assertEquals("x,y\n", decode(bytes, "UTF-8"));
    Assert.assertEquals(1, writer.getRowsWritten());
  }

  @Test
  public void testFailureMidRowIsFatal() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    final CSVWriter writer = new CSVWriter(bytes, DEFAULTS);
    writer.initialize();
    TestHelpers.assertThrows("Lone surrogates cannot be encoded",
        CSVEncodingException.class, new Runnable() {
          @Override
          public void run() {
            writer.writeRow("ok", "\uD800");
          }
        });
    Assert.assertFalse(writer.isOpen());
    TestHelpers.assertThrows("Should not write after a failed row",
        IllegalStateException.class, new Runnable() {
          @Override
          public void run() {
            writer.writeRow("x");
          }
        });
  }

  @Test
  public void testCloseLeavesSinkOpen() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    WritableByteChannel channel = Channels.newChannel(bytes);
    CSVWriter writer = new CSVWriter(channel, DEFAULTS);
    writer.initialize();
    writer.writeRow("a");
    writer.close();
    Assert.assertFalse(writer.isOpen());
    Assert.assertTrue(channel.isOpen());
    Assert.assertEquals("a\n", decode(bytes, "UTF-8"));
  }

  private static String decode(ByteArrayOutputStream bytes, String charset) {
    return new String(bytes.toByteArray(), Charset.forName(charset));
  }
}
