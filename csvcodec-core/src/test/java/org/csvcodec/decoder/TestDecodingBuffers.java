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

import com.google.common.collect.ImmutableList;
import org.csvcodec.BufferingStrategy;
import org.csvcodec.CSVBufferException;
import org.csvcodec.CSVProperties;
import org.csvcodec.TestHelpers;
import org.csvcodec.reader.CSVReader;
import org.junit.Assert;
import org.junit.Test;

public class TestDecodingBuffers {

  private static final String CSV =
      "id,name,id\n0,zero,a\n1,one,b\n2,two,c\n3,three,d\n";

  private static final CSVDecoderConfiguration KEEP_ALL =
      new CSVDecoderConfiguration(
          new CSVProperties.Builder().hasHeader().build(),
          BufferingStrategy.KEEP_ALL);

  private static final CSVDecoderConfiguration SEQUENTIAL =
      KEEP_ALL.withBuffering(BufferingStrategy.SEQUENTIAL);

  @Test
  public void testKeepAllServesAnyRow() {
    DecodingBuffer buffer = DecodingBuffers.open(CSV, KEEP_ALL);
    Assert.assertEquals(BufferingStrategy.KEEP_ALL, buffer.getStrategy());
    Assert.assertEquals("three", buffer.getField(3, 1));
    Assert.assertEquals(4, buffer.getRowsParsed());
    Assert.assertEquals("zero", buffer.getField(0, 1));
    Assert.assertEquals("two", buffer.getField(2, "name"));
    Assert.assertEquals(ImmutableList.of("1", "one", "b"),
        buffer.getRow(1).getFields());
    Assert.assertEquals("three", buffer.getField(3, 1));
    Assert.assertEquals("Rows should be parsed once", 4,
        buffer.getRowsParsed());
  }

  @Test
  public void testKeepAllPastTheEnd() {
    final DecodingBuffer buffer = DecodingBuffers.open(CSV, KEEP_ALL);
    Assert.assertTrue(buffer.hasRow(3));
    Assert.assertFalse(buffer.hasRow(4));
    CSVBufferException e = TestHelpers.assertThrows(
        "Should reject rows past the end",
        CSVBufferException.class, new Runnable() {
          @Override
          public void run() {
            buffer.getRow(7);
          }
        });
    Assert.assertEquals(7, e.getRequestedRow());
    Assert.assertEquals(0, e.getFirstRetainedRow());
    Assert.assertEquals("Earlier rows should still be served",
        "0", buffer.getField(0, "id"));
  }

  @Test
  public void testSequentialMovesForward() {
    DecodingBuffer buffer = DecodingBuffers.open(CSV, SEQUENTIAL);
    Assert.assertEquals(BufferingStrategy.SEQUENTIAL, buffer.getStrategy());
    Assert.assertEquals("zero", buffer.getField(0, 1));
    Assert.assertEquals("Fields of the current row in any order",
        "a", buffer.getField(0, 2));
    Assert.assertEquals("0", buffer.getField(0, 0));
    Assert.assertEquals("two", buffer.getField(2, "name"));
    Assert.assertEquals("Current row may be requested again",
        "c", buffer.getField(2, 2));
    Assert.assertEquals(3, buffer.getRowsParsed());
  }

  @Test
  public void testSequentialRejectsDiscardedRows() {
    final DecodingBuffer buffer = DecodingBuffers.open(CSV, SEQUENTIAL);
    buffer.getRow(2);
    CSVBufferException e = TestHelpers.assertThrows(
        "Should reject a discarded row",
        CSVBufferException.class, new Runnable() {
          @Override
          public void run() {
            buffer.getRow(1);
          }
        });
    Assert.assertEquals(BufferingStrategy.SEQUENTIAL, e.getStrategy());
    Assert.assertEquals(1, e.getRequestedRow());
    Assert.assertEquals(2, e.getFirstRetainedRow());

    TestHelpers.assertThrows("Should reject row 0 after a jump",
        CSVBufferException.class, new Runnable() {
          @Override
          public void run() {
            buffer.hasRow(0);
          }
        });
  }

  @Test
  public void testSequentialPastTheEnd() {
    final DecodingBuffer buffer = DecodingBuffers.open(CSV, SEQUENTIAL);
    Assert.assertFalse(buffer.hasRow(9));
    Assert.assertEquals("Last row stays current at the end",
        "three", buffer.getField(3, "name"));
  }

  @Test
  public void testInvalidAccessPaths() {
    final DecodingBuffer buffer = DecodingBuffers.open(CSV, KEEP_ALL);
    TestHelpers.assertThrows("Should reject unknown header",
        CSVBufferException.class, new Runnable() {
          @Override
          public void run() {
            buffer.getField(0, "missing");
          }
        });
    TestHelpers.assertThrows("Should reject column out of range",
        CSVBufferException.class, new Runnable() {
          @Override
          public void run() {
            buffer.getField(0, 3);
          }
        });
    TestHelpers.assertThrows("Should reject negative row",
        CSVBufferException.class, new Runnable() {
          @Override
          public void run() {
            buffer.getRow(-1);
          }
        });
  }

  @Test
  public void testDuplicateHeaderUsesFirstColumn() {
    DecodingBuffer buffer = DecodingBuffers.open(CSV, KEEP_ALL);
    Assert.assertEquals(ImmutableList.of("id", "name", "id"),
        buffer.getHeaders());
    Assert.assertEquals("1", buffer.getField(1, "id"));
  }

  @Test
  public void testRequiresInitializedReader() {
    final CSVReader reader = new CSVReader(CSV,
        new CSVProperties.Builder().build());
    TestHelpers.assertThrows("Should reject a reader that is not open",
        IllegalArgumentException.class, new Runnable() {
          @Override
          public void run() {
            DecodingBuffers.newBuffer(reader, BufferingStrategy.KEEP_ALL);
          }
        });
  }
}
