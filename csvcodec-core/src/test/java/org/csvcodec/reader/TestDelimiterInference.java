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

package org.csvcodec.reader;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.csvcodec.CSVInferenceException;
import org.csvcodec.Delimiters;
import org.csvcodec.TestHelpers;
import org.csvcodec.spi.BufferedCodePointSource;
import org.csvcodec.spi.CodePointSource;
import org.csvcodec.spi.ReaderCodePointSource;
import org.junit.Assert;
import org.junit.Test;

public class TestDelimiterInference {

  @Test
  public void testInferBothDelimiters() {
    String csv = "a,b,c\n1,2,3\n4,5,6\n";
    BufferedCodePointSource source = source(csv);
    Delimiters delimiters = DelimiterInference.inferDelimiters(source);
    Assert.assertEquals(",", delimiters.fieldString());
    Assert.assertEquals("\n", delimiters.rowString());
    Assert.assertEquals("Sampled input should be restored",
        csv, drain(source));
  }

  @Test
  public void testInferSemicolonAndCRLF() {
    Delimiters delimiters = DelimiterInference.inferDelimiters(
        source("a;b;c\r\n1;2;3\r\n"));
    Assert.assertEquals(Delimiters.of(";", "\r\n"), delimiters);
  }

  @Test
  public void testInferCarriageReturn() {
    Delimiters delimiters = DelimiterInference.inferDelimiters(
        source("a,b\rc,d\r"));
    Assert.assertEquals(Delimiters.of(",", "\r"), delimiters);
  }

  @Test
  public void testQuotedLineBreaksAreIgnored() {
    Delimiters delimiters = DelimiterInference.inferDelimiters(
        source("\"x\r\ny\",1\n2,3\n"));
    Assert.assertEquals(Delimiters.of(",", "\n"), delimiters);
  }

  @Test
  public void testQuotedCandidatesAreIgnored() {
    Delimiters delimiters = DelimiterInference.inferDelimiters(
        source("name\tnote\nx\t\"a,b\"\ny\tc\n"));
    Assert.assertEquals(Delimiters.of("\t", "\n"), delimiters);
  }

  @Test
  public void testQuoteInsideUnquotedFieldIsLiteral() {
    String csv = "a,5\" pipe\nb,6\nc,7\n";
    Assert.assertEquals(Delimiters.of(",", "\n"),
        DelimiterInference.inferDelimiters(source(csv)));
    Assert.assertEquals(Delimiters.of(",", "\n"),
        DelimiterInference.inferRowDelimiter(source(csv), new int[] {','}));
  }

  @Test
  public void testDoubledQuoteKeepsFieldQuoted() {
    Delimiters delimiters = DelimiterInference.inferDelimiters(
        source("\"say \"\"hi\r\n\"\"\",1\n2,3\n"));
    Assert.assertEquals(Delimiters.of(",", "\n"), delimiters);
  }

  @Test
  public void testMostFieldsWins() {
    Delimiters delimiters = DelimiterInference.inferDelimiters(
        source("a,b;c;d\n1,2;3;4\n"));
    Assert.assertEquals(";", delimiters.fieldString());
  }

  @Test
  public void testTiesGoToEarlierCandidate() {
    Delimiters delimiters = DelimiterInference.inferDelimiters(
        source("a,b;c\n1,2;3\n"));
    Assert.assertEquals(",", delimiters.fieldString());
  }

  @Test
  public void testInferFieldDelimiterWithKnownRow() {
    Delimiters delimiters = DelimiterInference.inferFieldDelimiter(
        source("a|b\n1|2\n"), new int[] {'\n'});
    Assert.assertEquals(Delimiters.of("|", "\n"), delimiters);
  }

  @Test
  public void testInferRowDelimiterWithKnownField() {
    BufferedCodePointSource source = source("a,b\r\n1,2\r\n");
    Delimiters delimiters = DelimiterInference.inferRowDelimiter(
        source, new int[] {','});
    Assert.assertEquals(Delimiters.of(",", "\r\n"), delimiters);
    Assert.assertEquals("a,b\r\n1,2\r\n", drain(source));
  }

  @Test
  public void testSingleRowFails() {
    final BufferedCodePointSource source = source("a,b,c\n");
    CSVInferenceException e = TestHelpers.assertThrows(
        "Should not guess from one row",
        CSVInferenceException.class, new Runnable() {
          @Override
          public void run() {
            DelimiterInference.inferDelimiters(source);
          }
        });
    Assert.assertEquals(1, e.getSampledRows());
    Assert.assertEquals("Input should be restored after a failure",
        "a,b,c\n", drain(source));

    TestHelpers.assertThrows("Should not guess a row delimiter from one row",
        CSVInferenceException.class, new Runnable() {
          @Override
          public void run() {
            DelimiterInference.inferRowDelimiter(source("a,b\n"),
                new int[] {','});
          }
        });
  }

  @Test
  public void testEmptyInputFails() {
    CSVInferenceException e = TestHelpers.assertThrows(
        "Should not guess from empty input",
        CSVInferenceException.class, new Runnable() {
          @Override
          public void run() {
            DelimiterInference.inferDelimiters(source(""));
          }
        });
    Assert.assertEquals("row delimiter", e.getTarget());
  }

  @Test
  public void testNoLineBreakFails() {
    TestHelpers.assertThrows("Should not guess without a line break",
        CSVInferenceException.class, new Runnable() {
          @Override
          public void run() {
            DelimiterInference.inferDelimiters(source("a,b,c"));
          }
        });
  }

  @Test
  public void testInconsistentRowsFail() {
    TestHelpers.assertThrows("Should reject ragged rows",
        CSVInferenceException.class, new Runnable() {
          @Override
          public void run() {
            DelimiterInference.inferDelimiters(source("a,b\n1,2,3\nx\n"));
          }
        });
  }

  @Test
  public void testTruncatedSampleDropsPartialRow() {
    String csv = "a,b\nc,d\ne,f\n";
    BufferedCodePointSource source = source(csv);
    Sample sample = Sample.take(source, 10);
    Assert.assertFalse(sample.isComplete());
    List<List<String>> rows = sample.rows(Delimiters.of(",", "\n"),
        TestCSVReader.NO_TRIM);
    Assert.assertEquals(ImmutableList.of(
        ImmutableList.of("a", "b"),
        ImmutableList.of("c", "d")), rows);
    Assert.assertEquals(csv, drain(source));
  }

  @Test
  public void testSampleRowLimit() {
    StringBuilder csv = new StringBuilder();
    for (int i = 0; i < Sample.MAX_ROWS + 5; i += 1) {
      csv.append(i).append(",x\n");
    }
    Sample sample = Sample.take(source(csv.toString()));
    Assert.assertTrue(sample.isComplete());
    Assert.assertEquals(Sample.MAX_ROWS,
        sample.rows(Delimiters.of(",", "\n"), TestCSVReader.NO_TRIM).size());
  }

  static BufferedCodePointSource source(String csv) {
    return new BufferedCodePointSource(ReaderCodePointSource.of(csv));
  }

  static String drain(CodePointSource source) {
    StringBuilder sb = new StringBuilder();
    int c;
    while ((c = source.read()) != CodePointSource.END) {
      sb.appendCodePoint(c);
    }
    return sb.toString();
  }
}
