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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Set;
import org.csvcodec.CSVInferenceException;
import org.csvcodec.Delimiters;
import org.csvcodec.MalformedCSVException;
import org.csvcodec.spi.BufferedCodePointSource;
import org.csvcodec.spi.CodePointSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Guesses the field and row delimiters from a sampled prefix of the input.
 * </p>
 * <p>
 * The row delimiter is the line break found outside quoted fields: CRLF when
 * every line break is a CRLF pair, otherwise the more frequent of a lone LF or
 * a lone CR. The field delimiter is the candidate that splits every sampled
 * row into the same number of fields, more than one; when several do, the one
 * giving the most fields wins and remaining ties go to the earlier candidate
 * in {@link #FIELD_CANDIDATES}.
 * </p>
 * <p>
 * Only the single-character candidates are tried for the field delimiter; a
 * multi-character field delimiter has to be configured explicitly. At least
 * two rows are needed. The sampled code points are always pushed back into the
 * source.
 * </p>
 */
public class DelimiterInference {

  private static final Logger LOG = LoggerFactory
      .getLogger(DelimiterInference.class);

  @VisibleForTesting
  static final List<Integer> FIELD_CANDIDATES = ImmutableList.of(
      (int) ',', (int) ';', (int) '\t', (int) '|', (int) ':', (int) '^');

  private static final int CR = '\r';
  private static final int LF = '\n';
  private static final Set<Integer> NO_TRIM = ImmutableSet.of();

  private DelimiterInference() {
  }

  /**
   * @throws CSVInferenceException if no candidate splits the sampled rows
   *         consistently
   */
  public static Delimiters inferFieldDelimiter(BufferedCodePointSource source,
                                               int[] rowDelimiter) {
    Sample sample = Sample.take(source);
    Delimiters delimiters = fieldDelimiter(sample, rowDelimiter);
    LOG.debug("Inferred field delimiter: {}", delimiters);
    return delimiters;
  }

  /**
   * @throws CSVInferenceException if the sample holds fewer than two rows
   */
  public static Delimiters inferRowDelimiter(BufferedCodePointSource source,
                                             int[] fieldDelimiter) {
    Preconditions.checkArgument(fieldDelimiter.length > 0,
        "Field delimiter cannot be empty");
    Sample sample = Sample.take(source);
    int[] row = rowDelimiter(sample,
        ImmutableSet.of(fieldDelimiter[fieldDelimiter.length - 1]));
    Delimiters delimiters = Delimiters.of(fieldDelimiter, row);
    checkRows(sample, delimiters, "row delimiter");
    LOG.debug("Inferred row delimiter: {}", delimiters);
    return delimiters;
  }

  /**
   * @throws CSVInferenceException if either delimiter cannot be determined
   */
  public static Delimiters inferDelimiters(BufferedCodePointSource source) {
    Sample sample = Sample.take(source);
    Delimiters delimiters = fieldDelimiter(sample, rowDelimiter(sample));
    LOG.debug("Inferred delimiters: {}", delimiters);
    return delimiters;
  }

  private static Delimiters fieldDelimiter(Sample sample, int[] rowDelimiter) {
    Delimiters best = null;
    int bestFields = 1;
    int sampledRows = 0;
    for (int candidate : FIELD_CANDIDATES) {
      if (contains(rowDelimiter, candidate)) {
        continue;
      }
      Delimiters delimiters = Delimiters.of(new int[] {candidate}, rowDelimiter);
      List<List<String>> rows;
      try {
        rows = sample.rows(delimiters, NO_TRIM);
      } catch (MalformedCSVException e) {
        LOG.debug("Rejecting field delimiter candidate {}: {}",
            describe(candidate), e.getMessage());
        continue;
      }
      sampledRows = Math.max(sampledRows, rows.size());
      if (rows.size() < 2) {
        continue;
      }
      int fields = consistentFieldCount(rows);
      if (fields > bestFields) {
        best = delimiters;
        bestFields = fields;
      }
    }

    if (sampledRows < 2) {
      throw new CSVInferenceException("field delimiter", sampledRows,
          "at least two rows are needed");
    }
    if (best == null) {
      throw new CSVInferenceException("field delimiter", sampledRows,
          "no candidate splits every row into the same number of fields");
    }
    return best;
  }

  /**
   * @return the field count shared by every row, or 0 if the counts differ
   */
  private static int consistentFieldCount(List<List<String>> rows) {
    int fields = rows.get(0).size();
    for (List<String> row : rows) {
      if (row.size() != fields) {
        return 0;
      }
    }
    return fields;
  }

  @VisibleForTesting
  static int[] rowDelimiter(Sample sample) {
    return rowDelimiter(sample, ImmutableSet.copyOf(FIELD_CANDIDATES));
  }

  /**
   * Counts line breaks outside quoted fields. A quote opens a quoted field
   * only at the start of the sample, after a line break, or after one of
   * {@code fieldDelimiters}.
   */
  private static int[] rowDelimiter(Sample sample,
                                    Set<Integer> fieldDelimiters) {
    if (sample.isEmpty()) {
      throw new CSVInferenceException("row delimiter", 0, "the input is empty");
    }

    int crlf = 0;
    int lf = 0;
    int cr = 0;
    boolean quoted = false;
    int previous = CodePointSource.END;
    List<Integer> codePoints = sample.codePoints();
    for (int i = 0; i < codePoints.size(); i += 1) {
      int c = codePoints.get(i);
      if (quoted) {
        if (c == Delimiters.QUOTE) {
          if (i + 1 < codePoints.size() &&
              codePoints.get(i + 1) == Delimiters.QUOTE) {
            i += 1;
          } else {
            quoted = false;
          }
        }
      } else if (c == Delimiters.QUOTE) {
        // a quote inside an unquoted field is literal
        quoted = startsField(previous, fieldDelimiters);
      } else if (c == CR) {
        if (i + 1 < codePoints.size() && codePoints.get(i + 1) == LF) {
          crlf += 1;
          i += 1;
        } else {
          cr += 1;
        }
      } else if (c == LF) {
        lf += 1;
      }
      previous = c;
    }

    LOG.debug("Line breaks outside quotes: CRLF={}, LF={}, CR={}",
        new Object[] {crlf, lf, cr});

    if (crlf > 0 && lf == 0 && cr == 0) {
      return new int[] {CR, LF};
    } else if (lf + crlf > 0 && lf >= cr) {
      return new int[] {LF};
    } else if (cr > 0) {
      return new int[] {CR};
    }
    throw new CSVInferenceException("row delimiter", 1,
        "no line break found outside quoted fields");
  }

  private static boolean startsField(int previous,
                                     Set<Integer> fieldDelimiters) {
    return previous == CodePointSource.END || previous == CR ||
        previous == LF || fieldDelimiters.contains(previous);
  }

  private static void checkRows(Sample sample, Delimiters delimiters,
                                String target) {
    List<List<String>> rows;
    try {
      rows = sample.rows(delimiters, NO_TRIM);
    } catch (MalformedCSVException e) {
      throw new CSVInferenceException(target, 0,
          "the sample is not valid CSV: " + e.getMessage());
    }
    if (rows.size() < 2) {
      throw new CSVInferenceException(target, rows.size(),
          "at least two rows are needed");
    }
  }

  private static boolean contains(int[] codePoints, int codePoint) {
    for (int c : codePoints) {
      if (c == codePoint) {
        return true;
      }
    }
    return false;
  }

  private static String describe(int codePoint) {
    return String.format("U+%04X", codePoint);
  }
}
