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
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.csvcodec.CSVInferenceException;
import org.csvcodec.Delimiters;
import org.csvcodec.MalformedCSVException;
import org.csvcodec.spi.BufferedCodePointSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Decides whether the first row is a header by comparing its shape with the
 * rows that follow.
 * </p>
 * <p>
 * Each column votes. A column whose later values all look numeric votes for a
 * header when its first value does not, and against one when its first value
 * is numeric too. A text column votes against a header when its first value
 * repeats further down. The first row is a header when the votes in favor
 * outnumber the votes against.
 * </p>
 */
public class HeaderInference {

  private static final Logger LOG = LoggerFactory
      .getLogger(HeaderInference.class);

  private static final Pattern NUMBER = Pattern.compile(
      "[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?[dDfFlL]?");

  private HeaderInference() {
  }

  /**
   * @throws CSVInferenceException if fewer than two rows could be sampled
   */
  public static boolean inferHeader(BufferedCodePointSource source,
                                    Delimiters delimiters, Set<Integer> trim) {
    Sample sample = Sample.take(source);
    List<List<String>> rows;
    try {
      rows = sample.rows(delimiters, trim);
    } catch (MalformedCSVException e) {
      throw new CSVInferenceException("header", 0,
          "the sample is not valid CSV: " + e.getMessage());
    }
    if (rows.size() < 2) {
      throw new CSVInferenceException("header", rows.size(),
          "at least two rows are needed");
    }

    int votes = 0;
    List<String> first = rows.get(0);
    for (int column = 0; column < first.size(); column += 1) {
      votes += vote(rows, column);
    }

    LOG.debug("Header votes over {} rows: {}", rows.size(), votes);
    return votes > 0;
  }

  private static int vote(List<List<String>> rows, int column) {
    String first = rows.get(0).get(column);
    boolean sawValue = false;
    boolean allNumeric = true;
    boolean repeated = false;
    for (List<String> row : rows.subList(1, rows.size())) {
      if (column >= row.size() || row.get(column).isEmpty()) {
        continue;
      }
      String value = row.get(column);
      sawValue = true;
      allNumeric &= isNumeric(value);
      repeated |= value.equals(first);
    }

    if (!sawValue) {
      return 0;
    } else if (allNumeric) {
      if (isNumeric(first)) {
        return -1;
      }
      return first.isEmpty() ? 0 : 1;
    }
    return repeated ? -1 : 0;
  }

  @VisibleForTesting
  static boolean isNumeric(String value) {
    return NUMBER.matcher(value).matches();
  }
}
