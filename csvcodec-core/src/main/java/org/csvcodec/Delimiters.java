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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import java.util.Arrays;
import javax.annotation.concurrent.Immutable;
import org.apache.commons.lang.StringEscapeUtils;

/**
 * A resolved pair of field and row delimiters, each a non-empty sequence of
 * code points. The two are never equal.
 */
@Immutable
public final class Delimiters {

  public static final int QUOTE = '"';

  private final int[] field;
  private final int[] row;

  private Delimiters(int[] field, int[] row) {
    this.field = field;
    this.row = row;
  }

  /**
   * @throws CSVConfigurationException if either delimiter is empty, both are
   *         equal, or one contains the quote character
   */
  public static Delimiters of(String field, String row) {
    Preconditions.checkNotNull(field, "Field delimiter cannot be null");
    Preconditions.checkNotNull(row, "Row delimiter cannot be null");
    return of(codePoints(field), codePoints(row));
  }

  public static Delimiters of(int[] field, int[] row) {
    CSVConfigurationException.check(field.length > 0,
        "Field delimiter cannot be empty");
    CSVConfigurationException.check(row.length > 0,
        "Row delimiter cannot be empty");
    CSVConfigurationException.check(!Arrays.equals(field, row),
        "Field and row delimiters cannot be equal: \"%s\"",
        StringEscapeUtils.escapeJava(toString(field)));
    CSVConfigurationException.check(!contains(field, QUOTE),
        "Field delimiter cannot contain the quote character");
    CSVConfigurationException.check(!contains(row, QUOTE),
        "Row delimiter cannot contain the quote character");
    return new Delimiters(field.clone(), row.clone());
  }

  public int[] field() {
    return field.clone();
  }

  public int[] row() {
    return row.clone();
  }

  public String fieldString() {
    return toString(field);
  }

  public String rowString() {
    return toString(row);
  }

  /**
   * @return {@code true} if the code point appears in either delimiter
   */
  public boolean isDelimiterScalar(int codePoint) {
    return contains(field, codePoint) || contains(row, codePoint);
  }

  public static int[] codePoints(String value) {
    return value.codePoints().toArray();
  }

  static String toString(int[] codePoints) {
    return new String(codePoints, 0, codePoints.length);
  }

  private static boolean contains(int[] codePoints, int codePoint) {
    for (int c : codePoints) {
      if (c == codePoint) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    Delimiters other = (Delimiters) obj;
    return Arrays.equals(field, other.field) && Arrays.equals(row, other.row);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(field) + Arrays.hashCode(row);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("field", StringEscapeUtils.escapeJava(fieldString()))
        .add("row", StringEscapeUtils.escapeJava(rowString()))
        .toString();
  }
}
