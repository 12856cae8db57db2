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
import com.google.common.collect.ImmutableSet;
import java.util.Properties;
import java.util.Set;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import org.apache.commons.lang.StringEscapeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Settings shared by CSV readers and writers.
 * </p>
 * <p>
 * A {@code null} field or row delimiter is inferred from the input when
 * reading; writers fall back to {@link #DEFAULT_FIELD_DELIMITER} and
 * {@link #DEFAULT_ROW_DELIMITER}. The quote character is always
 * {@code "}.
 * </p>
 */
@Immutable
public class CSVProperties {
  private static final Logger LOG = LoggerFactory
      .getLogger(CSVProperties.class);

  public static final String CHARSET_PROPERTY = "csv.charset";
  public static final String FIELD_DELIMITER_PROPERTY = "csv.field-delimiter";
  public static final String ROW_DELIMITER_PROPERTY = "csv.row-delimiter";
  public static final String HEADER_PROPERTY = "csv.header";
  public static final String TRIM_PROPERTY = "csv.trim";
  public static final String BOM_PROPERTY = "csv.bom";

  /** Property value asking for a delimiter to be inferred. */
  public static final String INFER = "infer";
  public static final String TRIM_NONE = "none";
  public static final String TRIM_WHITESPACE = "whitespace";

  public static final String DEFAULT_CHARSET = "utf8";
  public static final String DEFAULT_FIELD_DELIMITER = ",";
  public static final String DEFAULT_ROW_DELIMITER = "\n";
  public static final HeaderStrategy DEFAULT_HEADER = HeaderStrategy.NONE;
  public static final BOMStrategy DEFAULT_BOM = BOMStrategy.CONVENTION;

  /**
   * Tab and the Unicode space separators.
   */
  public static final Set<Integer> WHITESPACE = whitespace();

  // configuration
  public final String charset;
  @Nullable
  public final String fieldDelimiter;
  @Nullable
  public final String rowDelimiter;
  public final HeaderStrategy header;
  public final Set<Integer> trim;
  public final boolean trimWhitespace;
  public final BOMStrategy bom;

  private CSVProperties(String charset, @Nullable String fieldDelimiter,
                        @Nullable String rowDelimiter, HeaderStrategy header,
                        Set<Integer> trim, boolean trimWhitespace,
                        BOMStrategy bom) {
    this.charset = charset;
    this.fieldDelimiter = fieldDelimiter;
    this.rowDelimiter = rowDelimiter;
    this.header = header;
    this.trim = ImmutableSet.copyOf(trim);
    this.trimWhitespace = trimWhitespace;
    this.bom = bom;
  }

  /**
   * Reads the settings from {@code csv.*} properties. Missing properties use
   * the defaults and values that cannot be parsed are ignored.
   */
  public static CSVProperties fromProperties(Properties properties) {
    Builder builder = new Builder()
        .charset(coalesce(
            properties.getProperty(CHARSET_PROPERTY), DEFAULT_CHARSET));

    String field = properties.getProperty(FIELD_DELIMITER_PROPERTY);
    if (INFER.equalsIgnoreCase(field)) {
      builder.inferFieldDelimiter();
    } else if (field != null) {
      builder.fieldDelimiter(field);
    }

    String row = properties.getProperty(ROW_DELIMITER_PROPERTY);
    if (INFER.equalsIgnoreCase(row)) {
      builder.inferRowDelimiter();
    } else if (row != null) {
      builder.rowDelimiter(row);
    }

    String header = properties.getProperty(HEADER_PROPERTY);
    if (header != null) {
      try {
        builder.header(HeaderStrategy.valueOf(header.trim().toUpperCase()));
      } catch (IllegalArgumentException ex) {
        LOG.debug("Defaulting header strategy, failed to parse: {}", header);
        // header remains set to the default
      }
    }

    String trim = properties.getProperty(TRIM_PROPERTY);
    if (trim == null || TRIM_NONE.equalsIgnoreCase(trim)) {
      builder.noTrim();
    } else if (TRIM_WHITESPACE.equalsIgnoreCase(trim)) {
      builder.trimWhitespace();
    } else {
      builder.trim(trim);
    }

    String bom = properties.getProperty(BOM_PROPERTY);
    if (bom != null) {
      try {
        builder.bom(BOMStrategy.valueOf(bom.trim().toUpperCase()));
      } catch (IllegalArgumentException ex) {
        LOG.debug("Defaulting BOM strategy, failed to parse: {}", bom);
        // bom remains set to the default
      }
    }

    return builder.build();
  }

  /**
   * Returns the first non-null value from the sequence or null if there is no
   * non-null value.
   */
  private static <T> T coalesce(T... values) {
    for (T value : values) {
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  public Properties toProperties() {
    Properties properties = new Properties();
    properties.setProperty(CHARSET_PROPERTY, charset);
    properties.setProperty(FIELD_DELIMITER_PROPERTY, fieldDelimiter == null ?
        INFER : StringEscapeUtils.escapeJava(fieldDelimiter));
    properties.setProperty(ROW_DELIMITER_PROPERTY, rowDelimiter == null ?
        INFER : StringEscapeUtils.escapeJava(rowDelimiter));
    properties.setProperty(HEADER_PROPERTY, header.name());
    if (trimWhitespace) {
      properties.setProperty(TRIM_PROPERTY, TRIM_WHITESPACE);
    } else if (trim.isEmpty()) {
      properties.setProperty(TRIM_PROPERTY, TRIM_NONE);
    } else {
      StringBuilder chars = new StringBuilder();
      for (int c : trim) {
        chars.appendCodePoint(c);
      }
      properties.setProperty(TRIM_PROPERTY,
          StringEscapeUtils.escapeJava(chars.toString()));
    }
    properties.setProperty(BOM_PROPERTY, bom.name());
    return properties;
  }

  /**
   * @return the trim scalars with any scalar of the given delimiters removed
   *         when the set came from {@link Builder#trimWhitespace()}
   */
  public Set<Integer> trimScalars(Delimiters delimiters) {
    if (!trimWhitespace) {
      return trim;
    }
    ImmutableSet.Builder<Integer> builder = ImmutableSet.builder();
    for (int c : trim) {
      if (!delimiters.isDelimiterScalar(c)) {
        builder.add(c);
      }
    }
    return builder.build();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("charset", charset)
        .add("fieldDelimiter", fieldDelimiter == null ?
            INFER : StringEscapeUtils.escapeJava(fieldDelimiter))
        .add("rowDelimiter", rowDelimiter == null ?
            INFER : StringEscapeUtils.escapeJava(rowDelimiter))
        .add("header", header)
        .add("trim", trimWhitespace ? TRIM_WHITESPACE : trim)
        .add("bom", bom)
        .toString();
  }

  private static Set<Integer> whitespace() {
    ImmutableSet.Builder<Integer> builder = ImmutableSet.builder();
    builder.add((int) '\t');
    for (int c = 0; c <= Character.MAX_VALUE; c += 1) {
      if (Character.getType(c) == Character.SPACE_SEPARATOR) {
        builder.add(c);
      }
    }
    return builder.build();
  }

  public static class Builder {
    private String charset = DEFAULT_CHARSET;
    private String fieldDelimiter = DEFAULT_FIELD_DELIMITER;
    private String rowDelimiter = DEFAULT_ROW_DELIMITER;
    private HeaderStrategy header = DEFAULT_HEADER;
    private Set<Integer> trim = ImmutableSet.of();
    private boolean trimWhitespace = false;
    private BOMStrategy bom = DEFAULT_BOM;

    public Builder() {
    }

    public Builder(CSVProperties props) {
      this.charset = props.charset;
      this.fieldDelimiter = props.fieldDelimiter;
      this.rowDelimiter = props.rowDelimiter;
      this.header = props.header;
      this.trim = props.trim;
      this.trimWhitespace = props.trimWhitespace;
      this.bom = props.bom;
    }

    public Builder charset(String charset) {
      this.charset = charset;
      return this;
    }

    public Builder fieldDelimiter(String delimiter) {
      this.fieldDelimiter = StringEscapeUtils.unescapeJava(delimiter);
      return this;
    }

    public Builder inferFieldDelimiter() {
      this.fieldDelimiter = null;
      return this;
    }

    public Builder rowDelimiter(String delimiter) {
      this.rowDelimiter = StringEscapeUtils.unescapeJava(delimiter);
      return this;
    }

    public Builder inferRowDelimiter() {
      this.rowDelimiter = null;
      return this;
    }

    public Builder header(HeaderStrategy header) {
      this.header = header;
      return this;
    }

    public Builder hasHeader() {
      this.header = HeaderStrategy.FIRST_LINE;
      return this;
    }

    public Builder hasHeader(boolean hasHeader) {
      this.header = hasHeader ? HeaderStrategy.FIRST_LINE : HeaderStrategy.NONE;
      return this;
    }

    public Builder inferHeader() {
      this.header = HeaderStrategy.UNKNOWN;
      return this;
    }

    /**
     * Trim the given characters from both ends of unquoted fields. An empty
     * string turns trimming off.
     */
    public Builder trim(String characters) {
      String chars = StringEscapeUtils.unescapeJava(characters);
      ImmutableSet.Builder<Integer> builder = ImmutableSet.builder();
      for (int c : Delimiters.codePoints(chars)) {
        builder.add(c);
      }
      this.trim = builder.build();
      this.trimWhitespace = false;
      return this;
    }

    public Builder trimWhitespace() {
      this.trim = WHITESPACE;
      this.trimWhitespace = true;
      return this;
    }

    public Builder noTrim() {
      this.trim = ImmutableSet.of();
      this.trimWhitespace = false;
      return this;
    }

    public Builder bom(BOMStrategy bom) {
      this.bom = bom;
      return this;
    }

    /**
     * @throws CSVConfigurationException if the settings contradict each other
     */
    public CSVProperties build() {
      CSVConfigurationException.check(charset != null,
          "Charset cannot be null");
      CSVConfigurationException.check(header != null,
          "Header strategy cannot be null");
      CSVConfigurationException.check(bom != null,
          "BOM strategy cannot be null");
      CSVConfigurationException.check(!trim.contains(Delimiters.QUOTE),
          "Trim characters cannot contain the quote character");

      if (fieldDelimiter != null && rowDelimiter != null) {
        // validates emptiness, equality and quote usage
        Delimiters.of(fieldDelimiter, rowDelimiter);
      }
      checkDelimiter("Field", fieldDelimiter);
      checkDelimiter("Row", rowDelimiter);

      return new CSVProperties(charset, fieldDelimiter, rowDelimiter, header,
          trim, trimWhitespace, bom);
    }

    private void checkDelimiter(String name, @Nullable String delimiter) {
      if (delimiter == null) {
        return;
      }
      CSVConfigurationException.check(!delimiter.isEmpty(),
          "%s delimiter cannot be empty", name);
      CSVConfigurationException.check(
          delimiter.indexOf(Delimiters.QUOTE) < 0,
          "%s delimiter cannot contain the quote character", name);
      if (!trimWhitespace) {
        for (int c : Delimiters.codePoints(delimiter)) {
          CSVConfigurationException.check(!trim.contains(c),
              "Trim characters cannot contain %s delimiter character \"%s\"",
              name.toLowerCase(), StringEscapeUtils.escapeJava(
                  new String(Character.toChars(c))));
        }
      }
    }
  }
}
