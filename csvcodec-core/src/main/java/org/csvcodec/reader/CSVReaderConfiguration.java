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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import java.util.Set;
import javax.annotation.concurrent.Immutable;
import org.apache.commons.lang.StringEscapeUtils;
import org.csvcodec.CSVConfigurationException;
import org.csvcodec.CSVProperties;
import org.csvcodec.Delimiters;
import org.csvcodec.spi.BufferedCodePointSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The settings of one parse session once every inferred value is known. It is
 * resolved before the first row is parsed and never changes afterward.
 */
@Immutable
public class CSVReaderConfiguration {

  private static final Logger LOG = LoggerFactory
      .getLogger(CSVReaderConfiguration.class);

  private final Delimiters delimiters;
  private final boolean hasHeader;
  private final Set<Integer> trim;

  public CSVReaderConfiguration(Delimiters delimiters, boolean hasHeader,
                                Set<Integer> trim) {
    Preconditions.checkNotNull(delimiters, "Delimiters cannot be null");
    Preconditions.checkNotNull(trim, "Trim set cannot be null");
    for (int c : trim) {
      CSVConfigurationException.check(!delimiters.isDelimiterScalar(c),
          "Trim characters cannot contain delimiter character \"%s\"",
          StringEscapeUtils.escapeJava(new String(Character.toChars(c))));
    }
    CSVConfigurationException.check(!trim.contains(Delimiters.QUOTE),
        "Trim characters cannot contain the quote character");
    this.delimiters = delimiters;
    this.hasHeader = hasHeader;
    this.trim = ImmutableSet.copyOf(trim);
  }

  /**
   * Resolves the properties against the input, inferring any delimiter or
   * header setting left open. Every code point read while inferring is pushed
   * back into the source's buffer.
   *
   * @throws CSVConfigurationException if the settings contradict each other
   * @throws org.csvcodec.CSVInferenceException if a setting cannot be inferred
   */
  public static CSVReaderConfiguration resolve(CSVProperties props,
                                               BufferedCodePointSource source) {
    Delimiters delimiters;
    if (props.fieldDelimiter != null && props.rowDelimiter != null) {
      delimiters = Delimiters.of(props.fieldDelimiter, props.rowDelimiter);
    } else if (props.rowDelimiter != null) {
      delimiters = DelimiterInference.inferFieldDelimiter(
          source, Delimiters.codePoints(props.rowDelimiter));
    } else if (props.fieldDelimiter != null) {
      delimiters = DelimiterInference.inferRowDelimiter(
          source, Delimiters.codePoints(props.fieldDelimiter));
    } else {
      delimiters = DelimiterInference.inferDelimiters(source);
    }

    Set<Integer> trim = props.trimScalars(delimiters);

    boolean hasHeader;
    switch (props.header) {
      case FIRST_LINE:
        hasHeader = true;
        break;
      case UNKNOWN:
        hasHeader = HeaderInference.inferHeader(source, delimiters, trim);
        break;
      default:
        hasHeader = false;
    }

    CSVReaderConfiguration config =
        new CSVReaderConfiguration(delimiters, hasHeader, trim);
    LOG.debug("Resolved reader configuration: {}", config);
    return config;
  }

  public Delimiters getDelimiters() {
    return delimiters;
  }

  public boolean hasHeader() {
    return hasHeader;
  }

  public Set<Integer> getTrim() {
    return trim;
  }

  public int getQuote() {
    return Delimiters.QUOTE;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("delimiters", delimiters)
        .add("hasHeader", hasHeader)
        .add("trimmed", trim.size())
        .toString();
  }
}
