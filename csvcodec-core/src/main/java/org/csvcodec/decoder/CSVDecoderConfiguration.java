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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import java.util.Properties;
import javax.annotation.concurrent.Immutable;
import org.csvcodec.BOMStrategy;
import org.csvcodec.BufferingStrategy;
import org.csvcodec.CSVProperties;
import org.csvcodec.HeaderStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The settings of a decode session: the reader's {@link CSVProperties} plus the
 * {@link BufferingStrategy} that decides how many parsed rows stay available.
 */
@Immutable
public class CSVDecoderConfiguration {

  private static final Logger LOG = LoggerFactory
      .getLogger(CSVDecoderConfiguration.class);

  public static final String BUFFERING_PROPERTY = "csv.buffering";
  public static final BufferingStrategy DEFAULT_BUFFERING =
      BufferingStrategy.KEEP_ALL;

  private final CSVProperties readerProperties;
  private final BufferingStrategy buffering;

  public CSVDecoderConfiguration(CSVProperties readerProperties,
                                 BufferingStrategy buffering) {
    Preconditions.checkNotNull(readerProperties,
        "Reader properties cannot be null");
    Preconditions.checkNotNull(buffering, "Buffering strategy cannot be null");
    this.readerProperties = readerProperties;
    this.buffering = buffering;
  }

  public CSVDecoderConfiguration(CSVProperties readerProperties) {
    this(readerProperties, DEFAULT_BUFFERING);
  }

  public static CSVDecoderConfiguration fromProperties(Properties properties) {
    BufferingStrategy buffering = DEFAULT_BUFFERING;
    String value = properties.getProperty(BUFFERING_PROPERTY);
    if (value != null) {
      try {
        buffering = BufferingStrategy.valueOf(
            value.trim().toUpperCase().replace('-', '_'));
      } catch (IllegalArgumentException ex) {
        LOG.debug("Defaulting buffering strategy, failed to parse: {}", value);
        // buffering remains set to the default
      }
    }
    return new CSVDecoderConfiguration(
        CSVProperties.fromProperties(properties), buffering);
  }

  public Properties toProperties() {
    Properties properties = readerProperties.toProperties();
    properties.setProperty(BUFFERING_PROPERTY, buffering.name());
    return properties;
  }

  public CSVProperties getReaderProperties() {
    return readerProperties;
  }

  public BufferingStrategy getBuffering() {
    return buffering;
  }

  public String getCharset() {
    return readerProperties.charset;
  }

  public String getFieldDelimiter() {
    return readerProperties.fieldDelimiter;
  }

  public String getRowDelimiter() {
    return readerProperties.rowDelimiter;
  }

  public HeaderStrategy getHeader() {
    return readerProperties.header;
  }

  public BOMStrategy getBOM() {
    return readerProperties.bom;
  }

  /**
   * @return a copy of this configuration with other reader properties
   */
  public CSVDecoderConfiguration withReaderProperties(CSVProperties props) {
    return new CSVDecoderConfiguration(props, buffering);
  }

  /**
   * @return a copy of this configuration with another buffering strategy
   */
  public CSVDecoderConfiguration withBuffering(BufferingStrategy strategy) {
    return new CSVDecoderConfiguration(readerProperties, strategy);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("reader", readerProperties)
        .add("buffering", buffering)
        .toString();
  }
}
