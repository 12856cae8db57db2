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

/**
 * Thrown when the sampled prefix of the input is not enough to determine a
 * delimiter or the presence of a header row.
 */
public class CSVInferenceException extends CSVException {

  private final String target;
  private final int sampledRows;

  public CSVInferenceException(String target, int sampledRows, String reason) {
    super(format("Cannot infer %s from %s sampled row(s): %s",
        target, sampledRows, reason));
    this.target = target;
    this.sampledRows = sampledRows;
  }

  /**
   * @return what was being inferred, for example {@code "field delimiter"}
   */
  public String getTarget() {
    return target;
  }

  public int getSampledRows() {
    return sampledRows;
  }
}
