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

import javax.annotation.Nullable;

/**
 * Thrown when the output channel is not open, reports an error, or keeps
 * accepting zero bytes past the retry budget.
 */
public class CSVStreamException extends CSVException {

  private final boolean channelOpen;
  private final int attempts;

  public CSVStreamException(String reason, boolean channelOpen, int attempts,
                            @Nullable Throwable cause) {
    super(format("%s (channel open: %s, attempts: %s)",
        reason, channelOpen, attempts), cause);
    this.channelOpen = channelOpen;
    this.attempts = attempts;
  }

  public boolean isChannelOpen() {
    return channelOpen;
  }

  /**
   * @return the number of write attempts made for the failing buffer
   */
  public int getAttempts() {
    return attempts;
  }
}
