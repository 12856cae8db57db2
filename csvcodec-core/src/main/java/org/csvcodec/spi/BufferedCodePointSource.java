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

package org.csvcodec.spi;

import com.google.common.base.Preconditions;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Drains a {@link ScalarBuffer} before reading from the wrapped source, so code
 * points pushed back into the buffer are seen again in their original order.
 */
@NotThreadSafe
public class BufferedCodePointSource implements CodePointSource {

  private final CodePointSource source;
  private final ScalarBuffer buffer;

  public BufferedCodePointSource(CodePointSource source) {
    this(source, new ScalarBuffer());
  }

  public BufferedCodePointSource(CodePointSource source, ScalarBuffer buffer) {
    Preconditions.checkNotNull(source, "Source cannot be null");
    Preconditions.checkNotNull(buffer, "Buffer cannot be null");
    this.source = source;
    this.buffer = buffer;
  }

  @Override
  public int read() {
    if (!buffer.isEmpty()) {
      return buffer.next();
    }
    return source.read();
  }

  public ScalarBuffer getBuffer() {
    return buffer;
  }
}
