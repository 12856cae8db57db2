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

package org.csvcodec.writer;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;
import javax.annotation.concurrent.NotThreadSafe;
import org.csvcodec.CSVStreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Writes whole byte arrays to a {@link WritableByteChannel}.
 * </p>
 * <p>
 * A write that makes progress is followed by another until every byte is
 * written. A write that accepts no bytes is retried, but only
 * {@link #MAX_ATTEMPTS} zero-progress writes in a row are allowed before the
 * write fails. An {@link IOException} from the channel fails the write at
 * once. The channel must be open before anything is written.
 * </p>
 */
@NotThreadSafe
public class ChannelWriter {

  private static final Logger LOG = LoggerFactory
      .getLogger(ChannelWriter.class);

  @VisibleForTesting
  static final int MAX_ATTEMPTS = 2;

  private final WritableByteChannel channel;
  private long bytesWritten = 0;

  public ChannelWriter(WritableByteChannel channel) {
    Preconditions.checkNotNull(channel, "Channel cannot be null");
    this.channel = channel;
  }

  /**
   * @throws CSVStreamException if the channel is closed, reports an error, or
   *         keeps accepting zero bytes
   */
  public void write(byte[] bytes) {
    Preconditions.checkNotNull(bytes, "Bytes cannot be null");
    checkOpen();

    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    int attempts = 0;
    while (buffer.hasRemaining()) {
      attempts += 1;
      int written;
      try {
        written = channel.write(buffer);
      } catch (IOException e) {
        throw new CSVStreamException("Channel reported an error",
            channel.isOpen(), attempts, e);
      }

      if (written > 0) {
        bytesWritten += written;
        attempts = 0;
      } else if (written < 0) {
        throw new CSVStreamException("Channel reported a negative byte count",
            channel.isOpen(), attempts, null);
      } else if (attempts >= MAX_ATTEMPTS) {
        throw new CSVStreamException(
            "Channel accepted no bytes, " + buffer.remaining() +
                " byte(s) unwritten", channel.isOpen(), attempts, null);
      } else {
        LOG.debug("Channel accepted no bytes, retrying ({} of {})",
            attempts, MAX_ATTEMPTS);
      }
    }
  }

  /**
   * @throws CSVStreamException if the channel is not open
   */
  public void checkOpen() {
    if (!channel.isOpen()) {
      throw new CSVStreamException("Channel is not open", false, 0, null);
    }
  }

  public boolean isOpen() {
    return channel.isOpen();
  }

  /**
   * @return the total number of bytes written through this writer
   */
  public long getBytesWritten() {
    return bytesWritten;
  }
}
