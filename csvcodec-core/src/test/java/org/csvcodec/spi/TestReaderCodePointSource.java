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

import java.io.IOException;
import java.io.Reader;
import org.csvcodec.CSVIOException;
import org.csvcodec.TestHelpers;
import org.junit.Assert;
import org.junit.Test;
import org.mockito.Mockito;

public class TestReaderCodePointSource {

  @Test
  public void testJoinsSurrogatePairs() {
    String text = "a\uD83D\uDE00b";
    ReaderCodePointSource source = ReaderCodePointSource.of(text);
    Assert.assertEquals('a', source.read());
    Assert.assertEquals(0x1F600, source.read());
    Assert.assertEquals('b', source.read());
    Assert.assertEquals(CodePointSource.END, source.read());
    Assert.assertEquals("END should repeat", CodePointSource.END,
        source.read());
  }

  @Test
  public void testLoneSurrogatesPassThrough() {
    ReaderCodePointSource source = ReaderCodePointSource.of("\uD83Dx\uDE00");
    Assert.assertEquals(0xD83D, source.read());
    Assert.assertEquals('x', source.read());
    Assert.assertEquals(0xDE00, source.read());
    Assert.assertEquals(CodePointSource.END, source.read());

    source = ReaderCodePointSource.of("y\uD83D");
    Assert.assertEquals('y', source.read());
    Assert.assertEquals(0xD83D, source.read());
    Assert.assertEquals(CodePointSource.END, source.read());
  }

  @Test
  public void testWrapsIOException() throws IOException {
    Reader reader = Mockito.mock(Reader.class);
    Mockito.when(reader.read()).thenThrow(new IOException("disk gone"));
    final ReaderCodePointSource source = new ReaderCodePointSource(reader);
    CSVIOException e = TestHelpers.assertThrows("Should wrap IOException",
        CSVIOException.class, new Runnable() {
          @Override
          public void run() {
            source.read();
          }
        });
    Assert.assertTrue(e.getCause() instanceof IOException);
  }
}
