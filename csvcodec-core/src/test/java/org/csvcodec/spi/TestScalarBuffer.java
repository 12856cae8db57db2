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

import com.google.common.collect.Lists;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Random;
import org.junit.Assert;
import org.junit.Test;

public class TestScalarBuffer {

  @Test
  public void testEmptyBuffer() {
    ScalarBuffer buffer = new ScalarBuffer();
    Assert.assertTrue(buffer.isEmpty());
    Assert.assertEquals("Empty buffer should return END",
        CodePointSource.END, buffer.next());
  }

  @Test
  public void testPrependKeepsBatchOrder() {
    ScalarBuffer buffer = new ScalarBuffer();
    buffer.append(new int[] {'d', 'e'});
    buffer.prepend(Lists.newArrayList((int) 'b', (int) 'c'));
    buffer.prepend('a');
    buffer.append('f');

    Assert.assertEquals(6, buffer.size());
    Assert.assertEquals("abcdef", drain(buffer));
    Assert.assertTrue(buffer.isEmpty());
  }

  @Test
  public void testRestoreLookahead() {
    // read ahead three code points, then put them back in front
    ScalarBuffer buffer = new ScalarBuffer();
    buffer.append(new int[] {'x', 'y', 'z', '1', '2'});
    List<Integer> read = Lists.newArrayList();
    for (int i = 0; i < 3; i += 1) {
      read.add(buffer.next());
    }
    buffer.prepend(read);
    Assert.assertEquals("xyz12", drain(buffer));
  }

  @Test
  public void testOrderMatchesDequeModel() {
    Random random = new Random(2013);
    ScalarBuffer buffer = new ScalarBuffer();
    Deque<Integer> model = new ArrayDeque<Integer>();
    int nextValue = 0;

    for (int step = 0; step < 5000; step += 1) {
      int op = random.nextInt(5);
      int count = 1 + random.nextInt(4);
      if (op == 0) {
        buffer.prepend(nextValue);
        model.addFirst(nextValue);
        nextValue += 1;
      } else if (op == 1) {
        int[] batch = new int[count];
        for (int i = 0; i < count; i += 1) {
          batch[i] = nextValue++;
        }
        buffer.prepend(batch);
        for (int i = count - 1; i >= 0; i -= 1) {
          model.addFirst(batch[i]);
        }
      } else if (op == 2) {
        List<Integer> batch = Lists.newArrayList();
        for (int i = 0; i < count; i += 1) {
          batch.add(nextValue++);
        }
        buffer.append(batch);
        model.addAll(batch);
      } else {
        Integer expected = model.pollFirst();
        Assert.assertEquals("Step " + step,
            expected == null ? CodePointSource.END : expected.intValue(),
            buffer.next());
      }
      Assert.assertEquals(model.size(), buffer.size());
    }
  }

  @Test
  public void testBufferedSourceDrainsBufferFirst() {
    BufferedCodePointSource source =
        new BufferedCodePointSource(ReaderCodePointSource.of("cd"));
    source.getBuffer().append(new int[] {'a', 'b'});
    StringBuilder sb = new StringBuilder();
    int c;
    while ((c = source.read()) != CodePointSource.END) {
      sb.appendCodePoint(c);
    }
    Assert.assertEquals("abcd", sb.toString());
  }

  private static String drain(ScalarBuffer buffer) {
    StringBuilder sb = new StringBuilder();
    int c;
    while ((c = buffer.next()) != CodePointSource.END) {
      sb.appendCodePoint(c);
    }
    return sb.toString();
  }
}
