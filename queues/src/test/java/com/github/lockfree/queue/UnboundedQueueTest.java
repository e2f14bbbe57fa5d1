/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.lockfree.queue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import org.junit.jupiter.api.Test;

class UnboundedQueueTest {

  @Test
  void shouldRejectInvalidBlockSize() {
    assertThrows(IllegalArgumentException.class, () -> new UnboundedQueue<Integer>(0));
    assertThrows(IllegalArgumentException.class, () -> new UnboundedQueue<Integer>(-4));
    assertThrows(IllegalArgumentException.class,
        () -> new UnboundedQueue<Integer>(UnboundedQueue.MAXIMUM_BLOCK_SIZE + 1));
  }

  @Test
  void shouldReportEmptyWithoutChangingState() {
    UnboundedQueue<Integer> queue = new UnboundedQueue<>();

    for (int i = 0; i < 3; i++) {
      assertNull(queue.poll());
      assertNull(queue.peek());
      assertTrue(queue.isEmpty());
      assertEquals(0, queue.size());
    }
    assertEquals(1, queue.linkedBlocks());
  }

  @Test
  void shouldGrowByBlocksAndPollInInsertionOrder() {
    UnboundedQueue<Integer> queue = new UnboundedQueue<>();
    int blockSize = UnboundedQueue.DEFAULT_BLOCK_SIZE;
    int count = 3 * blockSize + 1;

    for (int i = 0; i < count; i++) {
      assertTrue(queue.offer(i));
    }
    assertEquals(count, queue.size());
    assertEquals(4, queue.linkedBlocks());
    assertNotSame(queue.lvHeadBlock(), queue.lvTailBlock());
    assertEquals(3L * blockSize, queue.lvTailBlock().offset);

    for (int i = 0; i < count; i++) {
      assertEquals(i, queue.poll());
    }
    assertNull(queue.poll());
    assertTrue(queue.isEmpty());
    assertEquals(1, queue.linkedBlocks());
    assertSame(queue.lvHeadBlock(), queue.lvTailBlock());
  }

  @Test
  void shouldWorkWithSingleSlotBlocks() {
    UnboundedQueue<Integer> queue = new UnboundedQueue<>(1);
    for (int i = 0; i < 10; i++) {
      queue.offer(i);
    }
    assertEquals(10, queue.size());
    assertEquals(10, queue.linkedBlocks());

    for (int i = 0; i < 10; i++) {
      assertEquals(i, queue.poll());
    }
    assertNull(queue.poll());
  }

  @Test
  void shouldInterleaveOffersAndPollsAcrossBlocks() {
    UnboundedQueue<Integer> queue = new UnboundedQueue<>(4);
    int next = 0;
    int expected = 0;
    for (int round = 0; round < 500; round++) {
      int batch = 1 + (round % 7);
      for (int i = 0; i < batch; i++) {
        queue.offer(next++);
      }
      for (int i = 0; i < batch - 1; i++) {
        assertEquals(expected++, queue.poll());
      }
    }
    assertEquals(next - expected, queue.size());
    while (expected < next) {
      assertEquals(expected++, queue.poll());
    }
    assertTrue(queue.isEmpty());
  }

  @Test
  void shouldPeekAcrossExhaustedBlock() {
    UnboundedQueue<String> queue = new UnboundedQueue<>(2);
    queue.offer("a");
    queue.offer("b");
    queue.offer("c");

    assertEquals("a", queue.poll());
    assertEquals("b", queue.poll());
    assertEquals("c", queue.peek());
    assertEquals(1, queue.linkedBlocks());
    assertEquals("c", queue.poll());
    assertNull(queue.peek());
  }

  @Test
  void shouldComputeSizeAcrossBlocks() {
    UnboundedQueue<Integer> queue = new UnboundedQueue<>(4);
    for (int i = 0; i < 10; i++) {
      queue.offer(i);
    }
    for (int i = 0; i < 3; i++) {
      queue.poll();
    }
    assertEquals(7, queue.size());
    assertFalse(queue.isEmpty());
  }

  @Test
  void shouldNeverBeFull() {
    UnboundedQueue<Integer> queue = new UnboundedQueue<>(2);
    for (int i = 0; i < 1_000; i++) {
      assertTrue(queue.offer(i));
    }
    assertFalse(queue.isFull());
    assertEquals(OptionalInt.empty(), queue.capacity());
  }

  @Test
  void shouldClearPolledSlots() {
    UnboundedQueue<Object> queue = new UnboundedQueue<>(8);
    for (int i = 0; i < 5; i++) {
      queue.offer(new Object());
    }
    for (int i = 0; i < 5; i++) {
      queue.poll();
    }
    for (Object slot : queue.lvHeadBlock().slots) {
      assertNull(slot);
    }
  }

  @Test
  void shouldDrainRemainingElementsOnce() {
    UnboundedQueue<Integer> queue = new UnboundedQueue<>(4);
    for (int i = 0; i < 9; i++) {
      queue.offer(i);
    }
    queue.poll();

    List<Integer> drained = new ArrayList<>();
    queue.drainTo(drained::add);

    assertEquals(List.of(1, 2, 3, 4, 5, 6, 7, 8), drained);
    assertTrue(queue.isEmpty());
    assertNull(queue.poll());
  }

  @Test
  void shouldReturnSameInstanceOnRoundTrip() {
    UnboundedQueue<StringBuilder> queue = new UnboundedQueue<>();
    StringBuilder value = new StringBuilder("payload");

    queue.offer(value);

    assertSame(value, queue.poll());
    assertEquals("payload", value.toString());
  }

  @Test
  void shouldRejectNullElement() {
    UnboundedQueue<Integer> queue = new UnboundedQueue<>();
    assertThrows(NullPointerException.class, () -> queue.offer(null));
    assertTrue(queue.isEmpty());
  }

  @Test
  void shouldNotSupportIteration() {
    UnboundedQueue<Integer> queue = new UnboundedQueue<>();
    assertThrows(UnsupportedOperationException.class, queue::iterator);
  }

  @Test
  void shouldDescribeBlockSizeAndSize() {
    UnboundedQueue<Integer> queue = new UnboundedQueue<>(16);
    queue.offer(1);
    queue.offer(2);

    assertEquals("UnboundedQueue{blockSize=16, size=2}", queue.toString());
  }
}
