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

import java.util.OptionalInt;
import java.util.Queue;
import java.util.function.Consumer;

import org.checkerframework.checker.nullness.qual.Nullable;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * 多生产者多消费者的无锁 FIFO 队列，满和空都是立即返回的结果，不会阻塞调用线程
 * <p>
 *
 * A multiple-producer / multiple-consumer FIFO queue that never blocks. A full or empty condition
 * is reported immediately as a return value rather than waited out, and neither is treated as an
 * exceptional outcome.
 * <p>
 * The queue does not permit {@code null} elements, as {@code null} is the value returned by
 * {@link #poll()} and {@link #peek()} when the queue is empty.
 * <p>
 * The size queries ({@link #size()}, {@link #isEmpty()}, {@link #isFull()}) are snapshots that are
 * accurate only as of the instant of the read. Concurrent producers and consumers may change the
 * true count before the caller observes the result.
 *
 * @param <E> the type of elements held in this queue
 */
public interface MpmcQueue<E> extends Queue<E> {

  /**
   * Inserts the specified element at the tail of this queue if it is possible to do so
   * immediately without violating capacity restrictions. The addition does not fail spuriously due
   * to contention; a {@code false} result always means that the queue was observed to be full.
   * <p>
   * A rejected element is not retained by the queue, so the caller may retry or redirect it.
   *
   * @param e the element to add
   * @return {@code true} if the element was added, {@code false} if the queue is full
   * @throws NullPointerException if the specified element is null
   */
  @Override
  @CanIgnoreReturnValue
  boolean offer(E e);

  /**
   * Retrieves and removes the oldest available element of this queue.
   *
   * @return the head of this queue, or {@code null} if the queue is empty
   */
  @Override
  @Nullable E poll();

  /**
   * Retrieves, but does not remove, the oldest available element of this queue. The element may be
   * removed by another consumer by the time the caller inspects it.
   *
   * @return the head of this queue, or {@code null} if the queue is empty
   */
  @Override
  @Nullable E peek();

  /**
   * Returns whether the queue was observed to have no remaining capacity.
   *
   * @return {@code true} if the queue is full
   */
  boolean isFull();

  /**
   * Returns the maximum number of elements that the queue may hold.
   *
   * @return the queue's capacity, or empty if the queue is unbounded
   */
  OptionalInt capacity();

  /**
   * Removes the available elements, sending each one to the consumer for processing. Each element
   * is delivered exactly once and the queue holds no reference to it afterwards. Elements that
   * concurrent producers publish while draining may or may not be included.
   * <p>
   * If the consumer throws an exception then it is propagated to the caller, and the element that
   * was being processed is not returned to the queue.
   *
   * @param consumer the action to perform on each element
   */
  default void drainTo(Consumer<? super E> consumer) {
    for (;;) {
      E e = poll();
      if (e == null) {
        return;
      }
      consumer.accept(e);
    }
  }
}
