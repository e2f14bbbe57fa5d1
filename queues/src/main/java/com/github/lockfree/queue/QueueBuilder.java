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

import java.lang.System.Logger;
import java.lang.System.Logger.Level;

import org.checkerframework.checker.index.qual.Positive;
import org.checkerframework.checker.nullness.qual.Nullable;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.FormatMethod;

/**
 * 队列构造器，设置了容量则构造有界队列，否则构造无界队列
 * <p>
 *
 * A builder of {@link MpmcQueue} instances. A queue built with a {@linkplain #capacity capacity}
 * is a {@link BoundedQueue} that rejects new elements when full; otherwise it is an
 * {@link UnboundedQueue} that grows in linked blocks of the {@linkplain #blockSize block size}.
 * <p>
 * Usage example:
 * <pre>{@code
 *   MpmcQueue<Task> tasks = QueueBuilder.newBuilder()
 *       .capacity(1_024)
 *       .build();
 * }</pre>
 */
public final class QueueBuilder {
  static final Logger logger = System.getLogger(QueueBuilder.class.getName());

  static final int UNSET_INT = -1;

  int capacity = UNSET_INT;
  int blockSize = UNSET_INT;

  private QueueBuilder() {}

  /** Ensures that the argument expression is true. */
  @FormatMethod
  static void requireArgument(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalArgumentException(String.format(template, args));
    }
  }

  /** Ensures that the state expression is true. */
  @FormatMethod
  static void requireState(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalStateException(String.format(template, args));
    }
  }

  /** Returns the smallest power of two greater than or equal to {@code x}. */
  static int ceilingPowerOfTwo(int x) {
    // From Hacker's Delight, Chapter 3, Harry S. Warren Jr.
    return 1 << -Integer.numberOfLeadingZeros(x - 1);
  }

  /** Returns the smallest power of two greater than or equal to {@code x}. */
  static long ceilingPowerOfTwo(long x) {
    // From Hacker's Delight, Chapter 3, Harry S. Warren Jr.
    return 1L << -Long.numberOfLeadingZeros(x - 1);
  }

  /**
   * Constructs a new {@code QueueBuilder} instance with default settings, which builds an
   * unbounded queue with the default block size.
   *
   * @return a new instance with default settings
   */
  @CheckReturnValue
  public static QueueBuilder newBuilder() {
    return new QueueBuilder();
  }

  /**
   * 设置队列的最大容量，设置后构造的是有界队列
   * <p>
   *
   * Specifies the maximum number of elements the queue may contain. When the queue is full, an
   * {@link MpmcQueue#offer offer} is rejected immediately rather than waiting for space.
   *
   * @param capacity the maximum number of elements
   * @return this {@code QueueBuilder} instance (for chaining)
   * @throws IllegalArgumentException if {@code capacity} is not positive
   * @throws IllegalStateException if a capacity was already set
   */
  @CanIgnoreReturnValue
  public QueueBuilder capacity(@Positive int capacity) {
    requireState(this.capacity == UNSET_INT, "capacity was already set to %s", this.capacity);
    requireArgument(capacity >= 1, "capacity must be positive: %s", capacity);
    this.capacity = capacity;
    return this;
  }

  boolean isBounded() {
    return (capacity != UNSET_INT);
  }

  /**
   * Specifies the number of slots in each block of an unbounded queue. A larger block amortizes
   * the allocation and linking of blocks over more insertions at the cost of memory that is
   * retained until every slot of the block has been consumed. The size is rounded up to a power of
   * two.
   * <p>
   * This setting has no effect on a queue built with a {@link #capacity}.
   *
   * @param blockSize the number of slots per block
   * @return this {@code QueueBuilder} instance (for chaining)
   * @throws IllegalArgumentException if {@code blockSize} is not positive or too large
   * @throws IllegalStateException if a block size was already set
   */
  @CanIgnoreReturnValue
  public QueueBuilder blockSize(@Positive int blockSize) {
    requireState(this.blockSize == UNSET_INT, "block size was already set to %s", this.blockSize);
    requireArgument((blockSize >= 1) && (blockSize <= UnboundedQueue.MAXIMUM_BLOCK_SIZE),
        "block size must be between 1 and %s: %s", UnboundedQueue.MAXIMUM_BLOCK_SIZE, blockSize);
    this.blockSize = blockSize;
    return this;
  }

  int getBlockSize() {
    if (blockSize == UNSET_INT) {
      return UnboundedQueue.DEFAULT_BLOCK_SIZE;
    }
    int rounded = ceilingPowerOfTwo(blockSize);
    if (rounded != blockSize) {
      logger.log(Level.DEBUG, "rounding block size {0} up to {1}", blockSize, rounded);
    }
    return rounded;
  }

  /**
   * Builds a queue with the settings of this builder. The builder may be used again to create
   * additional queues.
   *
   * @param <E> the type of elements held in the queue
   * @return a new, empty queue
   */
  @CheckReturnValue
  public <E> MpmcQueue<E> build() {
    if (isBounded()) {
      if (blockSize != UNSET_INT) {
        logger.log(Level.WARNING, "ignoring blockSize specified with a bounded capacity");
      }
      return new BoundedQueue<>(capacity);
    }
    return new UnboundedQueue<>(getBlockSize());
  }

  /**
   * Returns a string representation for this builder instance. The exact form of the returned
   * string is not specified.
   */
  @Override
  public String toString() {
    StringBuilder s = new StringBuilder(48);
    s.append(getClass().getSimpleName()).append('{');
    int baseLength = s.length();
    if (capacity != UNSET_INT) {
      s.append("capacity=").append(capacity).append(", ");
    }
    if (blockSize != UNSET_INT) {
      s.append("blockSize=").append(blockSize).append(", ");
    }
    if (s.length() > baseLength) {
      s.delete(s.length() - 2, s.length());
    }
    return s.append('}').toString();
  }
}
