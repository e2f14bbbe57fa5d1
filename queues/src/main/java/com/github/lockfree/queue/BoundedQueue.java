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

import static com.github.lockfree.queue.QueueBuilder.ceilingPowerOfTwo;
import static com.github.lockfree.queue.QueueBuilder.requireArgument;
import static java.util.Objects.requireNonNull;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.AbstractQueue;
import java.util.Iterator;
import java.util.OptionalInt;

import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * 有界的环形队列，每个槽位带有一个 stamp（圈数 + 状态），生产者和消费者通过 CAS 抢占 tail/head 计数
 * <p>
 *
 * A bounded, lock-free, multiple-producer / multiple-consumer FIFO queue backed by a fixed ring of
 * slots. The capacity is chosen at construction and the ring is never resized.
 *
 * @param <E> the type of elements held in this queue
 */
public final class BoundedQueue<E> extends BQHeader.HeadAndTailRef<E> implements MpmcQueue<E> {
  /*
   * The head and tail are logical counters of the form (lap | index), where the index is the low
   * bits below oneLap and the lap is the remaining high bits. oneLap is the smallest power of two
   * greater than the capacity, so the index never overflows into the lap. Advancing past the last
   * slot of the ring moves to index 0 of the next lap.
   *
   * Every slot carries a stamp, which encodes the counter value it expects next:
   *   stamp == tail       the slot is empty and may be written by the producer holding tail
   *   stamp == head + 1   the slot is full and may be read by the consumer holding head
   * A producer that writes at tail t publishes t + 1, and a consumer that reads at head h publishes
   * h + oneLap, which is the same index one lap later. A thread that was descheduled for several
   * laps observes a stamp from a different lap and its CAS on the stale counter fails, so a slot
   * index can be reused indefinitely without the ABA problem.
   *
   * A producer first claims the tail by CAS and only then writes the element, after which it
   * release-stores the stamp. A consumer acquire-loads the stamp before claiming the head, so the
   * element written by the producer is visible to it. The consumer clears the element before
   * release-storing the stamp for the next lap, so the next producer never races with the read.
   *
   * When the slot still holds an element from the previous lap the queue may be full. This is
   * confirmed by re-reading the head; if a consumer is merely mid-read then the producer backs off
   * and retries instead of reporting a spurious full result. The same applies to a consumer that
   * finds an empty stamp while a producer is mid-write.
   */

  static final VarHandle STAMPS = MethodHandles.arrayElementVarHandle(long[].class);
  static final VarHandle ELEMENTS = MethodHandles.arrayElementVarHandle(Object[].class);

  byte p000, p001, p002, p003, p004, p005, p006, p007;
  byte p008, p009, p010, p011, p012, p013, p014, p015;
  byte p016, p017, p018, p019, p020, p021, p022, p023;
  byte p024, p025, p026, p027, p028, p029, p030, p031;
  byte p032, p033, p034, p035, p036, p037, p038, p039;
  byte p040, p041, p042, p043, p044, p045, p046, p047;
  byte p048, p049, p050, p051, p052, p053, p054, p055;
  byte p056, p057, p058, p059, p060, p061, p062, p063;
  byte p064, p065, p066, p067, p068, p069, p070, p071;
  byte p072, p073, p074, p075, p076, p077, p078, p079;
  byte p080, p081, p082, p083, p084, p085, p086, p087;
  byte p088, p089, p090, p091, p092, p093, p094, p095;
  byte p096, p097, p098, p099, p100, p101, p102, p103;
  byte p104, p105, p106, p107, p108, p109, p110, p111;
  byte p112, p113, p114, p115, p116, p117, p118, p119;

  final int capacity;
  final long oneLap;
  final long[] stamps;
  final Object[] elements;

  /**
   * Creates a queue that holds at most {@code capacity} elements.
   *
   * @param capacity the maximum number of elements, which must be at least one
   * @throws IllegalArgumentException if {@code capacity} is less than one
   */
  public BoundedQueue(int capacity) {
    requireArgument(capacity >= 1, "capacity must be positive: %s", capacity);
    this.capacity = capacity;
    this.oneLap = ceilingPowerOfTwo(capacity + 1L);
    this.elements = new Object[capacity];
    this.stamps = new long[capacity];
    for (int i = 0; i < capacity; i++) {
      // lap 0, expecting a write at index i
      stamps[i] = i;
    }
  }

  @Override
  public boolean offer(E e) {
    requireNonNull(e);
    var backoff = new Backoff();
    long tail = lvTail();

    for (;;) {
      int index = indexOf(tail);
      long stamp = lvStamp(stamps, index);

      // 1. 槽位为空且属于当前圈，尝试抢占 tail
      if (tail == stamp) {
        long nextTail = next(tail, index);
        if (casTail(tail, nextTail)) {
          spElement(elements, index, e);
          soStamp(stamps, index, tail + 1);
          return true;
        }
        backoff.spin();
        tail = lvTail();
      }
      // 2. 槽位仍保存着上一圈的元素，确认队列是否已满
      else if (stamp + oneLap == tail + 1) {
        long head = lvHead();
        if (head + oneLap == tail) {
          return false;
        }
        backoff.spin();
        tail = lvTail();
      }
      // 3. tail 已过期或其它线程正在写入，稍后重试
      else {
        backoff.snooze();
        tail = lvTail();
      }
    }
  }

  @Override
  @SuppressWarnings("unchecked")
  public @Nullable E poll() {
    var backoff = new Backoff();
    long head = lvHead();

    for (;;) {
      int index = indexOf(head);
      long stamp = lvStamp(stamps, index);

      if (head + 1 == stamp) {
        long nextHead = next(head, index);
        if (casHead(head, nextHead)) {
          E e = (E) lpElement(elements, index);
          spElement(elements, index, null);
          soStamp(stamps, index, head + oneLap);
          return e;
        }
        backoff.spin();
        head = lvHead();
      } else if (stamp == head) {
        long tail = lvTail();
        if (tail == head) {
          return null;
        }
        // a producer claimed this slot but has not published it yet
        backoff.spin();
        head = lvHead();
      } else {
        backoff.snooze();
        head = lvHead();
      }
    }
  }

  @Override
  @SuppressWarnings("unchecked")
  public @Nullable E peek() {
    var backoff = new Backoff();
    long head = lvHead();

    for (;;) {
      int index = indexOf(head);
      long stamp = lvStamp(stamps, index);

      if (head + 1 == stamp) {
        E e = (E) laElement(elements, index);
        long current = lvHead();
        if (current == head) {
          return e;
        }
        head = current;
      } else if (stamp == head) {
        if (lvTail() == head) {
          return null;
        }
        backoff.spin();
        head = lvHead();
      } else {
        backoff.snooze();
        head = lvHead();
      }
    }
  }

  @Override
  public int size() {
    for (;;) {
      long tail = lvTail();
      long head = lvHead();

      // retry until a consistent pair is read, as the head may have lapped the stale tail
      if (lvTail() == tail) {
        int headIndex = indexOf(head);
        int tailIndex = indexOf(tail);
        if (headIndex < tailIndex) {
          return tailIndex - headIndex;
        } else if (headIndex > tailIndex) {
          return capacity - headIndex + tailIndex;
        } else if (tail == head) {
          return 0;
        } else {
          return capacity;
        }
      }
    }
  }

  @Override
  public boolean isEmpty() {
    // Loading the head before the tail allows for producer increments after the head is read,
    // so the estimate is conservative
    long head = lvHead();
    long tail = lvTail();
    return (tail == head);
  }

  @Override
  public boolean isFull() {
    long tail = lvTail();
    long head = lvHead();
    return (head + oneLap == tail);
  }

  @Override
  public OptionalInt capacity() {
    return OptionalInt.of(capacity);
  }

  @Override
  public Iterator<E> iterator() {
    throw new UnsupportedOperationException();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{capacity=" + capacity + ", size=" + size() + '}';
  }

  /** Returns the ring index encoded in the counter. */
  int indexOf(long counter) {
    return (int) (counter & (oneLap - 1));
  }

  /** Returns the counter that follows the one at {@code index}, wrapping to the next lap. */
  long next(long counter, @NonNegative int index) {
    if (index + 1 < capacity) {
      return counter + 1;
    }
    long lap = counter & -oneLap;
    return lap + oneLap;
  }

  static long lvStamp(long[] stamps, int index) {
    return (long) STAMPS.getVolatile(stamps, index);
  }

  static void soStamp(long[] stamps, int index, long stamp) {
    STAMPS.setRelease(stamps, index, stamp);
  }

  /** A plain store, which is published by the following release of the slot's stamp. */
  static void spElement(Object[] elements, int index, @Nullable Object e) {
    ELEMENTS.set(elements, index, e);
  }

  /** A plain load, which is ordered by the preceding acquire of the slot's stamp. */
  static @Nullable Object lpElement(Object[] elements, int index) {
    return ELEMENTS.get(elements, index);
  }

  /** An acquiring load, so that a following re-read of the head cannot move ahead of it. */
  static @Nullable Object laElement(Object[] elements, int index) {
    return ELEMENTS.getAcquire(elements, index);
  }
}

/** The namespace for field padding through inheritance. */
final class BQHeader {

  @SuppressWarnings("PMD.AbstractClassWithoutAbstractMethod")
  abstract static class PadHead<E> extends AbstractQueue<E> {
    byte p000, p001, p002, p003, p004, p005, p006, p007;
    byte p008, p009, p010, p011, p012, p013, p014, p015;
    byte p016, p017, p018, p019, p020, p021, p022, p023;
    byte p024, p025, p026, p027, p028, p029, p030, p031;
    byte p032, p033, p034, p035, p036, p037, p038, p039;
    byte p040, p041, p042, p043, p044, p045, p046, p047;
    byte p048, p049, p050, p051, p052, p053, p054, p055;
    byte p056, p057, p058, p059, p060, p061, p062, p063;
    byte p064, p065, p066, p067, p068, p069, p070, p071;
    byte p072, p073, p074, p075, p076, p077, p078, p079;
    byte p080, p081, p082, p083, p084, p085, p086, p087;
    byte p088, p089, p090, p091, p092, p093, p094, p095;
    byte p096, p097, p098, p099, p100, p101, p102, p103;
    byte p104, p105, p106, p107, p108, p109, p110, p111;
    byte p112, p113, p114, p115, p116, p117, p118, p119;
  }

  /** Enforces a memory layout to avoid false sharing by padding the head counter. */
  abstract static class HeadRef<E> extends PadHead<E> {
    volatile long head;
  }

  abstract static class PadTail<E> extends HeadRef<E> {
    byte p120, p121, p122, p123, p124, p125, p126, p127;
    byte p128, p129, p130, p131, p132, p133, p134, p135;
    byte p136, p137, p138, p139, p140, p141, p142, p143;
    byte p144, p145, p146, p147, p148, p149, p150, p151;
    byte p152, p153, p154, p155, p156, p157, p158, p159;
    byte p160, p161, p162, p163, p164, p165, p166, p167;
    byte p168, p169, p170, p171, p172, p173, p174, p175;
    byte p176, p177, p178, p179, p180, p181, p182, p183;
    byte p184, p185, p186, p187, p188, p189, p190, p191;
    byte p192, p193, p194, p195, p196, p197, p198, p199;
    byte p200, p201, p202, p203, p204, p205, p206, p207;
    byte p208, p209, p210, p211, p212, p213, p214, p215;
    byte p216, p217, p218, p219, p220, p221, p222, p223;
    byte p224, p225, p226, p227, p228, p229, p230, p231;
    byte p232, p233, p234, p235, p236, p237, p238, p239;
  }

  /**
   * 队列的读写计数器，消费者 CAS 更新 head，生产者 CAS 更新 tail，两者分属不同的缓存行
   * <p>
   *
   * The consumer and producer counters. Each is advanced only by a successful CAS, which grants
   * the winning thread exclusive ownership of the slot at the counter's previous value.
   */
  abstract static class HeadAndTailRef<E> extends PadTail<E> {
    static final VarHandle HEAD, TAIL;

    volatile long tail;

    long lvHead() {
      return head;
    }

    long lvTail() {
      return tail;
    }

    boolean casHead(long expect, long update) {
      return HEAD.compareAndSet(this, expect, update);
    }

    boolean casTail(long expect, long update) {
      return TAIL.compareAndSet(this, expect, update);
    }

    static {
      var lookup = MethodHandles.lookup();
      try {
        HEAD = lookup.findVarHandle(HeadRef.class, "head", long.class);
        TAIL = lookup.findVarHandle(HeadAndTailRef.class, "tail", long.class);
      } catch (ReflectiveOperationException e) {
        throw new ExceptionInInitializerError(e);
      }
    }
  }
}
