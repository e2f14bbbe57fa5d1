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

import static com.github.lockfree.queue.QueueBuilder.requireArgument;
import static java.util.Objects.requireNonNull;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.AbstractQueue;
import java.util.Iterator;
import java.util.OptionalInt;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * 无界队列，由固定大小的数组块组成的单向链表，块用完时才分配下一个块，
 * 消费完的块从链表头部摘除后交由 GC 回收
 * <p>
 *
 * An unbounded, lock-free, multiple-producer / multiple-consumer FIFO queue backed by a linked
 * list of fixed-size blocks. The queue grows one block at a time when the tail block is exhausted,
 * so an allocation is amortized over the insertions that fill a block, and the elements are never
 * copied.
 *
 * @param <E> the type of elements held in this queue
 */
public final class UnboundedQueue<E> extends UQHeader.HeadAndTailBlockRef<E>
    implements MpmcQueue<E> {
  /*
   * Each block has a producer counter (enqueued) and a consumer counter (dequeued), both of which
   * only increase and never exceed the block size. A producer claims slot i of the tail block by a
   * CAS of enqueued from i to i + 1, and then release-stores its element into the slot. A consumer
   * acquire-loads slot i of the head block where i is the current dequeued count, and if an
   * element is present then it claims the slot by a CAS of dequeued from i to i + 1. A non-null
   * slot is therefore both the "written" marker and the payload, and the acquire that observes it
   * makes the element's state visible to the consumer.
   *
   * A slot belongs to exactly one producer and one consumer because both claims are unique-winner
   * CASes on counters that never move backwards, and a block's slots are never reused. This makes
   * the block-local counters immune to ABA without a generation tag; the logical position of a slot
   * is (block offset + index), and block offsets strictly increase along the list.
   *
   * When a producer observes that the tail block is full it allocates a new block whose first slot
   * already holds its element, and tries to CAS it into the full block's next link. Only one
   * producer wins; the others discard their block and retry against the winner's. The shared tail
   * reference may lag behind the last linked block, and any thread that notices this helps to
   * advance it.
   *
   * A consumer that finds the head block fully consumed unlinks it by CASing the shared head
   * reference to the next block. The retired block is not freed explicitly: a thread that read the
   * head before the unlink may still be inspecting it, and the garbage collector reclaims the block
   * only after every such reference is gone. Blocks are retired strictly in list order.
   *
   * The consumer does not wait for a producer that claimed the head slot but has not yet published
   * its element. Such an element is not yet part of the queue and poll reports the queue as empty.
   */

  /** The number of slots per block if not specified. */
  static final int DEFAULT_BLOCK_SIZE = 32;
  /** The largest supported number of slots per block. */
  static final int MAXIMUM_BLOCK_SIZE = 1 << 20;

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

  final int blockSize;

  /** Creates an empty queue with the default block size. */
  public UnboundedQueue() {
    this(DEFAULT_BLOCK_SIZE);
  }

  /**
   * Creates an empty queue that grows in blocks of {@code blockSize} slots.
   *
   * @param blockSize the number of slots per block
   * @throws IllegalArgumentException if {@code blockSize} is not positive or too large
   */
  public UnboundedQueue(int blockSize) {
    super(firstBlock(blockSize));
    this.blockSize = blockSize;
  }

  static <E> Block<E> firstBlock(int blockSize) {
    requireArgument((blockSize >= 1) && (blockSize <= MAXIMUM_BLOCK_SIZE),
        "block size must be between 1 and %s: %s", MAXIMUM_BLOCK_SIZE, blockSize);
    return new Block<>(blockSize, 0L);
  }

  /**
   * Inserts the specified element at the tail of this queue. As the queue is unbounded, this
   * method never returns {@code false}.
   *
   * @throws NullPointerException if the specified element is null
   * @throws OutOfMemoryError if a new block is required and cannot be allocated, in which case the
   *         queue is left unchanged
   */
  @Override
  public boolean offer(E e) {
    requireNonNull(e);
    var backoff = new Backoff();

    for (;;) {
      Block<E> tail = lvTailBlock();
      int index = tail.lvEnqueued();

      // 1. 当前块还有空闲槽位，CAS 抢占槽位后写入元素
      if (index < blockSize) {
        if (tail.casEnqueued(index, index + 1)) {
          soSlot(tail.slots, index, e);
          return true;
        }
        backoff.spin();
        continue;
      }

      // 2. 当前块已写满，由发现的线程负责分配并链接新块
      Block<E> next = tail.lvNext();
      if (next == null) {
        var block = new Block<E>(blockSize, tail.offset + blockSize, e);
        if (tail.casNext(null, block)) {
          casTailBlock(tail, block);
          return true;
        }
        next = tail.lvNext();
      }

      // 3. 帮助推进滞后的 tail
      casTailBlock(tail, next);
    }
  }

  @Override
  public @Nullable E poll() {
    var backoff = new Backoff();

    for (;;) {
      Block<E> head = lvHeadBlock();
      int index = head.lvDequeued();

      if (index < blockSize) {
        E e = lvSlot(head.slots, index);
        if (e == null) {
          if (head.lvDequeued() == index) {
            // not published yet, or never claimed by a producer
            return null;
          }
          continue;
        }
        if (head.casDequeued(index, index + 1)) {
          soSlot(head.slots, index, null);
          return e;
        }
        backoff.spin();
        continue;
      }

      Block<E> next = head.lvNext();
      if (next == null) {
        return null;
      }
      // retire the exhausted block
      casHeadBlock(head, next);
    }
  }

  @Override
  public @Nullable E peek() {
    for (;;) {
      Block<E> head = lvHeadBlock();
      int index = head.lvDequeued();

      if (index < blockSize) {
        E e = lvSlot(head.slots, index);
        if (head.lvDequeued() != index) {
          continue;
        }
        return e;
      }

      Block<E> next = head.lvNext();
      if (next == null) {
        return null;
      }
      casHeadBlock(head, next);
    }
  }

  @Override
  public int size() {
    for (;;) {
      Block<E> head = lvHeadBlock();
      int dequeued = head.lvDequeued();

      Block<E> tail = lvTailBlock();
      int enqueued = tail.lvEnqueued();
      for (Block<E> next = tail.lvNext(); next != null; next = tail.lvNext()) {
        tail = next;
        enqueued = tail.lvEnqueued();
      }

      // retry until the head did not move while the tail was read
      if ((lvHeadBlock() == head) && (head.lvDequeued() == dequeued)) {
        long size = (tail.offset + enqueued) - (head.offset + dequeued);
        return (int) Math.max(0, Math.min(size, Integer.MAX_VALUE));
      }
    }
  }

  @Override
  public boolean isEmpty() {
    return (size() == 0);
  }

  @Override
  public boolean isFull() {
    return false;
  }

  @Override
  public OptionalInt capacity() {
    return OptionalInt.empty();
  }

  @Override
  public Iterator<E> iterator() {
    throw new UnsupportedOperationException();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{blockSize=" + blockSize + ", size=" + size() + '}';
  }

  /** Returns the number of blocks that are linked from the head, for diagnostics. */
  int linkedBlocks() {
    int count = 0;
    for (Block<E> block = lvHeadBlock(); block != null; block = block.lvNext()) {
      count++;
    }
    return count;
  }

  @SuppressWarnings("unchecked")
  static <E> @Nullable E lvSlot(Object[] slots, int index) {
    return (E) Block.SLOTS.getAcquire(slots, index);
  }

  static void soSlot(Object[] slots, int index, @Nullable Object e) {
    Block.SLOTS.setRelease(slots, index, e);
  }

  /**
   * 数组块，链表中的一个节点
   * <p>
   *
   * A fixed-size segment of the queue. The offset is the logical position of the first slot, which
   * allows the queue's size to be computed from the head and tail blocks alone.
   */
  static final class Block<E> {
    static final VarHandle SLOTS = MethodHandles.arrayElementVarHandle(Object[].class);
    static final VarHandle ENQUEUED, DEQUEUED, NEXT;

    final long offset;
    final Object[] slots;

    volatile int enqueued;
    volatile int dequeued;
    volatile @Nullable Block<E> next;

    /** Creates an empty block. */
    Block(int blockSize, long offset) {
      this.slots = new Object[blockSize];
      this.offset = offset;
    }

    /** Creates a block whose first slot holds the element, to be published by linking it. */
    Block(int blockSize, long offset, E first) {
      this(blockSize, offset);
      slots[0] = first;
      enqueued = 1;
    }

    int lvEnqueued() {
      return enqueued;
    }

    int lvDequeued() {
      return dequeued;
    }

    @Nullable Block<E> lvNext() {
      return next;
    }

    boolean casEnqueued(int expect, int update) {
      return ENQUEUED.compareAndSet(this, expect, update);
    }

    boolean casDequeued(int expect, int update) {
      return DEQUEUED.compareAndSet(this, expect, update);
    }

    boolean casNext(@Nullable Block<E> expect, Block<E> update) {
      return NEXT.compareAndSet(this, expect, update);
    }

    static {
      var lookup = MethodHandles.lookup();
      try {
        ENQUEUED = lookup.findVarHandle(Block.class, "enqueued", int.class);
        DEQUEUED = lookup.findVarHandle(Block.class, "dequeued", int.class);
        NEXT = lookup.findVarHandle(Block.class, "next", Block.class);
      } catch (ReflectiveOperationException e) {
        throw new ExceptionInInitializerError(e);
      }
    }
  }
}

/** The namespace for field padding through inheritance. */
final class UQHeader {

  @SuppressWarnings("PMD.AbstractClassWithoutAbstractMethod")
  abstract static class PadHeadBlock<E> extends AbstractQueue<E> {
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

  /** Enforces a memory layout to avoid false sharing by padding the head block reference. */
  abstract static class HeadBlockRef<E> extends PadHeadBlock<E> {
    volatile UnboundedQueue.Block<E> headBlock;
  }

  abstract static class PadTailBlock<E> extends HeadBlockRef<E> {
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
   * The oldest reachable block, advanced by consumers, and the newest block known to producers,
   * which may lag behind the end of the list until a producer helps to advance it.
   */
  abstract static class HeadAndTailBlockRef<E> extends PadTailBlock<E> {
    static final VarHandle HEAD_BLOCK, TAIL_BLOCK;

    volatile UnboundedQueue.Block<E> tailBlock;

    HeadAndTailBlockRef(UnboundedQueue.Block<E> initial) {
      HEAD_BLOCK.setRelease(this, initial);
      TAIL_BLOCK.setRelease(this, initial);
    }

    UnboundedQueue.Block<E> lvHeadBlock() {
      return headBlock;
    }

    UnboundedQueue.Block<E> lvTailBlock() {
      return tailBlock;
    }

    boolean casHeadBlock(UnboundedQueue.Block<E> expect, UnboundedQueue.Block<E> update) {
      return HEAD_BLOCK.compareAndSet(this, expect, update);
    }

    boolean casTailBlock(UnboundedQueue.Block<E> expect, UnboundedQueue.Block<E> update) {
      return TAIL_BLOCK.compareAndSet(this, expect, update);
    }

    static {
      var lookup = MethodHandles.lookup();
      try {
        HEAD_BLOCK = lookup.findVarHandle(HeadBlockRef.class, "headBlock",
            UnboundedQueue.Block.class);
        TAIL_BLOCK = lookup.findVarHandle(HeadAndTailBlockRef.class, "tailBlock",
            UnboundedQueue.Block.class);
      } catch (ReflectiveOperationException e) {
        throw new ExceptionInInitializerError(e);
      }
    }
  }
}
