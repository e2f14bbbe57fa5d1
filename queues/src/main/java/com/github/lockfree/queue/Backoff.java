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

/**
 * 自旋重试的退避策略，CAS 失败后先忙等，之后让出 CPU，但从不挂起线程
 * <p>
 *
 * An exponential backoff for the retry loops of the lock-free queues. Each step doubles the number
 * of {@link Thread#onSpinWait()} hints issued, up to a limit, after which {@link #snooze()} yields
 * the processor instead. A thread is never parked, so a queue operation using this backoff always
 * remains non-blocking.
 * <p>
 * An instance is confined to the thread performing a single queue operation.
 */
final class Backoff {
  static final int SPIN_LIMIT = 6;
  static final int YIELD_LIMIT = 10;

  int step;

  /**
   * Backs off in a lock-free loop after a failed CAS, when the competing thread is expected to
   * make progress immediately.
   */
  void spin() {
    int spins = 1 << Math.min(step, SPIN_LIMIT);
    for (int i = 0; i < spins; i++) {
      Thread.onSpinWait();
    }
    if (step <= SPIN_LIMIT) {
      step++;
    }
  }

  /**
   * Backs off while waiting for another thread to finish publishing its slot, yielding the
   * processor once spinning has not been productive.
   */
  void snooze() {
    if (step <= SPIN_LIMIT) {
      for (int i = 0; i < (1 << step); i++) {
        Thread.onSpinWait();
      }
    } else {
      Thread.yield();
    }
    if (step <= YIELD_LIMIT) {
      step++;
    }
  }
}
