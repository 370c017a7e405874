// Copyright (c) 2025 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.listener;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps track of the active instances of a given type and lets a thread wait for all of them to
 * be released.
 *
 * <p>A listener container adds each consumer when it starts and the consumer releases itself once
 * the broker confirms its cancellation. On shutdown the container waits on {@link
 * #await(Duration)} before declaring itself stopped.
 *
 * <p>Instances are thread-safe. Adding an instance twice or releasing an instance that is not
 * registered has no effect.
 *
 * @param <T> the type of the tracked instances
 */
public class ActiveObjectCounter<T> {

  private static final Logger LOGGER = LoggerFactory.getLogger(ActiveObjectCounter.class);

  private final ConcurrentMap<T, CountDownLatch> locks = new ConcurrentHashMap<>();
  private volatile boolean active = true;

  public void add(T object) {
    if (this.locks.putIfAbsent(object, new CountDownLatch(1)) == null) {
      LOGGER.debug("Added active object {}", object);
    }
  }

  public void release(T object) {
    CountDownLatch lock = this.locks.remove(object);
    if (lock != null) {
      LOGGER.debug("Released active object {}", object);
      lock.countDown();
    }
  }

  /**
   * Wait for the instances registered at call time to be released.
   *
   * @param timeout maximum time to wait
   * @return true if all the instances have been released, false on timeout
   */
  public boolean await(Duration timeout) {
    long deadline = System.nanoTime() + timeout.toNanos();
    List<CountDownLatch> latches = new ArrayList<>(this.locks.values());
    try {
      for (CountDownLatch latch : latches) {
        long remaining = deadline - System.nanoTime();
        if (!latch.await(remaining, TimeUnit.NANOSECONDS)) {
          LOGGER.debug("Timed out waiting for {} active object(s)", this.locks.size());
          return false;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AmqpException(e);
    }
    return true;
  }

  /** Wait for the instances registered at call time to be released, without time limit. */
  public void await() {
    List<CountDownLatch> latches = new ArrayList<>(this.locks.values());
    try {
      for (CountDownLatch latch : latches) {
        latch.await();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AmqpException(e);
    }
  }

  public int getCount() {
    return this.locks.size();
  }

  /**
   * Whether the owner of the counter is still running.
   *
   * @return false after {@link #deactivate()}
   */
  public boolean isActive() {
    return this.active;
  }

  public void deactivate() {
    this.active = false;
  }

  /** Forget all the registered instances and activate the counter again. */
  public void reset() {
    this.locks.values().forEach(CountDownLatch::countDown);
    this.locks.clear();
    this.active = true;
  }
}
