/*
 * Copyright (c) 2024 Moataz Hussein
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.mizosoft.ripple.internal.flow;

import static com.github.mizosoft.ripple.internal.Validate.requireArgument;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Represents a subscriber's outstanding demand for items. Demand saturates at {@link #UNBOUNDED},
 * which absorbs any further addition and is never consumed.
 */
public final class Demand {
  /** Demand that is never exhausted. */
  public static final long UNBOUNDED = Long.MAX_VALUE;

  private final AtomicLong demand;

  /** Creates zero demand. */
  public Demand() {
    demand = new AtomicLong();
  }

  /**
   * Adds {@code n} to this demand, saturating at {@link #UNBOUNDED}. Returns {@code true} if all
   * demand was previously fulfilled.
   *
   * @throws IllegalArgumentException if {@code n} is negative
   */
  public boolean add(long n) {
    requireArgument(n >= 0, "negative demand: %d", n);
    return demand.getAndAccumulate(n, Demand::saturatedAdd) == 0;
  }

  /**
   * Consumes one unit of demand. Returns {@code false} without changing anything if there's no
   * demand left. Unbounded demand is left as is.
   */
  public boolean consumeOne() {
    while (true) {
      long current = demand.get();
      if (current == 0) {
        return false;
      }
      if (current == UNBOUNDED || demand.compareAndSet(current, current - 1)) {
        return true;
      }
    }
  }

  /** Returns the remaining demand. */
  public long remaining() {
    return demand.get();
  }

  public boolean isExhausted() {
    return demand.get() == 0;
  }

  static long saturatedAdd(long x, long y) {
    long r = x + y;
    return r < 0 ? UNBOUNDED : r; // Overflow
  }

  @Override
  public String toString() {
    long current = demand.get();
    return "Demand[" + (current == UNBOUNDED ? "unbounded" : current) + "]";
  }
}
