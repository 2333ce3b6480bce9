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

package com.github.mizosoft.ripple;

import static java.util.Objects.requireNonNull;

import java.util.concurrent.atomic.AtomicReference;

/** A {@link Cancellable} that consumes its stop function on first cancellation. */
final class OnceCancellable implements Cancellable {
  private final AtomicReference<Runnable> stop;

  OnceCancellable(Runnable stop) {
    this.stop = new AtomicReference<>(requireNonNull(stop));
  }

  @Override
  public void cancel() {
    var stopFunction = stop.getAndSet(null);
    if (stopFunction != null) {
      stopFunction.run();
    }
  }

  boolean isCancelled() {
    return stop.get() == null;
  }

  @Override
  public String toString() {
    return "Cancellable[" + (isCancelled() ? "cancelled" : "active") + "]";
  }
}
