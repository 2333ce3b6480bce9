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

/**
 * A handle to an ongoing database operation, typically an observation, that can be stopped. {@link
 * #cancel()} is idempotent: calling it more than once, or after the operation has already
 * finished, has no effect. Closing a {@code Cancellable} cancels it, so owners can release it with
 * try-with-resources.
 */
@FunctionalInterface
public interface Cancellable extends AutoCloseable {

  /** Stops the operation. No further callbacks are initiated once this method returns. */
  void cancel();

  @Override
  default void close() {
    cancel();
  }

  /**
   * Returns a {@code Cancellable} that runs the given stop function at most once, no matter how
   * many times or from how many threads it is cancelled.
   */
  static Cancellable once(Runnable stop) {
    return new OnceCancellable(stop);
  }
}
