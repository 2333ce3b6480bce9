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

import com.github.mizosoft.ripple.internal.concurrent.SerialSchedulingContext;
import com.github.mizosoft.ripple.internal.concurrent.SharedContexts;
import java.util.concurrent.Executor;

/**
 * The execution venue on which publishers deliver their signals. A context must execute submitted
 * tasks serially and in submission order, and must be able to tell whether the calling thread is
 * currently running one of its tasks.
 */
public interface SchedulingContext extends Executor {

  /** Returns {@code true} if the calling thread is currently executing a task of this context. */
  boolean isCurrent();

  /** Returns a context that runs its tasks serially on the given executor. */
  static SchedulingContext serial(Executor delegate) {
    return new SerialSchedulingContext(delegate);
  }

  /**
   * Returns the context used by publishers created without an explicit one. It runs tasks on a
   * single daemon thread that is created on first use.
   */
  static SchedulingContext shared() {
    return SharedContexts.context();
  }
}
