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

package com.github.mizosoft.ripple.internal.concurrent;

import com.github.mizosoft.ripple.SchedulingContext;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

/**
 * Provides the default {@link SchedulingContext} that is used across the library when no context
 * is supplied by the user.
 */
public class SharedContexts {
  static final String THREAD_NAME_PROP = "com.github.mizosoft.ripple.sharedContext.threadName";

  static final String DEFAULT_THREAD_NAME = "ripple-context";

  private static final ThreadFactory threadFactory =
      r -> {
        var thread = new Thread(r);
        thread.setName(loadThreadName());
        thread.setDaemon(true);
        return thread;
      };

  private SharedContexts() {}

  static String loadThreadName() {
    var threadName = System.getProperty(THREAD_NAME_PROP);
    return threadName != null && !threadName.isBlank() ? threadName : DEFAULT_THREAD_NAME;
  }

  /** Returns the shared context, creating it on first call. */
  public static SchedulingContext context() {
    return ContextHolder.CONTEXT;
  }

  private static final class ContextHolder {
    static final SchedulingContext CONTEXT =
        new SerialSchedulingContext(Executors.newSingleThreadExecutor(threadFactory));
  }
}
