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

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/** Helpers for implementing reactive streams subscriptions and the like. */
public class FlowSupport {
  private static final Logger logger = System.getLogger(FlowSupport.class.getName());

  private static final int DROPPED_EXCEPTION_STACK_TRACE_LIMIT = 10;

  /** An executor that executes the runnable in the calling thread. */
  public static final Executor SYNC_EXECUTOR = SyncExecutor.INSTANCE;

  private enum SyncExecutor implements Executor {
    INSTANCE;

    @Override
    public void execute(Runnable command) {
      command.run();
    }

    @Override
    public String toString() {
      return SyncExecutor.class.getSimpleName();
    }
  }

  private FlowSupport() {} // non-instantiable

  /**
   * Returns an {@code IllegalArgumentException} to signal if the subscriber requests a negative
   * number of items.
   */
  public static IllegalArgumentException illegalRequest() {
    return new IllegalArgumentException("negative subscription request");
  }

  public static void onDroppedException(Throwable exception) {
    if (logger.isLoggable(Level.WARNING)) {
      logger.log(
          Level.WARNING,
          () ->
              "Dropped exception: "
                  + System.lineSeparator()
                  + "\tat "
                  + StackWalker.getInstance()
                      .walk(
                          frames ->
                              frames
                                  .limit(DROPPED_EXCEPTION_STACK_TRACE_LIMIT)
                                  .map(StackWalker.StackFrame::toString)
                                  .collect(Collectors.joining(System.lineSeparator() + "\tat "))),
          exception);
    }
  }
}
