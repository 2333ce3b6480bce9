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

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.ripple.SchedulingContext;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link SchedulingContext} that runs its tasks one at a time, in submission order, on a delegate
 * executor. At most one drain loop is scheduled on the delegate at any time. The thread running
 * that loop is the context's current thread.
 */
public final class SerialSchedulingContext implements SchedulingContext {
  /** A drain loop is scheduled or running. */
  private static final int DRAINING = 1;

  /** Tasks were added while draining, so the loop must poll again before exiting. */
  private static final int RECHECK = 2;

  /** No more tasks are accepted. */
  private static final int CLOSED = 4;

  private static final VarHandle CTL;

  static {
    try {
      CTL = MethodHandles.lookup().findVarHandle(SerialSchedulingContext.class, "ctl", int.class);
    } catch (NoSuchFieldException | IllegalAccessException e) {
      throw new ExceptionInInitializerError(e);
    }
  }

  private final Queue<Task> tasks = new ConcurrentLinkedQueue<>();
  private final Executor delegate;

  @SuppressWarnings("unused") // VarHandle indirection.
  private volatile int ctl;

  private volatile @Nullable Thread drainingThread;

  public SerialSchedulingContext(Executor delegate) {
    this.delegate = requireNonNull(delegate);
  }

  @Override
  public boolean isCurrent() {
    return drainingThread == Thread.currentThread();
  }

  @Override
  public void execute(Runnable command) {
    if (is(CLOSED)) {
      throw new RejectedExecutionException("context is shut down");
    }

    var task = new Task(command);
    tasks.add(task);
    while (true) {
      int c = ctl;
      if ((c & RECHECK) != 0) {
        return; // The running loop polls again after we've added our task.
      }
      if ((c & DRAINING) != 0) {
        if (CTL.compareAndSet(this, c, c | RECHECK)) {
          return;
        }
      } else if (CTL.compareAndSet(this, c, c | DRAINING)) {
        scheduleDrain(task);
        return;
      }
    }
  }

  /** Stops accepting new tasks. Tasks already submitted still run. */
  public void shutdown() {
    CTL.getAndBitwiseOr(this, CLOSED);
  }

  private void scheduleDrain(Task trigger) {
    try {
      delegate.execute(this::drain);
    } catch (RuntimeException | Error e) {
      CTL.getAndBitwiseAnd(this, ~(DRAINING | RECHECK));

      // A rejected task is dropped. If it was already drained by a concurrent loop then it has
      // run, and there's nothing to report.
      if (!(e instanceof RejectedExecutionException) || tasks.remove(trigger)) {
        throw e;
      }
    }
  }

  private void drain() {
    // Non-null if the delegate runs the loop inline from within one of our tasks.
    var enclosingThread = drainingThread;
    drainingThread = Thread.currentThread();
    try {
      runTasks();
    } finally {
      drainingThread = enclosingThread;
    }
  }

  private void runTasks() {
    boolean interrupted = false;
    do {
      Task task;
      while ((task = tasks.poll()) != null) {
        interrupted |= Thread.interrupted();
        try {
          task.run();
        } catch (Throwable t) {
          onTaskFailure(t);
          throw t;
        }
      }
    } while (!tryExit());

    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  /** Consumes a pending RECHECK and returns false, or clears DRAINING and returns true. */
  private boolean tryExit() {
    while (true) {
      int c = ctl;
      if ((c & RECHECK) != 0) {
        if (CTL.compareAndSet(this, c, c & ~RECHECK)) {
          return false;
        }
      } else if (CTL.compareAndSet(this, c, c & ~DRAINING)) {
        return true;
      }
    }
  }

  /**
   * Releases the loop before a task's exception propagates to the delegate, scheduling a new loop
   * for the remaining tasks. The new loop is scheduled from the common pool as the delegate might
   * run it inline, which would delay the exception.
   */
  private void onTaskFailure(Throwable failure) {
    CTL.getAndBitwiseAnd(this, ~(DRAINING | RECHECK));
    if (!tasks.isEmpty()) {
      try {
        ForkJoinPool.commonPool().execute(() -> execute(() -> {}));
      } catch (RuntimeException | Error e) {
        failure.addSuppressed(e);
      }
    }
  }

  private boolean is(int bit) {
    return (ctl & bit) != 0;
  }

  @Override
  public String toString() {
    return "SerialSchedulingContext@"
        + Integer.toHexString(hashCode())
        + "[delegate="
        + delegate
        + ", draining="
        + is(DRAINING)
        + ", closed="
        + is(CLOSED)
        + "]";
  }

  /** Gives each submitted task its own identity so a rejected one can be removed from the queue. */
  private static final class Task implements Runnable {
    private final Runnable command;

    Task(Runnable command) {
      this.command = requireNonNull(command);
    }

    @Override
    public void run() {
      command.run();
    }

    @Override
    public String toString() {
      return command.toString();
    }
  }
}
