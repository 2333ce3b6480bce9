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

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.ripple.ContractViolationException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.concurrent.Flow.Subscriber;
import java.util.concurrent.Flow.Subscription;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A {@link Subscription} whose state transitions are guarded by a reentrant lock, and which
 * guarantees downstream receives at most one terminal signal and nothing after it or after
 * cancellation. Implementations decide what to deliver while holding {@link #lock} and invoke
 * downstream after releasing it, either directly or from a task queued while holding it.
 */
@SuppressWarnings("unused") // VarHandle indirection.
public abstract class AbstractGuardedSubscription<T> implements Subscription {
  private static final Logger logger =
      System.getLogger(AbstractGuardedSubscription.class.getName());

  private static final VarHandle DONE;

  static {
    try {
      DONE =
          MethodHandles.lookup()
              .findVarHandle(AbstractGuardedSubscription.class, "done", boolean.class);
    } catch (NoSuchFieldException | IllegalAccessException e) {
      throw new ExceptionInInitializerError(e);
    }
  }

  /** Guards the state of implementations. Reentrant as downstream may call back synchronously. */
  protected final ReentrantLock lock = new ReentrantLock();

  private final Subscriber<? super T> downstream;

  /** Whether downstream has been cancelled or has received a terminal signal. */
  private volatile boolean done;

  protected AbstractGuardedSubscription(Subscriber<? super T> downstream) {
    this.downstream = requireNonNull(downstream);
  }

  /**
   * Passes this subscription to downstream's {@code onSubscribe}. A contract violation or rejection
   * raised by a request made within {@code onSubscribe}, after which this subscription has already
   * cancelled itself, is rethrown to the caller as it would be outside {@code onSubscribe}.
   */
  public final void subscribe() {
    try {
      downstream.onSubscribe(this);
    } catch (ContractViolationException | RejectedExecutionException e) {
      if (done) {
        throw e;
      }
      cancelOnError(e);
    } catch (Throwable t) {
      cancelOnError(t);
    }
  }

  @Override
  public final void cancel() {
    if (DONE.compareAndSet(this, false, true)) {
      guardedAbort();
    }
  }

  /**
   * Releases resources held by this subscription after downstream cancels or is completed
   * exceptionally due to a failure of its own. Called at most once, without holding the lock.
   */
  protected abstract void abort();

  private void guardedAbort() {
    try {
      abort();
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown during subscription cancellation", t);
    }
  }

  /**
   * Returns {@code true} if downstream is no longer to receive signals. {@code false} result is
   * immediately outdated.
   */
  protected final boolean isDone() {
    return done;
  }

  /** Passes the item downstream unless done. Cancels and completes exceptionally if it throws. */
  protected final void submitOnNext(T item) {
    if (!done) {
      try {
        downstream.onNext(item);
      } catch (Throwable t) {
        cancelOnError(t);
      }
    }
  }

  /** Completes downstream exceptionally unless done. The exception is otherwise dropped. */
  protected final void submitOnError(Throwable exception) {
    if (DONE.compareAndSet(this, false, true)) {
      try {
        downstream.onError(exception);
      } catch (Throwable t) {
        t.addSuppressed(exception);
        logger.log(Level.WARNING, "Exception thrown by subscriber's onError", t);
      }
    } else {
      FlowSupport.onDroppedException(exception);
    }
  }

  /** Completes downstream normally unless done. */
  protected final void submitOnComplete() {
    if (DONE.compareAndSet(this, false, true)) {
      try {
        downstream.onComplete();
      } catch (Throwable t) {
        logger.log(
            Level.WARNING, () -> "Exception thrown by subscriber's onComplete: " + downstream, t);
      }
    }
  }

  /**
   * Aborts this subscription then completes downstream with the given exception, unless it is
   * already done.
   */
  protected final void cancelOnError(Throwable exception) {
    if (DONE.compareAndSet(this, false, true)) {
      guardedAbort();
      try {
        downstream.onError(exception);
      } catch (Throwable t) {
        t.addSuppressed(exception);
        logger.log(Level.WARNING, "Exception thrown by subscriber's onError", t);
      }
    } else {
      FlowSupport.onDroppedException(exception);
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[downstream=" + downstream + ", done=" + done + "]";
  }
}
