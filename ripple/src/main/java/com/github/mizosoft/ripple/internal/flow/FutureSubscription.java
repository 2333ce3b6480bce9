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

import com.github.mizosoft.ripple.SchedulingContext;
import com.github.mizosoft.ripple.internal.Utils;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow.Subscriber;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A subscription that runs a single asynchronous database operation on first positive demand, and
 * delivers its result followed by completion, or its failure, on a scheduling context. A {@code
 * null} result completes the subscription without an item.
 */
public final class FutureSubscription<T> extends AbstractGuardedSubscription<T> {
  private static final Logger logger = System.getLogger(FutureSubscription.class.getName());

  private enum State {
    WAITING_FOR_DEMAND,
    WAITING_FOR_FULFILLMENT,
    FINISHED
  }

  private final Supplier<? extends CompletionStage<? extends T>> operation;
  private final SchedulingContext context;

  @GuardedBy("lock")
  private State state = State.WAITING_FOR_DEMAND;

  public FutureSubscription(
      Subscriber<? super T> downstream,
      Supplier<? extends CompletionStage<? extends T>> operation,
      SchedulingContext context) {
    super(downstream);
    this.operation = requireNonNull(operation);
    this.context = requireNonNull(context);
  }

  @Override
  public void request(long n) {
    if (n < 0) {
      cancelOnError(FlowSupport.illegalRequest());
      return;
    }
    if (n == 0) {
      return;
    }

    lock.lock();
    try {
      if (state != State.WAITING_FOR_DEMAND) {
        return; // The operation runs once no matter how demand arrives.
      }
      state = State.WAITING_FOR_FULFILLMENT;
    } finally {
      lock.unlock();
    }

    CompletionStage<? extends T> stage;
    try {
      stage = requireNonNull(operation.get(), "operation returned a null stage");
    } catch (RuntimeException e) {
      stage = CompletableFuture.failedFuture(e);
    }
    stage.whenComplete(this::onFulfillment);
  }

  private void onFulfillment(@Nullable T result, @Nullable Throwable exception) {
    RejectedExecutionException rejection = null;
    lock.lock();
    try {
      if (state != State.WAITING_FOR_FULFILLMENT) {
        if (exception != null) {
          FlowSupport.onDroppedException(Utils.getDeepCompletionCause(exception));
        }
        return;
      }
      state = State.FINISHED;
      try {
        context.execute(() -> deliver(result, exception));
      } catch (RejectedExecutionException e) {
        rejection = e;
      }
    } finally {
      lock.unlock();
    }

    // The completing thread isn't the caller of any subscription method, so the rejection is
    // reported to downstream from here instead of being thrown.
    if (rejection != null) {
      logger.log(Level.ERROR, () -> "Scheduling context rejected the result of " + this, rejection);
      cancelOnError(rejection);
    }
  }

  private void deliver(@Nullable T result, @Nullable Throwable exception) {
    if (exception != null) {
      submitOnError(Utils.getDeepCompletionCause(exception));
    } else {
      if (result != null) {
        submitOnNext(result);
      }
      submitOnComplete();
    }
  }

  @Override
  protected void abort() {
    lock.lock();
    try {
      state = State.FINISHED;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    lock.lock();
    try {
      return "FutureSubscription[state="
          + state
          + ", context="
          + context
          + ", done="
          + isDone()
          + "]";
    } finally {
      lock.unlock();
    }
  }
}
