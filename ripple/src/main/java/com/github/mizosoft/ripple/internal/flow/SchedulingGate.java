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
import com.github.mizosoft.ripple.SchedulingPolicy;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Decides whether a signal is delivered on the calling thread or queued onto a {@link
 * SchedulingContext}. Whether a particular delivery is synchronous is tracked by the subscription,
 * which consults this gate for its policy.
 */
public final class SchedulingGate {
  private enum Mode {
    /** All signals are queued onto the context. */
    ASYNC,

    /** The first signal is delivered on the calling thread, the rest are queued. */
    IMMEDIATE_FIRST,

    /** All signals are delivered on the calling thread. There's no context. */
    SYNCHRONOUS
  }

  private static final SchedulingGate SYNCHRONOUS_GATE = new SchedulingGate(Mode.SYNCHRONOUS, null);

  private final Mode mode;
  private final @Nullable SchedulingContext context;

  private SchedulingGate(Mode mode, @Nullable SchedulingContext context) {
    this.mode = mode;
    this.context = context;
  }

  /** Returns {@code true} if every signal is delivered synchronously. */
  public boolean deliversSynchronously() {
    return mode == Mode.SYNCHRONOUS;
  }

  /**
   * Returns the policy with which an observation is started. Only the first observation of a
   * subscription can fetch its initial value immediately, as later ones are restarted from
   * whatever thread requests more demand.
   */
  public SchedulingPolicy observationPolicy(boolean firstObservation) {
    return firstObservation && mode == Mode.IMMEDIATE_FIRST
        ? SchedulingPolicy.IMMEDIATE
        : SchedulingPolicy.ASYNC;
  }

  /** Returns {@code true} if synchronous delivery is allowed on the calling thread. */
  public boolean isOnContext() {
    return context == null || context.isCurrent();
  }

  /**
   * Runs the given signal on the calling thread if {@code synchronous} is {@code true}, otherwise
   * queues it onto this gate's context.
   */
  public void deliver(boolean synchronous, Runnable signal) {
    var currentContext = context;
    if (synchronous || currentContext == null) {
      signal.run();
    } else {
      currentContext.execute(signal);
    }
  }

  @Override
  public String toString() {
    return "SchedulingGate[" + mode + (context != null ? ", " + context : "") + "]";
  }

  public static SchedulingGate of(SchedulingPolicy policy, SchedulingContext context) {
    requireNonNull(context);
    switch (requireNonNull(policy)) {
      case ASYNC:
        return new SchedulingGate(Mode.ASYNC, context);
      case IMMEDIATE:
        return new SchedulingGate(Mode.IMMEDIATE_FIRST, context);
      default:
        throw new AssertionError("unexpected policy: " + policy);
    }
  }

  /** Returns a gate that delivers everything on the calling thread. */
  public static SchedulingGate synchronous() {
    return SYNCHRONOUS_GATE;
  }
}
