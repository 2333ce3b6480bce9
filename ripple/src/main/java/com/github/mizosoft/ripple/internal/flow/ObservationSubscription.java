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

import com.github.mizosoft.ripple.Cancellable;
import com.github.mizosoft.ripple.ContractViolationException;
import com.github.mizosoft.ripple.SchedulingPolicy;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.concurrent.Flow.Subscriber;
import java.util.concurrent.RejectedExecutionException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A subscription that relays the values of a database observation to a subscriber while
 * respecting its demand. The observation is started on the first positive request, and is stopped
 * whenever demand is exhausted, to be started again on the next request.
 *
 * <p>State transitions are decided while holding the lock. Observations are started and cancelled,
 * and synchronous signals are delivered, only after the lock is released. Asynchronous signals are
 * queued onto the context while holding the lock so that they're delivered in the order they were
 * decided.
 */
public final class ObservationSubscription<T> extends AbstractGuardedSubscription<T> {
  private static final Logger logger = System.getLogger(ObservationSubscription.class.getName());

  private enum State {
    WAITING_FOR_DEMAND,
    OBSERVING,
    FINISHED
  }

  private final ObservationStarter<T> starter;
  private final SchedulingGate gate;

  @GuardedBy("lock")
  private final Demand demand = new Demand();

  @GuardedBy("lock")
  private State state = State.WAITING_FOR_DEMAND;

  /** The slot of the active observation. Non-null if and only if observing. */
  @GuardedBy("lock")
  private @Nullable ObservationSlot slot;

  @GuardedBy("lock")
  private boolean firstObservation = true;

  /** Whether the next signal is delivered on the calling thread. */
  @GuardedBy("lock")
  private boolean syncNextDelivery;

  /** Set when an observation callback breaks the synchronous delivery contract. */
  @GuardedBy("lock")
  private @Nullable ContractViolationException pendingViolation;

  public ObservationSubscription(
      Subscriber<? super T> downstream, ObservationStarter<T> starter, SchedulingGate gate) {
    super(downstream);
    this.starter = requireNonNull(starter);
    this.gate = requireNonNull(gate);
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

    ObservationSlot slotToStart = null;
    SchedulingPolicy policy = SchedulingPolicy.ASYNC;
    lock.lock();
    try {
      switch (state) {
        case WAITING_FOR_DEMAND:
          policy = gate.observationPolicy(firstObservation);
          if (policy == SchedulingPolicy.IMMEDIATE && !gate.isOnContext()) {
            break; // Fail after unlocking.
          }
          if (!firstObservation) {
            logger.log(
                Level.DEBUG, () -> "Restarting observation after demand exhaustion: " + this);
          }
          demand.add(n);
          firstObservation = false;
          syncNextDelivery = policy == SchedulingPolicy.IMMEDIATE;
          slotToStart = new ObservationSlot();
          slot = slotToStart;
          state = State.OBSERVING;
          break;

        case OBSERVING:
          demand.add(n);
          return;

        case FINISHED:
          return;

        default:
          throw new AssertionError("unexpected state: " + state);
      }
    } finally {
      lock.unlock();
    }

    if (slotToStart == null) {
      failOnContractViolation(
          new ContractViolationException(
              "subscriptions with the IMMEDIATE policy must request from the scheduling context"));
    } else {
      startObservation(slotToStart, policy);
    }
  }

  private void startObservation(ObservationSlot startedSlot, SchedulingPolicy policy) {
    Cancellable handle;
    try {
      handle =
          starter.start(
              policy,
              error -> onObservationError(startedSlot, error),
              value -> onObservationValue(startedSlot, value));
    } catch (ContractViolationException | RejectedExecutionException e) {
      throw e;
    } catch (RuntimeException e) {
      onObservationError(startedSlot, e);
      return;
    }

    // The handle may arrive after the observation was stopped by a synchronous callback, in
    // which case it's cancelled right away.
    startedSlot.setOrCancel(requireNonNull(handle, "startObservation returned a null handle"));
    if (policy == SchedulingPolicy.IMMEDIATE) {
      checkImmediateDelivery(startedSlot);
    }
  }

  private void checkImmediateDelivery(ObservationSlot startedSlot) {
    ContractViolationException violation;
    lock.lock();
    try {
      violation = pendingViolation;
      pendingViolation = null;
      if (violation == null
          && state == State.OBSERVING
          && slot == startedSlot
          && syncNextDelivery) {
        violation =
            new ContractViolationException(
                "observation started with the IMMEDIATE policy returned without delivering its"
                    + " initial value");
      }
    } finally {
      lock.unlock();
    }

    if (violation != null) {
      failOnContractViolation(violation);
    }
  }

  private void onObservationValue(ObservationSlot sourceSlot, @Nullable T value) {
    if (value == null) {
      onObservationError(sourceSlot, new NullPointerException("observed value is null"));
      return;
    }

    ObservationSlot slotToCancel = null;
    RejectedExecutionException rejection = null;
    boolean synchronous;
    lock.lock();
    try {
      // Values from a stopped observation, or arriving without demand, are dropped.
      if (state != State.OBSERVING || slot != sourceSlot || !demand.consumeOne()) {
        return;
      }

      synchronous = gate.deliversSynchronously() || syncNextDelivery;
      if (syncNextDelivery && !gate.isOnContext()) {
        pendingViolation =
            new ContractViolationException(
                "initial value delivered synchronously off the scheduling context");
        slotToCancel = finishLocked();
        synchronous = false;
      } else {
        syncNextDelivery = false;
        if (demand.isExhausted()) {
          slotToCancel = sourceSlot;
          slot = null;
          state = State.WAITING_FOR_DEMAND;
        }
        if (!synchronous) {
          rejection = dispatchLocked(() -> submitOnNext(value));
          if (rejection != null) {
            slotToCancel = finishLocked();
            if (slotToCancel == null) {
              slotToCancel = sourceSlot;
            }
          }
        }
      }
    } finally {
      lock.unlock();
    }

    if (slotToCancel != null) {
      slotToCancel.cancel();
    }
    if (rejection != null) {
      onRejected(rejection);
    } else if (synchronous) {
      submitOnNext(value);
    }
  }

  private void onObservationError(ObservationSlot sourceSlot, Throwable error) {
    requireNonNull(error);
    ObservationSlot slotToCancel;
    RejectedExecutionException rejection = null;
    boolean synchronous;
    lock.lock();
    try {
      if (state != State.OBSERVING || slot != sourceSlot) {
        slotToCancel = null;
        synchronous = false;
      } else {
        synchronous = gate.deliversSynchronously() || syncNextDelivery;
        if (syncNextDelivery && !gate.isOnContext()) {
          pendingViolation =
              new ContractViolationException(
                  "initial error delivered synchronously off the scheduling context");
          pendingViolation.addSuppressed(error);
          synchronous = false;
        } else if (!synchronous) {
          rejection = dispatchLocked(() -> submitOnError(error));
        }
        syncNextDelivery = false;
        slotToCancel = finishLocked();
      }
    } finally {
      lock.unlock();
    }

    if (slotToCancel == null) {
      FlowSupport.onDroppedException(error);
      return;
    }

    slotToCancel.cancel();
    if (rejection != null) {
      rejection.addSuppressed(error);
      onRejected(rejection);
    } else if (synchronous) {
      submitOnError(error);
    }
  }

  /** Transitions to FINISHED, returning the slot of the active observation if any. */
  @GuardedBy("lock")
  private @Nullable ObservationSlot finishLocked() {
    var currentSlot = slot;
    slot = null;
    state = State.FINISHED;
    return currentSlot;
  }

  @GuardedBy("lock")
  private @Nullable RejectedExecutionException dispatchLocked(Runnable signal) {
    try {
      gate.deliver(false, signal);
      return null;
    } catch (RejectedExecutionException e) {
      return e;
    }
  }

  private void onRejected(RejectedExecutionException rejection) {
    logger.log(Level.ERROR, () -> "Scheduling context rejected a signal of " + this, rejection);
    cancel();
    throw rejection;
  }

  private void failOnContractViolation(ContractViolationException violation) {
    logger.log(Level.ERROR, violation.getMessage(), violation);
    cancel();
    throw violation;
  }

  @Override
  protected void abort() {
    ObservationSlot slotToCancel;
    lock.lock();
    try {
      slotToCancel = finishLocked();
    } finally {
      lock.unlock();
    }

    if (slotToCancel != null) {
      slotToCancel.cancel();
    }
  }

  @Override
  public String toString() {
    lock.lock();
    try {
      return "ObservationSubscription[state="
          + state
          + ", "
          + demand
          + ", gate="
          + gate
          + ", done="
          + isDone()
          + "]";
    } finally {
      lock.unlock();
    }
  }
}
