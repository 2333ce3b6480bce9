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
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;

/**
 * A one-use slot for the {@link Cancellable} of an active database observation. The handle is
 * taken out of the slot at most once, so it is cancelled at most once regardless of how many
 * times or from how many threads the slot is cancelled. A handle arriving after the slot has been
 * cancelled is cancelled immediately.
 */
public final class ObservationSlot {
  private static final Logger logger = System.getLogger(ObservationSlot.class.getName());

  private static final Cancellable UNSET = () -> {};
  private static final Cancellable CANCELLED = () -> {};

  private static final VarHandle HANDLE;

  static {
    try {
      HANDLE =
          MethodHandles.lookup().findVarHandle(ObservationSlot.class, "handle", Cancellable.class);
    } catch (NoSuchFieldException | IllegalAccessException e) {
      throw new ExceptionInInitializerError(e);
    }
  }

  @SuppressWarnings("FieldMayBeFinal") // VarHandle indirection.
  private volatile Cancellable handle = UNSET;

  public ObservationSlot() {}

  public boolean isCancelled() {
    return handle == CANCELLED;
  }

  /** Sets the incoming handle, cancelling it if this slot is already set or cancelled. */
  public boolean setOrCancel(Cancellable incoming) {
    requireNonNull(incoming);
    if (!HANDLE.compareAndSet(this, UNSET, incoming)) {
      guardedCancel(incoming);
      return false;
    }
    return true;
  }

  /** Cancels the held handle if set. Subsequent calls have no effect. */
  public void cancel() {
    var cancelledHandle = (Cancellable) HANDLE.getAndSet(this, CANCELLED);
    if (cancelledHandle != CANCELLED) {
      guardedCancel(cancelledHandle);
    }
  }

  private static void guardedCancel(Cancellable cancellable) {
    try {
      cancellable.cancel();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Exception thrown while cancelling a database observation", e);
    }
  }

  @Override
  public String toString() {
    var currentHandle = handle;
    return "ObservationSlot["
        + (currentHandle == UNSET ? "unset" : currentHandle == CANCELLED ? "cancelled" : "set")
        + "]";
  }
}
