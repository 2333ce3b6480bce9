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

import static java.util.Objects.requireNonNull;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Tracks a value computed from the database. The value is evaluated once when the observation
 * starts, then again after every committed transaction that may have changed it.
 *
 * <pre>{@code
 * var playerCount = ValueObservation.tracking((Connection db) -> db.count("player"));
 * playerCount.publisher(database).subscribe(subscriber);
 * }</pre>
 *
 * @param <D> the type of database connections
 * @param <T> the type of observed values
 */
public final class ValueObservation<D, T> {
  private final DatabaseFunction<? super D, ? extends T> value;

  private ValueObservation(DatabaseFunction<? super D, ? extends T> value) {
    this.value = requireNonNull(value);
  }

  /** Returns the function that computes the tracked value. */
  public DatabaseFunction<? super D, ? extends T> value() {
    return value;
  }

  /** Returns an observation of this observation's values transformed by the given function. */
  public <R> ValueObservation<D, R> map(Function<? super T, ? extends R> mapper) {
    requireNonNull(mapper);
    return new ValueObservation<D, R>(db -> mapper.apply(value.apply(db)));
  }

  /**
   * Starts this observation on the given reader without a publisher. Callbacks are invoked on the
   * reader's threads.
   */
  public Cancellable start(
      DatabaseReader<D> reader,
      SchedulingPolicy policy,
      Consumer<? super Throwable> onError,
      Consumer<? super T> onChange) {
    return reader.startObservation(value, policy, onError, onChange);
  }

  /** Returns a publisher of this observation's values that delivers on the shared context. */
  public ValuePublisher<T> publisher(DatabaseReader<D> reader) {
    return publisher(reader, SchedulingContext.shared());
  }

  /** Returns a publisher of this observation's values that delivers on the given context. */
  public ValuePublisher<T> publisher(DatabaseReader<D> reader, SchedulingContext context) {
    requireNonNull(reader);
    return new ValuePublisher<T>(
        (policy, onError, onChange) -> reader.startObservation(value, policy, onError, onChange),
        SchedulingPolicy.ASYNC,
        context);
  }

  public static <D, T> ValueObservation<D, T> tracking(
      DatabaseFunction<? super D, ? extends T> value) {
    return new ValueObservation<>(value);
  }

  @Override
  public String toString() {
    return "ValueObservation[" + value + "]";
  }
}
