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

import java.util.concurrent.Flow.Publisher;

/**
 * Static factories for publishers of database values, reads and writes.
 *
 * <p>Read and write publishers run their operation once per subscriber, when it first requests an
 * item. They then deliver the result followed by completion, or the failure of the operation, on a
 * {@link SchedulingContext} (the {@linkplain SchedulingContext#shared() shared} one unless
 * specified). A {@code null} result completes the subscriber without an item.
 */
public final class DatabasePublishers {
  private DatabasePublishers() {} // non-instantiable

  /** Returns a publisher of the given observation's values. */
  public static <D, T> ValuePublisher<T> value(
      ValueObservation<D, T> observation,
      DatabaseReader<D> reader,
      SchedulingPolicy policy,
      SchedulingContext context) {
    return observation.publisher(reader, context).withPolicy(policy);
  }

  /** Returns a publisher of the writer's connection after each transaction modifying a region. */
  public static <D> Publisher<D> region(DatabaseWriter<D> writer, DatabaseRegion region) {
    return RegionObservation.tracking(region).publisher(writer);
  }

  public static <D, T> Publisher<T> read(
      DatabaseReader<D> reader, DatabaseFunction<? super D, ? extends T> value) {
    return read(reader, value, SchedulingContext.shared());
  }

  /** Returns a publisher of a value read from a consistent snapshot of the database. */
  public static <D, T> Publisher<T> read(
      DatabaseReader<D> reader,
      DatabaseFunction<? super D, ? extends T> value,
      SchedulingContext context) {
    requireNonNull(reader);
    requireNonNull(value);
    return new FuturePublisher<T>(() -> reader.readAsync(value), context);
  }

  public static <D, T> Publisher<T> write(
      DatabaseWriter<D> writer, DatabaseFunction<? super D, ? extends T> updates) {
    return write(writer, updates, SchedulingContext.shared());
  }

  /**
   * Returns a publisher of the result of running {@code updates} in a write transaction, which is
   * rolled back if it fails.
   */
  public static <D, T> Publisher<T> write(
      DatabaseWriter<D> writer,
      DatabaseFunction<? super D, ? extends T> updates,
      SchedulingContext context) {
    requireNonNull(writer);
    requireNonNull(updates);
    return new FuturePublisher<T>(() -> writer.writeAsync(updates), context);
  }

  public static <D, T, R> Publisher<R> writeThenRead(
      DatabaseWriter<D> writer,
      DatabaseFunction<? super D, ? extends T> updates,
      DatabaseBiFunction<? super D, ? super T, ? extends R> thenRead) {
    return writeThenRead(writer, updates, thenRead, SchedulingContext.shared());
  }

  /**
   * Returns a publisher of the result of {@code thenRead}, which is evaluated against the state
   * committed by {@code updates} and is passed its result. The read runs concurrently with
   * subsequent writes. It doesn't run at all if the write fails, in which case the failure is
   * published.
   */
  public static <D, T, R> Publisher<R> writeThenRead(
      DatabaseWriter<D> writer,
      DatabaseFunction<? super D, ? extends T> updates,
      DatabaseBiFunction<? super D, ? super T, ? extends R> thenRead,
      SchedulingContext context) {
    requireNonNull(writer);
    requireNonNull(updates);
    requireNonNull(thenRead);
    return new FuturePublisher<R>(
        () -> writer.<T, R>writeThenReadAsync(updates, thenRead), context);
  }
}
