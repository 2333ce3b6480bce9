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

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * The read side of a database, as consumed by the publishers of this library. Implementations
 * adapt a concrete database engine; they are free to run database accesses and invoke callbacks on
 * their own worker threads.
 *
 * @param <D> the type of the connection passed to database functions
 */
public interface DatabaseReader<D> {

  /**
   * Asynchronously evaluates {@code value} against a consistent snapshot of the database. The
   * returned future completes on a database worker with the value, or exceptionally with what the
   * function threw.
   */
  <T> CompletableFuture<T> readAsync(DatabaseFunction<? super D, ? extends T> value);

  /**
   * Starts tracking {@code value}: it is evaluated once initially, then again after every
   * committed change that may affect it, each fresh result being passed to {@code onChange}. A
   * failed evaluation is passed to {@code onError}, after which no more callbacks are invoked.
   *
   * <p>With {@link SchedulingPolicy#IMMEDIATE}, the initial value (or error) must be passed to its
   * callback synchronously, before this method returns. With {@link SchedulingPolicy#ASYNC}, all
   * callbacks may be invoked from any thread, including synchronously.
   *
   * <p>The returned handle stops the observation. Callbacks that are already executing when it's
   * cancelled may still complete.
   */
  <T> Cancellable startObservation(
      DatabaseFunction<? super D, ? extends T> value,
      SchedulingPolicy policy,
      Consumer<? super Throwable> onError,
      Consumer<? super T> onChange);
}
