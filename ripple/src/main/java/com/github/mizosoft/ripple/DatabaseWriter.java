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
 * The write side of a database, as consumed by the publishers of this library.
 *
 * @param <D> the type of the connection passed to database functions
 */
public interface DatabaseWriter<D> extends DatabaseReader<D> {

  /**
   * Asynchronously runs {@code updates} in a transaction. The transaction is committed if the
   * function returns normally and rolled back if it throws. The returned future completes on the
   * writer's thread right after the transaction ends, before any other write begins.
   */
  <T> CompletableFuture<T> writeAsync(DatabaseFunction<? super D, ? extends T> updates);

  /**
   * Asynchronously evaluates {@code value} against the state committed by the latest write at the
   * time of the call. The read doesn't block writes, nor is it blocked by them.
   */
  <T> CompletableFuture<T> concurrentReadAsync(DatabaseFunction<? super D, ? extends T> value);

  /**
   * Asynchronously runs {@code updates} in a transaction, then evaluates {@code thenRead} against
   * exactly the state that transaction committed, passing it the result of {@code updates}. The
   * read's snapshot is taken on the writer's thread before any other write begins, and the read
   * itself runs concurrently with subsequent writes. If the transaction fails, it is rolled back
   * and {@code thenRead} is never invoked.
   */
  <T, R> CompletableFuture<R> writeThenReadAsync(
      DatabaseFunction<? super D, ? extends T> updates,
      DatabaseBiFunction<? super D, ? super T, ? extends R> thenRead);

  /**
   * Passes the writer's connection to {@code onChange} after each committed transaction that
   * modified {@code region}. {@code onChange} is called on the writer's thread, and the connection
   * is only valid for the duration of the call. A failure to start observing is passed to {@code
   * onError}, possibly synchronously.
   */
  Cancellable observeRegion(
      DatabaseRegion region, Consumer<? super Throwable> onError, Consumer<? super D> onChange);
}
