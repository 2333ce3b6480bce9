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
import java.util.function.Consumer;

/**
 * Tracks the transactions that modify a database region. Unlike a {@link ValueObservation}, the
 * writer's connection itself is observed: it is passed to subscribers right after each such
 * transaction is committed, on the writer's thread and before any other write begins.
 */
public final class RegionObservation {
  private final DatabaseRegion region;

  private RegionObservation(DatabaseRegion region) {
    this.region = requireNonNull(region);
  }

  public DatabaseRegion region() {
    return region;
  }

  /** Starts this observation on the given writer without a publisher. */
  public <D> Cancellable start(
      DatabaseWriter<D> writer, Consumer<? super Throwable> onError, Consumer<? super D> onChange) {
    return writer.observeRegion(region, onError, onChange);
  }

  /**
   * Returns a publisher of the writer's connection after each transaction that modifies this
   * observation's region. Connections are delivered synchronously on the writer's thread and must
   * not be used after {@code onNext} returns.
   */
  public <D> Publisher<D> publisher(DatabaseWriter<D> writer) {
    return new RegionPublisher<>(writer, region);
  }

  public static RegionObservation tracking(DatabaseRegion region) {
    return new RegionObservation(region);
  }

  public static RegionObservation tracking(String... tables) {
    return new RegionObservation(DatabaseRegion.of(tables));
  }

  @Override
  public String toString() {
    return "RegionObservation[" + region + "]";
  }
}
