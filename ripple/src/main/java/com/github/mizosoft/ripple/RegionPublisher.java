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

import com.github.mizosoft.ripple.internal.flow.ObservationSubscription;
import com.github.mizosoft.ripple.internal.flow.SchedulingGate;
import java.util.concurrent.Flow.Publisher;
import java.util.concurrent.Flow.Subscriber;

final class RegionPublisher<D> implements Publisher<D> {
  private final DatabaseWriter<D> writer;
  private final DatabaseRegion region;

  RegionPublisher(DatabaseWriter<D> writer, DatabaseRegion region) {
    this.writer = requireNonNull(writer);
    this.region = requireNonNull(region);
  }

  @Override
  public void subscribe(Subscriber<? super D> subscriber) {
    requireNonNull(subscriber);
    new ObservationSubscription<D>(
            subscriber,
            (policy, onError, onChange) -> writer.observeRegion(region, onError, onChange),
            SchedulingGate.synchronous())
        .subscribe();
  }
}
