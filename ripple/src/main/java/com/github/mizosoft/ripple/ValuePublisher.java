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

import com.github.mizosoft.ripple.internal.flow.ObservationStarter;
import com.github.mizosoft.ripple.internal.flow.ObservationSubscription;
import com.github.mizosoft.ripple.internal.flow.SchedulingGate;
import java.util.concurrent.Flow.Publisher;
import java.util.concurrent.Flow.Subscriber;

/**
 * A {@code Publisher} of the fresh values of a database observation. Each subscriber gets its own
 * observation, which is started when it first requests values. A publisher is immutable and can be
 * subscribed to any number of times.
 *
 * <p>By default, all signals are delivered asynchronously on the publisher's {@link
 * SchedulingContext}. Use {@link #fetchOnSubscription()} to get the initial value synchronously
 * within the first request.
 *
 * @param <T> the type of observed values
 */
public final class ValuePublisher<T> implements Publisher<T> {
  private final ObservationStarter<T> starter;
  private final SchedulingPolicy policy;
  private final SchedulingContext context;

  ValuePublisher(
      ObservationStarter<T> starter, SchedulingPolicy policy, SchedulingContext context) {
    this.starter = requireNonNull(starter);
    this.policy = requireNonNull(policy);
    this.context = requireNonNull(context);
  }

  public SchedulingPolicy policy() {
    return policy;
  }

  /** Returns the context on which this publisher's signals are delivered. */
  public SchedulingContext context() {
    return context;
  }

  /**
   * Returns a publisher that delivers the initial value of each subscription synchronously, within
   * the first {@code request(n)}. Subscribers of the returned publisher must request from this
   * publisher's context.
   */
  public ValuePublisher<T> fetchOnSubscription() {
    return withPolicy(SchedulingPolicy.IMMEDIATE);
  }

  public ValuePublisher<T> withPolicy(SchedulingPolicy policy) {
    return policy == this.policy ? this : new ValuePublisher<>(starter, policy, context);
  }

  /** Returns a publisher that delivers its signals on the given context. */
  public ValuePublisher<T> receiveOn(SchedulingContext context) {
    return context == this.context ? this : new ValuePublisher<>(starter, policy, context);
  }

  @Override
  public void subscribe(Subscriber<? super T> subscriber) {
    requireNonNull(subscriber);
    new ObservationSubscription<T>(subscriber, starter, SchedulingGate.of(policy, context))
        .subscribe();
  }

  @Override
  public String toString() {
    return "ValuePublisher[policy=" + policy + ", context=" + context + "]";
  }
}
