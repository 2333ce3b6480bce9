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

import static org.assertj.core.api.Assertions.assertThat;

import com.github.mizosoft.ripple.SchedulingContext;
import com.github.mizosoft.ripple.SchedulingPolicy;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SchedulingGateTest {
  @Test
  void asyncGateQueuesEverySignal() {
    var context = new QueueingContext();
    var gate = SchedulingGate.of(SchedulingPolicy.ASYNC, context);
    assertThat(gate.deliversSynchronously()).isFalse();
    assertThat(gate.observationPolicy(true)).isEqualTo(SchedulingPolicy.ASYNC);
    assertThat(gate.observationPolicy(false)).isEqualTo(SchedulingPolicy.ASYNC);

    var signals = new ArrayList<String>();
    gate.deliver(false, () -> signals.add("a"));
    assertThat(signals).isEmpty();
    assertThat(context.tasks).hasSize(1);
    context.runAll();
    assertThat(signals).containsExactly("a");
  }

  @Test
  void immediateGateStartsOnlyFirstObservationImmediately() {
    var gate = SchedulingGate.of(SchedulingPolicy.IMMEDIATE, new QueueingContext());
    assertThat(gate.deliversSynchronously()).isFalse();
    assertThat(gate.observationPolicy(true)).isEqualTo(SchedulingPolicy.IMMEDIATE);
    assertThat(gate.observationPolicy(false)).isEqualTo(SchedulingPolicy.ASYNC);
  }

  @Test
  void synchronousDeliveryRunsInline() {
    var context = new QueueingContext();
    var gate = SchedulingGate.of(SchedulingPolicy.IMMEDIATE, context);
    var signals = new ArrayList<String>();
    gate.deliver(true, () -> signals.add("first"));
    gate.deliver(false, () -> signals.add("second"));
    assertThat(signals).containsExactly("first");
    context.runAll();
    assertThat(signals).containsExactly("first", "second");
  }

  @Test
  void isOnContext() {
    var context = new QueueingContext();
    var gate = SchedulingGate.of(SchedulingPolicy.IMMEDIATE, context);
    assertThat(gate.isOnContext()).isFalse();

    var onContext = new ArrayList<Boolean>();
    context.execute(() -> onContext.add(gate.isOnContext()));
    context.runAll();
    assertThat(onContext).containsExactly(true);
  }

  @Test
  void synchronousGate() {
    var gate = SchedulingGate.synchronous();
    assertThat(gate.deliversSynchronously()).isTrue();
    assertThat(gate.observationPolicy(true)).isEqualTo(SchedulingPolicy.ASYNC);
    assertThat(gate.isOnContext()).isTrue();

    var signals = new ArrayList<String>();
    gate.deliver(false, () -> signals.add("a"));
    assertThat(signals).containsExactly("a");
  }

  private static final class QueueingContext implements SchedulingContext {
    final List<Runnable> tasks = new ArrayList<>();
    boolean running;

    @Override
    public boolean isCurrent() {
      return running;
    }

    @Override
    public void execute(Runnable command) {
      tasks.add(command);
    }

    void runAll() {
      running = true;
      try {
        while (!tasks.isEmpty()) {
          tasks.remove(0).run();
        }
      } finally {
        running = false;
      }
    }
  }
}
