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

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;

import com.github.mizosoft.ripple.internal.flow.FlowSupport;
import com.github.mizosoft.ripple.testing.InMemoryDatabase;
import com.github.mizosoft.ripple.testing.InMemoryDatabase.Connection;
import com.github.mizosoft.ripple.testing.Logging;
import com.github.mizosoft.ripple.testing.MockContext;
import com.github.mizosoft.ripple.testing.TestSubscriber;
import com.github.mizosoft.ripple.testing.TestUtils;
import com.github.mizosoft.ripple.testing.junit.ExecutorExtension;
import com.github.mizosoft.ripple.testing.junit.ExecutorExtension.ExecutorParameterizedTest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;

@Timeout(20)
@ExtendWith(ExecutorExtension.class)
class ValueObservationTest {
  private static final ValueObservation<Connection, Integer> playerCount =
      ValueObservation.tracking(db -> db.count("player"));

  private InMemoryDatabase database;

  @BeforeAll
  static void disableLogging() {
    Logging.disable(FlowSupport.class);
  }

  @BeforeEach
  void setUp() throws Exception {
    database = new InMemoryDatabase();
    write(
        db -> {
          db.createTable("player");
          db.createTable("team");
          return null;
        });
  }

  @AfterEach
  void tearDown() {
    database.close();
  }

  private <T> T write(DatabaseFunction<Connection, T> updates) throws Exception {
    return database.writeAsync(updates).get(TestUtils.TIMEOUT_SECONDS, SECONDS);
  }

  @ExecutorParameterizedTest
  void countAfterEachWrite(SchedulingContext context) throws Exception {
    var onContext = new CopyOnWriteArrayList<Boolean>();
    var subscriber = new TestSubscriber<Integer>();
    subscriber.onNextAction(__ -> onContext.add(context.isCurrent()));
    playerCount.publisher(database, context).subscribe(subscriber);
    subscriber.requestItems(3);
    assertThat(subscriber.pollNext()).isZero();

    write(
        db -> {
          db.insert("player", "Arthur");
          return null;
        });
    write(
        db -> {
          db.insert("player", "Barbara", "Craig");
          return null;
        });
    assertThat(subscriber.pollNext(2)).containsExactly(1, 3);
    assertThat(onContext).containsExactly(true, true, true);
    assertThat(subscriber.protocolViolations()).isEmpty();
  }

  @ExecutorParameterizedTest
  void unrelatedWritesDontNotify(SchedulingContext context) throws Exception {
    var subscriber = new TestSubscriber<Integer>();
    playerCount.publisher(database, context).subscribe(subscriber);
    subscriber.requestItems(2);
    assertThat(subscriber.pollNext()).isZero();

    write(
        db -> {
          db.insert("team", "red");
          return null;
        });
    write(
        db -> {
          db.insert("player", "Arthur");
          return null;
        });
    assertThat(subscriber.pollNext()).isOne();
  }

  @ExecutorParameterizedTest
  void failedWriteDoesNotNotify(SchedulingContext context) throws Exception {
    var subscriber = new TestSubscriber<Integer>();
    playerCount.publisher(database, context).subscribe(subscriber);
    subscriber.requestItems(2);
    assertThat(subscriber.pollNext()).isZero();

    assertThat(
            database.writeAsync(
                db -> {
                  db.insert("player", "Arthur");
                  throw new DatabaseException("rolled back");
                }))
        .failsWithin(Duration.ofSeconds(TestUtils.TIMEOUT_SECONDS));
    write(
        db -> {
          db.insert("player", "Barbara");
          return null;
        });
    assertThat(subscriber.pollNext()).isOne();
  }

  @Test
  void initialValueWithinRequest() {
    var context = new MockContext();
    var subscriber = new TestSubscriber<Integer>();
    var receivedWithinRequest = new ArrayList<Integer>();
    context.enter(
        () -> {
          playerCount.publisher(database, context).fetchOnSubscription().subscribe(subscriber);
          subscriber.requestItems(1);
          receivedWithinRequest.addAll(subscriber.peekAvailable());
        });
    assertThat(receivedWithinRequest).containsExactly(0);
    assertThat(context.hasNext()).isFalse();
  }

  @Test
  void laterValuesAreAsyncWithImmediatePolicy() throws Exception {
    var context = new MockContext();
    var subscriber = new TestSubscriber<Integer>();
    context.enter(
        () -> {
          playerCount.publisher(database, context).fetchOnSubscription().subscribe(subscriber);
          subscriber.requestItems(2);
        });
    assertThat(subscriber.pollNext()).isZero();

    write(
        db -> {
          db.insert("player", "Arthur");
          return null;
        });
    assertThat(context.awaitNext(TestUtils.TIMEOUT_SECONDS, SECONDS)).isTrue();
    assertThat(subscriber.peekAvailable()).isEmpty();
    context.runAll();
    assertThat(subscriber.pollNext()).isOne();
  }

  @ExecutorParameterizedTest
  void valuesWithoutDemandAreDropped(SchedulingContext context) throws Exception {
    var subscriber = new TestSubscriber<Integer>();
    playerCount.publisher(database, context).subscribe(subscriber);
    subscriber.requestItems(1);
    assertThat(subscriber.pollNext()).isZero();

    write(
        db -> {
          db.insert("player", "Arthur");
          return null;
        });
    write(
        db -> {
          db.insert("player", "Barbara");
          return null;
        });
    assertThat(subscriber.peekAvailable()).isEmpty();

    // Renewed demand restarts observation, which fetches the current value.
    subscriber.requestItems(1);
    assertThat(subscriber.pollNext()).isEqualTo(2);
    assertThat(subscriber.protocolViolations()).isEmpty();
  }

  @ExecutorParameterizedTest
  void queryFailureAfterStartTerminatesSubscription(SchedulingContext context) throws Exception {
    var subscriber = new TestSubscriber<Integer>();
    playerCount.publisher(database, context).subscribe(subscriber);
    subscriber.requestItems(Long.MAX_VALUE);
    assertThat(subscriber.pollNext()).isZero();

    write(
        db -> {
          db.dropTable("player");
          return null;
        });
    assertThat(subscriber.awaitError())
        .isInstanceOf(QueryException.class)
        .hasMessageContaining("no such table");
    assertThat(database.activeObservationCount()).isZero();

    write(
        db -> {
          db.createTable("player");
          db.insert("player", "Arthur");
          return null;
        });
    assertThat(subscriber.nextCount()).isOne();
  }

  @ExecutorParameterizedTest
  void startFailureTerminatesSubscription(SchedulingContext context) {
    var subscriber = new TestSubscriber<Integer>();
    ValueObservation.<Connection, Integer>tracking(db -> db.count("coach"))
        .publisher(database, context)
        .subscribe(subscriber);
    subscriber.requestItems(1);
    assertThat(subscriber.awaitError())
        .isInstanceOf(ObservationStartException.class)
        .hasCauseInstanceOf(QueryException.class);
    assertThat(subscriber.nextCount()).isZero();
  }

  @ExecutorParameterizedTest
  void cancellationStopsObservation(SchedulingContext context) throws Exception {
    var subscriber = new TestSubscriber<Integer>();
    playerCount.publisher(database, context).subscribe(subscriber);
    subscriber.requestItems(Long.MAX_VALUE);
    assertThat(subscriber.pollNext()).isZero();
    assertThat(database.activeObservationCount()).isOne();

    subscriber.cancel();
    assertThat(database.activeObservationCount()).isZero();
    write(
        db -> {
          db.insert("player", "Arthur");
          return null;
        });
    assertThat(subscriber.nextCount()).isOne();
  }

  @Test
  void observationStartedWithoutPublisher() throws Exception {
    var values = new CopyOnWriteArrayList<Integer>();
    try (var cancellable =
        playerCount.start(database, SchedulingPolicy.ASYNC, e -> {}, values::add)) {
      write(
          db -> {
            db.insert("player", "Arthur");
            return null;
          });
      assertThat(values).containsExactly(0, 1);
    }
    write(
        db -> {
          db.insert("player", "Barbara");
          return null;
        });
    assertThat(values).containsExactly(0, 1);
  }

  @Test
  void sharedContextIsDefault() {
    var publisher = playerCount.publisher(database);
    assertThat(publisher.context()).isSameAs(SchedulingContext.shared());

    var subscriber = new TestSubscriber<Integer>();
    publisher.subscribe(subscriber);
    subscriber.requestItems(1);
    assertThat(subscriber.pollNext()).isZero();
    assertThat(subscriber.onNextThreads()).singleElement().matches(Thread::isDaemon);
  }
}
