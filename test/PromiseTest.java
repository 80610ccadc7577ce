/*
 * Copyright (c) 2010-2012  The SUAsync Authors.  All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *   - Redistributions of source code must retain the above copyright notice,
 *     this list of conditions and the following disclaimer.
 *   - Redistributions in binary form must reproduce the above copyright notice,
 *     this list of conditions and the following disclaimer in the documentation
 *     and/or other materials provided with the distribution.
 *   - Neither the name of the StumbleUpon nor the names of its contributors
 *     may be used to endorse or promote products derived from this software
 *     without specific prior written permission.
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE
 * ARE DISCLAIMED.  IN NO EVENT SHALL THE COPYRIGHT HOLDER OR CONTRIBUTORS BE
 * LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR
 * CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF
 * SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS
 * INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN
 * CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE)
 * ARISING IN ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF THE
 * POSSIBILITY OF SUCH DAMAGE.
 */
package com.stumbleupon.promise;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.After;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PromiseTest {

  private final Scheduler saved = Promise.getScheduler();

  @After
  public void restoreScheduler() {
    Promise.setScheduler(saved);
  }

  @Test
  public void testResolvePlainValue() throws Exception {
    final Promise<Integer> promise = Promise.resolve(42);
    assertThat(promise.isFulfilled()).isTrue();
    assertThat(promise.get(false)).isEqualTo(42);
  }

  @Test
  public void testResolveNull() throws Exception {
    final Promise<Object> promise = Promise.resolve(null);
    assertThat(promise.isFulfilled()).isTrue();
    assertThat(promise.get(false)).isNull();
  }

  @Test
  public void testResolvePromiseReturnsIt() {
    final Completer<String> c = new Completer<String>();
    final Promise<String> promise = Promise.resolve(c.promise);
    assertThat(promise).isSameAs(c.promise);
  }

  @Test
  public void testResolveWithPendingPromiseWaitsForIt() throws Exception {
    final Completer<Integer> c = new Completer<Integer>();
    final Promise<Integer> promise =
      new Promise<Integer>((resolve, reject) -> resolve.call(c.promise));
    assertThat(promise.isPending()).isTrue();
    assertThat(promise.isFollowing()).isTrue();

    c.resolve(7);
    assertThat(promise.isFulfilled()).isTrue();
    assertThat(promise.get(false)).isEqualTo(7);
  }

  @Test
  public void testResolveWithSettledPromiseCopiesOutcome() throws Exception {
    final Exception reason = new Exception("no");
    final Completer<Object> c = new Completer<Object>();
    c.resolve(Promise.reject(reason));
    assertThat(c.promise.isRejected()).isTrue();
    assertThat(c.promise.isFollowing()).isFalse();
    assertThatThrownBy(() -> c.promise.get(false)).isSameAs(reason);
  }

  @Test
  public void testSelfResolution() {
    final Completer<Object> c = new Completer<Object>();
    c.resolve(c.promise);
    assertThat(c.promise.isRejected()).isTrue();
    assertThatThrownBy(() -> c.promise.get(false))
      .isInstanceOf(SelfResolutionException.class);
  }

  @Test
  public void testSelfResolutionThroughCycle() {
    final Completer<Object> a = new Completer<Object>();
    final Completer<Object> b = new Completer<Object>();
    a.resolve(b.promise);
    b.resolve(a.promise);
    assertThat(b.promise.isRejected()).isTrue();
    assertThat(a.promise.isRejected()).isTrue();
    assertThatThrownBy(() -> a.promise.get(false))
      .isInstanceOf(SelfResolutionException.class);
  }

  @Test
  public void testHandlerReturningItsOwnPromise() {
    final Completer<Integer> c = new Completer<Integer>();
    final Promise<?>[] holder = new Promise<?>[1];
    holder[0] = c.promise.then(x -> holder[0]);
    c.resolve(1);
    assertThat(holder[0].isRejected()).isTrue();
    assertThatThrownBy(() -> holder[0].get(false))
      .isInstanceOf(SelfResolutionException.class);
  }

  @Test
  public void testThenTwiceOnSettledPromise() throws Exception {
    final Promise<String> promise = Promise.resolve("v");
    final List<String> order = Collections.synchronizedList(new ArrayList<String>());
    final Promise<Object> first = promise.then(v -> order.add("first:" + v));
    final Promise<Object> second = promise.then(v -> order.add("second:" + v));
    first.get();
    second.get();
    assertThat(order).containsExactly("first:v", "second:v");
  }

  @Test
  public void testSubscribersNotifiedInRegistrationOrder() throws Exception {
    final Completer<Integer> c = new Completer<Integer>();
    final List<Integer> order = Collections.synchronizedList(new ArrayList<Integer>());
    for (int i = 0; i < 10; i++) {
      final int n = i;
      c.promise.then(v -> order.add(n));
    }
    assertThat(order).isEmpty();
    c.resolve(0);
    assertThat(order).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
  }

  @Test
  public void testHandlerExceptionRejectsDependent() {
    final IllegalStateException boom = new IllegalStateException("boom");
    final Promise<Object> promise = Promise.resolve(1).then(v -> {
      throw boom;
    });
    assertThat(promise.isRejected()).isTrue();
    assertThatThrownBy(() -> promise.get()).isSameAs(boom);
  }

  @Test
  public void testRejectionSkipsFulfillmentHandlers() throws Exception {
    final List<String> calls = new ArrayList<String>();
    final Promise<String> promise = Promise.<String>reject(new Exception("x"))
      .then(v -> {
        calls.add("then");
        return v + "!";
      })
      .catchError(e -> "recovered from " + e.getMessage());
    assertThat(promise.get()).isEqualTo("recovered from x");
    assertThat(calls).isEmpty();
  }

  @Test
  public void testCatchErrorLetsValueThrough() throws Exception {
    final Promise<String> promise =
      Promise.<String>resolve("fine").catchError(e -> "recovered");
    assertThat(promise.get()).isEqualTo("fine");
  }

  @Test
  public void testRejectionHandlerCanRethrow() {
    final Exception other = new Exception("other");
    final Promise<Object> promise = Promise.reject(new Exception("first"))
      .then(null, e -> {
        throw other;
      });
    assertThatThrownBy(() -> promise.get()).isSameAs(other);
  }

  @Test
  public void testHandlerReturningPromiseIsAdopted() throws Exception {
    final Completer<String> inner = new Completer<String>();
    final Promise<String> promise =
      Promise.resolve(1).thenPromise(v -> inner.promise);
    assertThat(promise.isPending()).isTrue();
    inner.resolve("inner");
    assertThat(promise.get(false)).isEqualTo("inner");
  }

  @Test
  public void testHandlerReturningCompletableFutureIsAdopted() throws Exception {
    final CompletableFuture<String> future = new CompletableFuture<String>();
    final Promise<Object> promise = Promise.resolve(1).then(v -> future);
    assertThat(promise.isPending()).isTrue();
    future.complete("done");
    assertThat(promise.get(false)).isEqualTo("done");
  }

  @Test
  public void testExecutorExceptionRejects() {
    final Exception boom = new Exception("boom");
    final Promise<Object> promise = new Promise<Object>((resolve, reject) -> {
      throw boom;
    });
    assertThat(promise.isRejected()).isTrue();
    assertThatThrownBy(() -> promise.get(false)).isSameAs(boom);
  }

  @Test
  public void testExecutorExceptionAfterResolveIsIgnored() throws Exception {
    final Promise<Object> promise = new Promise<Object>((resolve, reject) -> {
      resolve.call("ok");
      throw new Exception("too late");
    });
    assertThat(promise.get(false)).isEqualTo("ok");
  }

  @Test
  public void testOnlyFirstResolutionCounts() throws Exception {
    final Completer<Integer> c = new Completer<Integer>();
    c.resolve(1);
    c.resolve(2);
    c.reject(new Exception("ignored"));
    assertThat(c.promise.get(false)).isEqualTo(1);
  }

  @Test
  public void testResolveAfterFollowingIsIgnored() throws Exception {
    final Completer<Integer> c = new Completer<Integer>();
    final Completer<Integer> other = new Completer<Integer>();
    c.resolve(other.promise);
    c.resolve(5);
    other.resolve(6);
    assertThat(c.promise.get(false)).isEqualTo(6);
  }

  @Test(expected = NullPointerException.class)
  public void testRejectWithNull() {
    Promise.reject(null);
  }

  @Test(expected = NullPointerException.class)
  public void testNullExecutor() {
    new Promise<Object>(null);
  }

  @Test
  public void testNullHandlersPassThrough() throws Exception {
    assertThat(Promise.resolve("x").then(null, null).get()).isEqualTo("x");
    final Exception reason = new Exception("r");
    final Promise<Object> rejected = Promise.reject(reason).then(null, null);
    assertThatThrownBy(() -> rejected.get()).isSameAs(reason);
  }

  @Test
  public void testDoneReportsUnhandledRejection() {
    final AtomicReference<Throwable> fatal = new AtomicReference<Throwable>();
    Promise.setScheduler(new Async(Runnable::run, true,
                                   (thread, e) -> fatal.set(e)));
    final Exception reason = new Exception("unhandled");
    Promise.reject(reason).done();
    assertThat(fatal.get()).isSameAs(reason);
  }

  @Test
  public void testDoneWithRejectionHandlerIsNotFatal() {
    final AtomicReference<Throwable> fatal = new AtomicReference<Throwable>();
    Promise.setScheduler(new Async(Runnable::run, true,
                                   (thread, e) -> fatal.set(e)));
    final List<Exception> handled = new ArrayList<Exception>();
    Promise.reject(new Exception("handled")).done(null, handled::add);
    assertThat(handled).hasSize(1);
    assertThat(fatal.get()).isNull();
  }

  @Test
  public void testDoneHandlerThrowingIsFatal() {
    final AtomicReference<Throwable> fatal = new AtomicReference<Throwable>();
    Promise.setScheduler(new Async(Runnable::run, true,
                                   (thread, e) -> fatal.set(e)));
    final IllegalStateException boom = new IllegalStateException("boom");
    Promise.resolve(1).done(v -> {
      throw boom;
    });
    assertThat(fatal.get()).isSameAs(boom);
  }

  @Test
  public void testRejectionWithoutSubscribersIsNotFatal() {
    final AtomicReference<Throwable> fatal = new AtomicReference<Throwable>();
    Promise.setScheduler(new Async(Runnable::run, true,
                                   (thread, e) -> fatal.set(e)));
    Promise.reject(new Exception("nobody cares"));
    assertThat(fatal.get()).isNull();
  }

  @Test
  public void testThenAll() throws Exception {
    final Promise<Integer> promise = Promise.resolve(10);
    final List<HandlerPair<Object, Integer>> handlers = Arrays.asList(
      HandlerPair.<Object, Integer>onFulfilled(v -> v + 1),
      HandlerPair.<Object, Integer>of(v -> v * 2, e -> -1),
      HandlerPair.<Object, Integer>onRejected(e -> -1));
    final List<Promise<Object>> promises = promise.thenAll(handlers);
    assertThat(promises).hasSize(3);
    assertThat(promises.get(0).get()).isEqualTo(11);
    assertThat(promises.get(1).get()).isEqualTo(20);
    assertThat(promises.get(2).get()).isEqualTo(10);
    assertThat(promise.thenAll(null)).isEmpty();
  }

  @Test
  public void testDoneAll() {
    final List<String> calls = new ArrayList<String>();
    final Promise<String> promise = Promise.reject(new Exception("e"));
    promise.doneAll(Arrays.asList(
      HandlerPair.<Object, String>of(v -> calls.add("ok 1"),
                                     e -> calls.add("failed 1")),
      HandlerPair.<Object, String>onRejected(e -> calls.add("failed 2"))));
    assertThat(calls).containsExactly("failed 1", "failed 2");
  }

  @Test
  public void testFutureIsCachedAndCompleted() throws Exception {
    final Completer<String> c = new Completer<String>();
    final CompletableFuture<String> future = c.promise.future();
    assertThat(c.promise.future()).isSameAs(future);
    assertThat(future.isDone()).isFalse();
    c.resolve("value");
    assertThat(future.get()).isEqualTo("value");
  }

  @Test
  public void testFutureOfRejectedPromise() {
    final Exception reason = new Exception("failed");
    final CompletableFuture<Object> future = Promise.reject(reason).future();
    assertThat(future.isCompletedExceptionally()).isTrue();
  }

  @Test
  public void testLongChainDoesNotGrowTheStack() throws Exception {
    final Completer<Integer> c = new Completer<Integer>();
    Promise<Integer> promise = c.promise;
    for (int i = 0; i < 100000; i++) {
      promise = promise.then(x -> x + 1);
    }
    c.resolve(0);
    assertThat(promise.get()).isEqualTo(100000);
  }

  @Test
  public void testLongChainPassesRejectionThrough() throws Exception {
    final Completer<Integer> c = new Completer<Integer>();
    Promise<Integer> promise = c.promise;
    for (int i = 0; i < 100000; i++) {
      promise = promise.then(x -> x + 1);
    }
    promise = promise.catchError(e -> -1);
    c.reject(new Exception("early"));
    assertThat(promise.get()).isEqualTo(-1);
  }

  @Test
  public void testStatePredicates() {
    final Completer<Object> c = new Completer<Object>();
    assertThat(c.promise.state()).isEqualTo(Promise.State.PENDING);
    assertThat(c.promise.isPending()).isTrue();
    c.reject(new Exception("x"));
    assertThat(c.promise.state()).isEqualTo(Promise.State.REJECTED);
    assertThat(c.promise.isPending()).isFalse();
    assertThat(c.promise.isFulfilled()).isFalse();
    assertThat(c.promise.isRejected()).isTrue();
  }

  @Test
  public void testToString() {
    assertThat(Promise.resolve("abc").toString())
      .contains("state=FULFILLED").contains("value=abc");
    final Completer<Object> c = new Completer<Object>();
    c.promise.then(v -> v);
    assertThat(c.promise.toString())
      .contains("state=PENDING").contains("subscribers=1");
  }

  /** Counts the promises handed over for settlement.  */
  private static final class CountingScheduler implements Scheduler {
    final Async async = new Async();
    int settled;

    public void invoke(final Runnable task) {
      async.invoke(task);
    }

    public void settlePromises(final Promise<?> promise) {
      settled++;
      async.settlePromises(promise);
    }

    public void fatalError(final Exception reason) {
      async.fatalError(reason);
    }

    public void drainQueueUntilSettled(final Promise<?> promise) {
      async.drainQueueUntilSettled(promise);
    }
  }

  @Test
  public void testHandlerResultsSettledInTheSamePass() throws Exception {
    final CountingScheduler counting = new CountingScheduler();
    Promise.setScheduler(counting);
    final Completer<Integer> c = new Completer<Integer>();
    final Promise<Integer> plus1 = c.promise.then(v -> v + 1);
    final Promise<Integer> plus2 = plus1.then(v -> v + 1);
    final Promise<Integer> plus3 = plus2.then(v -> v + 1);

    c.resolve(0);
    assertThat(plus3.get(false)).isEqualTo(3);
    assertThat(plus1.isAsyncGuaranteed()).isTrue();
    assertThat(plus2.isAsyncGuaranteed()).isTrue();
    // Only `c' went through the scheduler.
    assertThat(counting.settled).isEqualTo(1);
  }

}
