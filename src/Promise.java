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
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thread-safe promise, following the resolution and chaining rules of
 * <a href="https://promisesaplus.com/">Promises/A+</a>.
 * <p>
 * A {@code Promise} starts pending and is eventually settled exactly once,
 * either fulfilled with a value or rejected with an {@link Exception}.
 * Any number of handlers can be subscribed with {@link #then}, before or
 * after settlement; they're notified in the order in which they subscribed.
 * Each call to {@code then} returns a new dependent promise, resolved with
 * whatever the handler returns, or rejected with whatever it throws.
 *
 * <h1>Resolution</h1>
 *
 * Resolving a promise with a value isn't the same as fulfilling it.  If the
 * value is a thenable (another {@code Promise}, a {@link
 * java.util.concurrent.CompletionStage CompletionStage}, a {@link Thenable},
 * ... see {@link ThenableShape}), the promise adopts the thenable's eventual
 * outcome instead.  When the thenable is itself a pending promise, ours
 * starts <em>following</em> it: the subscribers we had so far are moved over
 * to it and everything we're asked from now on is answered by it.
 * <p>
 * A promise resolved with a follower starts following the promise at the
 * end of that follower's chain, not the follower itself.  A promise resolved
 * with itself, directly or through a chain of followers leading back to it,
 * is rejected with a {@link SelfResolutionException}.
 *
 * <h1>Notification</h1>
 *
 * Handlers are handed to the process-wide {@link Scheduler} (an {@link
 * Async} trampoline by default) rather than called directly, so that a long
 * chain of promises is processed iteratively and not recursively.  With the
 * default scheduler they still run on the thread that subscribed them or
 * settled the promise, but never nested inside another handler.
 *
 * <h1>Blocking</h1>
 *
 * {@link #get} lets a thread block until the promise settles.  This is
 * mostly useful in tests and at the boundary with synchronous code.  Never
 * call it from a handler of a promise whose settlement depends on the
 * promise you're waiting on.
 *
 * <h1>Invariants</h1>
 * <ul>
 * <li>A promise leaves the pending state at most once.  Later attempts to
 * resolve or reject it are ignored.</li>
 * <li>A rejection reason is never {@code null}.</li>
 * <li>A rejection that reaches a terminal promise (created by {@link #done})
 * is reported to {@link Scheduler#fatalError}.  Rejections of other promises
 * nobody subscribed to are not reported.</li>
 * </ul>
 * @param <T> The type of the value the promise is fulfilled with.
 */
public final class Promise<T> {

  // The type parameter is mostly a convenience for callers.  Handler
  // results get adopted whatever their type, so there are a few
  // unchecked casts in here where the type of a dependent promise is
  // "adjusted".

  private static final Logger LOG = LoggerFactory.getLogger(Promise.class);

  /**
   * Maximum number of subscribers a pending promise can hold.  Subscribing
   * one more discards the ones already there.
   */
  static final int MAX_CALLBACKS = 0xFFFF;

  private static final byte INIT_OVERFLOW_SIZE = 4;

  /**
   * How many promises an async-guaranteed settlement may settle inline,
   * one inside the other, before falling back to the scheduler.
   */
  private static final int MAX_INLINE_DEPTH = 32;

  private static final ThreadLocal<int[]> INLINE_DEPTH =
    new ThreadLocal<int[]>() {
      protected int[] initialValue() {
        return new int[1];
      }
    };

  /** Where a promise is in its lifecycle.  */
  public enum State {
    /** Not settled yet.  */
    PENDING,
    /** Not settled yet, will take the outcome of another promise.  */
    FOLLOWING,
    /** Settled with a value.  */
    FULFILLED,
    /** Settled with an exception.  */
    REJECTED,
  }

  private static volatile Scheduler scheduler = new Async();

  /**
   * Serializes the transitions to {@link State#FOLLOWING}, so that two
   * promises resolved with one another at the same time can't end up
   * following each other.
   */
  private static final Object FOLLOW_LOCK = new Object();

  private volatile State state;

  /**
   * The value when fulfilled, the reason when rejected, the followee when
   * following, {@code null} when pending.  Always written before `state',
   * so reading `state' first makes it safe to read.
   */
  private Object value;

  /** Whether this promise was created by {@link #done}.  */
  private final boolean is_final;

  /**
   * Whether this promise gets settled from a task already run by the
   * scheduler, in which case its own subscribers can be notified without
   * scheduling yet another task.
   */
  private volatile boolean async_guaranteed;

  /** Whether a thread is blocked in {@link #get} on this promise.  */
  private volatile boolean waiting;

  // The subscribers.  The first one is held in the 3 fields below, the
  // others in `overflow' where subscriber #i is at index i - 1.
  // Need to acquire this' monitor before changing any of these.

  private Callback fulfillment_handler0;

  private Callback rejection_handler0;

  private Promise promise0;

  private ArrayList<Subscriber> overflow;

  /** How many subscribers are stored.  */
  private int length;

  /**
   * Lazily created by {@link #future}, or the future this promise was made
   * from.  Need to acquire this' monitor before changing.
   */
  private CompletableFuture<T> future;

  /** The context current on the thread that created this promise.  */
  private final Context trace;

  /**
   * Wakes up the threads blocked in {@link #get}.  Subscribed once, the
   * first time somebody waits, and shared by all the waits that follow.
   * Need to acquire this' monitor before changing.
   */
  private Signal signal;

  /** Creates a pending promise.  */
  public Promise() {
    this(false);
  }

  /**
   * Creates a promise and runs the given executor, which will settle it.
   * @param executor The executor to run right away on this thread.
   * If it throws before settling the promise, the promise is rejected with
   * the exception thrown.
   * @throws NullPointerException if {@code executor} is {@code null}.
   */
  public Promise(final PromiseExecutor executor) {
    this(false);
    if (executor == null) {
      throw new NullPointerException("null executor");
    }
    resolveFromExecutor(executor);
  }

  private Promise(final boolean is_final) {
    this.is_final = is_final;
    this.trace = Context.current();
    state = State.PENDING;
  }

  /**
   * Returns a promise for the given value.
   * <p>
   * If the value is a thenable, the promise returned adopts its outcome (a
   * {@code Promise} is returned as-is).  Otherwise the promise returned is
   * already fulfilled with the value.
   * @param value The value, may be {@code null}.
   */
  @SuppressWarnings("unchecked")
  public static <T> Promise<T> resolve(final Object value) {
    final Promise<Object> promise = tryConvert(value);
    if (promise != null) {
      return (Promise<T>) ((Object) promise);
    }
    return fulfilled(value);
  }

  /**
   * Returns a promise already rejected with the given reason.
   * @param reason The reason.
   * @throws NullPointerException if {@code reason} is {@code null}.
   */
  public static <T> Promise<T> reject(final Exception reason) {
    final Promise<T> promise = new Promise<T>();
    promise.rejectWith(reason);
    return promise;
  }

  private static <T> Promise<T> fulfilled(final Object value) {
    final Promise<T> promise = new Promise<T>();
    promise.value = value;
    promise.state = State.FULFILLED;
    return promise;
  }

  /**
   * Absorbs a thenable into a promise.
   * @param obj The object to convert, may be {@code null}.
   * @return A promise adopting the object's outcome, the object itself if
   * it's already a promise, or {@code null} if it isn't a thenable.
   * @see ThenableShape
   */
  public static Promise<Object> tryConvert(final Object obj) {
    final ThenableShape shape = ThenableShape.of(obj);
    return shape == null ? null : shape.convert(obj);
  }

  /** Returns whether the given object would be absorbed as a thenable.  */
  public static boolean isThenable(final Object obj) {
    return ThenableShape.of(obj) != null;
  }

  /** Returns the scheduler used by all promises.  */
  public static Scheduler getScheduler() {
    return scheduler;
  }

  /**
   * Replaces the scheduler used by all promises.
   * @param s The new scheduler.
   * @return The previous scheduler.
   * @throws NullPointerException if {@code s} is {@code null}.
   */
  public static Scheduler setScheduler(final Scheduler s) {
    if (s == null) {
      throw new NullPointerException("null scheduler");
    }
    final Scheduler previous = scheduler;
    scheduler = s;
    return previous;
  }

  // ------------------------------------- //
  // Subscribing handlers to this promise. //
  // ------------------------------------- //

  /**
   * Subscribes a fulfillment handler.
   * <p>
   * If this promise is rejected, the promise returned is rejected with the
   * same reason.
   * @param onFulfilled The handler, may be {@code null}.
   * @return A new promise resolved with what the handler returns.
   */
  public <R> Promise<R> then(final Callback<R, ? super T> onFulfilled) {
    return subscribe(onFulfilled, null, false);
  }

  /**
   * Subscribes a fulfillment handler and a rejection handler.
   * <p>
   * Only one of the two will ever be called, with the value or the reason
   * this promise is settled with.  Whatever the handler returns resolves the
   * promise returned (so returning a thenable makes it adopt the thenable's
   * outcome), whatever it throws rejects it.  A {@code null} handler lets
   * the value or reason through unchanged.
   * @param onFulfilled The fulfillment handler, may be {@code null}.
   * @param onRejected The rejection handler, may be {@code null}.
   * @return A new dependent promise.
   */
  public <R> Promise<R> then(final Callback<R, ? super T> onFulfilled,
                             final Callback<R, Exception> onRejected) {
    return subscribe(onFulfilled, onRejected, false);
  }

  /**
   * Subscribes a fulfillment handler that returns another promise.
   * <p>
   * Same as {@link #then(Callback)}, with the type of the promise returned
   * matching the type of the promise the handler returns.
   * @param onFulfilled The handler.
   * @return A new promise that adopts the outcome of the handler's promise.
   */
  public <R, P extends Promise<R>>
    Promise<R> thenPromise(final Callback<P, ? super T> onFulfilled) {
    return subscribe(onFulfilled, null, false);
  }

  /**
   * Subscribes a rejection handler.
   * <p>
   * Same as {@code then(null, onRejected)}.  If this promise is fulfilled,
   * the promise returned is fulfilled with the same value.
   * @param onRejected The handler, typically a recovery returning a value of
   * the same type as this promise.
   * @return A new dependent promise.
   */
  public <R> Promise<T> catchError(final Callback<R, Exception> onRejected) {
    return subscribe(null, onRejected, false);
  }

  /**
   * Subscribes handlers at the end of a chain.
   * <p>
   * Nothing can be chained after this, so if this promise is rejected and
   * {@code onRejected} is {@code null}, or if the handler called throws,
   * the exception is reported to {@link Scheduler#fatalError}.
   * @param onFulfilled The fulfillment handler, may be {@code null}.
   * @param onRejected The rejection handler, may be {@code null}.
   */
  public void done(final Callback<?, ? super T> onFulfilled,
                   final Callback<?, Exception> onRejected) {
    subscribe(onFulfilled, onRejected, true);
  }

  /** Same as {@code done(onFulfilled, null)}.  */
  public void done(final Callback<?, ? super T> onFulfilled) {
    subscribe(onFulfilled, null, true);
  }

  /** Same as {@code done(null, null)}: ends the chain, reporting failures.  */
  public void done() {
    subscribe(null, null, true);
  }

  /**
   * Subscribes several pairs of handlers, in order.
   * @param handlers The pairs, may be {@code null} or empty.
   * @return One dependent promise per pair, in the same order.
   */
  public List<Promise<Object>>
    thenAll(final List<? extends HandlerPair<?, ? super T>> handlers) {
    if (handlers == null || handlers.isEmpty()) {
      return new ArrayList<Promise<Object>>(0);
    }
    final ArrayList<Promise<Object>> promises =
      new ArrayList<Promise<Object>>(handlers.size());
    for (final HandlerPair<?, ? super T> pair : handlers) {
      promises.add(this.<Object>subscribe(pair.fulfillmentHandler(),
                                          pair.rejectionHandler(), false));
    }
    return promises;
  }

  /**
   * Subscribes several pairs of handlers at the end of a chain, in order.
   * @param handlers The pairs, may be {@code null} or empty.
   * @see #done(Callback, Callback)
   */
  public void doneAll(final List<? extends HandlerPair<?, ? super T>> handlers) {
    if (handlers == null) {
      return;
    }
    for (final HandlerPair<?, ? super T> pair : handlers) {
      subscribe(pair.fulfillmentHandler(), pair.rejectionHandler(), true);
    }
  }

  @SuppressWarnings("unchecked")
  private <R> Promise<R> subscribe(final Callback onFulfilled,
                                   final Callback onRejected,
                                   final boolean terminal) {
    final Promise<R> promise = new Promise<R>(terminal);
    target().addCallbacks(onFulfilled, onRejected, promise);
    return promise;
  }

  // ---------------------------- //
  // Querying the current state.  //
  // ---------------------------- //

  /**
   * Returns the state of this promise, as far as its outcome is concerned.
   * A promise following a settled promise is reported as settled the same
   * way.  Could be wrong the moment this method returns.
   * @return The state, never {@link State#FOLLOWING}.
   */
  public State state() {
    return target().state;
  }

  /** Returns whether this promise is still pending.  See {@link #state}.  */
  public boolean isPending() {
    return state() == State.PENDING;
  }

  /** Returns whether this promise is fulfilled.  See {@link #state}.  */
  public boolean isFulfilled() {
    return state() == State.FULFILLED;
  }

  /** Returns whether this promise is rejected.  See {@link #state}.  */
  public boolean isRejected() {
    return state() == State.REJECTED;
  }

  /** Returns whether this promise delegates its outcome to another one.  */
  public boolean isFollowing() {
    return state == State.FOLLOWING;
  }

  /** Returns whether a thread is currently blocked on this promise.  */
  public boolean isWaiting() {
    return waiting;
  }

  /**
   * Returns the promise at the end of the chain of followees, which is
   * {@code this} if this promise isn't following any.
   */
  Promise<?> target() {
    Promise<?> ret = this;
    while (ret.state == State.FOLLOWING) {
      ret = (Promise<?>) ret.value;
    }
    return ret;
  }

  boolean isFinal() {
    return is_final;
  }

  boolean isAsyncGuaranteed() {
    return async_guaranteed;
  }

  /** Called by the scheduler right before it settles this promise.  */
  void setAsyncGuaranteed() {
    async_guaranteed = true;
  }

  synchronized int subscriberCount() {
    return length;
  }

  // ----------------------------------- //
  // Resolving and settling the promise. //
  // ----------------------------------- //

  private void resolveFromExecutor(final PromiseExecutor executor) {
    Exception error = null;
    try (Context ignored = Context.enter()) {
      executor.execute(resolver(), rejecter());
    } catch (Exception e) {
      error = e;
    }
    if (error != null) {
      rejectWith(error);
    }
  }

  private Callback<Void, Object> resolver() {
    return new Callback<Void, Object>() {
      public Void call(final Object arg) {
        resolveWith(arg);
        return null;
      }
      public String toString() {
        return "resolve Promise@" + Promise.this.hashCode();
      }
    };
  }

  private Callback<Void, Exception> rejecter() {
    return new Callback<Void, Exception>() {
      public Void call(final Exception arg) {
        rejectWith(arg);
        return null;
      }
      public String toString() {
        return "reject Promise@" + Promise.this.hashCode();
      }
    };
  }

  /**
   * Resolves this promise: adopts the outcome of the value if it's a
   * thenable, fulfills it with the value otherwise.
   * @param x The value.
   */
  void resolveWith(final Object x) {
    if (x == this) {
      rejectWith(new SelfResolutionException(this));
      return;
    }
    if (state != State.PENDING) {
      LOG.debug("Ignoring resolution of already resolved {} with {}", this, x);
      return;
    }
    final Promise<Object> promise = tryConvert(x);
    if (promise == null) {
      fulfill(x);
      return;
    }

    final Promise<?> target;
    synchronized (FOLLOW_LOCK) {
      target = promise.target();
      if (target != this && target.state == State.PENDING
          && follow(target)) {
        return;
      }
    }
    if (target == this) {
      rejectWith(new SelfResolutionException(this));
    } else if (target.state == State.FULFILLED) {
      fulfill(target.value);
    } else {
      doReject((Exception) target.value);
    }
  }

  /**
   * Makes this promise follow another one, moving our subscribers over to
   * it in the order in which they subscribed.  Need to hold FOLLOW_LOCK.
   * @param target A promise that isn't following anyone.
   * @return false if {@code target} got settled in the mean time, in which
   * case nothing was done.
   */
  private boolean follow(final Promise<?> target) {
    synchronized (this) {
      if (state != State.PENDING) {
        LOG.debug("Not following {}, already resolved: {}", target, this);
        return true;
      }
      // We lock `target' while holding our monitor, but the reverse never
      // happens since `target' doesn't follow us.  Nobody can subscribe to
      // us until we're done, and anyone who tries afterwards will be sent
      // to `target'.
      synchronized (target) {
        if (target.state != State.PENDING) {
          return false;
        }
        if (length > 0) {
          target.store(fulfillment_handler0, rejection_handler0, promise0);
        }
        for (int i = 1; i < length; i++) {
          final Subscriber s = overflow.get(i - 1);
          target.store(s.onFulfilled, s.onRejected, s.promise);
        }
      }
      clearSubscribers();
      value = target;
      state = State.FOLLOWING;
    }
    LOG.debug("{} is now following {}", this, target);
    return true;
  }

  /**
   * Rejects this promise.
   * @param reason The reason.
   * @throws NullPointerException if {@code reason} is {@code null}.
   */
  void rejectWith(final Exception reason) {
    if (reason == null) {
      throw new NullPointerException("A promise was rejected with null: "
                                     + this);
    }
    doReject(reason);
  }

  private void fulfill(final Object x) {
    if (x == this) {
      doReject(new SelfResolutionException(this));
      return;
    }
    final int len;
    synchronized (this) {
      if (state != State.PENDING) {
        LOG.debug("Ignoring fulfillment of already resolved {} with {}",
                  this, x);
        return;
      }
      value = x;
      state = State.FULFILLED;
      len = length;
    }
    if (len > 0) {
      notifySubscribers();
    }
  }

  private void doReject(final Exception reason) {
    final int len;
    synchronized (this) {
      if (state != State.PENDING) {
        LOG.debug("Ignoring rejection of already resolved {} with {}",
                  this, reason);
        return;
      }
      value = reason;
      state = State.REJECTED;
      len = length;
    }
    if (len > 0) {
      notifySubscribers();
    } else if (is_final) {
      scheduler.fatalError(reason);
    } else {
      LOG.debug("{} rejected with no subscribers", this);
    }
  }

  private void notifySubscribers() {
    if (async_guaranteed) {
      final int[] depth = INLINE_DEPTH.get();
      // Past this depth, go through the scheduler to keep the stack bounded.
      if (depth[0] < MAX_INLINE_DEPTH) {
        depth[0]++;
        try {
          settlePromises();
        } finally {
          depth[0]--;
        }
        return;
      }
    }
    scheduler.settlePromises(this);
  }

  // ------------------------- //
  // The subscribers' storage. //
  // ------------------------- //

  /**
   * Adds a subscriber, or notifies it right away (through the scheduler)
   * if this promise is already settled.
   * @param onFulfilled The fulfillment handler, may be {@code null}.
   * @param onRejected The rejection handler, may be {@code null}.
   * @param promise The dependent promise.
   */
  private void addCallbacks(final Callback onFulfilled,
                            final Callback onRejected,
                            final Promise promise) {
    Promise<?> followee = null;
    synchronized (this) {
      if (state == State.PENDING) {
        store(onFulfilled, onRejected, promise);
        return;
      } else if (state == State.FOLLOWING) {
        followee = (Promise<?>) value;
      }
    }
    if (followee != null) {
      followee.addCallbacks(onFulfilled, onRejected, promise);
      return;
    }

    final boolean fulfilled = state == State.FULFILLED;
    final Callback handler = fulfilled ? onFulfilled : onRejected;
    final Object result = value;
    scheduler.invoke(new Runnable() {
      public void run() {
        settlePromise(promise, handler, result, fulfilled);
      }
      public String toString() {
        return "notify Promise@" + promise.hashCode()
          + " of settled Promise@" + Promise.this.hashCode();
      }
    });
  }

  /** Need to hold this' monitor.  */
  private void store(final Callback onFulfilled,
                     final Callback onRejected,
                     final Promise promise) {
    int index = length;
    if (index >= MAX_CALLBACKS) {
      LOG.warn("Too many subscribers in " + this + " (size=" + index
               + "), discarding all of them to make room for Promise@"
               + promise.hashCode());
      clearSubscribers();
      index = 0;
    }
    if (index == 0) {
      fulfillment_handler0 = onFulfilled;
      rejection_handler0 = onRejected;
      promise0 = promise;
    } else {
      if (overflow == null) {
        overflow = new ArrayList<Subscriber>(INIT_OVERFLOW_SIZE);
      }
      overflow.add(new Subscriber(onFulfilled, onRejected, promise));
    }
    length = index + 1;
  }

  /** Need to hold this' monitor.  */
  private void clearSubscribers() {
    fulfillment_handler0 = null;
    rejection_handler0 = null;
    promise0 = null;
    overflow = null;
    length = 0;
  }

  /**
   * Notifies all the subscribers of this settled promise, in the order in
   * which they subscribed.  Each subscriber is only ever notified once.
   */
  @SuppressWarnings("unchecked")
  void settlePromises() {
    final Callback handler0;
    final Promise first;
    final ArrayList<Subscriber> others;
    final boolean fulfilled;
    final Object result;
    synchronized (this) {
      if (length == 0
          || (state != State.FULFILLED && state != State.REJECTED)) {
        return;
      }
      fulfilled = state == State.FULFILLED;
      result = value;
      handler0 = fulfilled ? fulfillment_handler0 : rejection_handler0;
      first = promise0;
      others = overflow;
      // No subscriber can be added once we're settled, so we can take them
      // all out now and run them without holding our monitor.
      clearSubscribers();
    }
    settlePromise(first, handler0, result, fulfilled);
    if (others != null) {
      for (final Subscriber s : others) {
        settlePromise(s.promise, fulfilled ? s.onFulfilled : s.onRejected,
                      result, fulfilled);
      }
    }
  }

  /**
   * Runs one handler and settles its dependent promise with the outcome.
   * @param promise The dependent promise.
   * @param handler The handler to run, {@code null} to pass the value or
   * reason through.
   * @param result The value or reason this promise was settled with.
   * @param fulfilled Whether this promise was fulfilled.
   */
  private void settlePromise(final Promise<?> promise,
                             final Callback handler,
                             final Object result,
                             final boolean fulfilled) {
    if (async_guaranteed) {
      promise.async_guaranteed = true;
    }
    if (handler != null) {
      final Attempt attempt = Attempt.call(handler, result);
      if (attempt.failed()) {
        promise.rejectWith(attempt.error());
      } else {
        promise.resolveWith(attempt.value());
      }
      return;
    }
    if (fulfilled) {
      promise.fulfill(result);
    } else {
      promise.doReject((Exception) result);
    }
  }

  private static final class Subscriber {
    final Callback onFulfilled;
    final Callback onRejected;
    final Promise promise;

    Subscriber(final Callback onFulfilled,
               final Callback onRejected,
               final Promise promise) {
      this.onFulfilled = onFulfilled;
      this.onRejected = onRejected;
      this.promise = promise;
    }
  }

  // ------------------------------ //
  // Blocking until we're settled.  //
  // ------------------------------ //

  /**
   * Waits for this promise to settle and returns its value.
   * <p>
   * <b>This method should only be used at the boundary with synchronous
   * code, or in tests.</b>  See the class comment.
   * @return The value this promise was fulfilled with.
   * @throws InterruptedException if this thread was interrupted while
   * waiting.
   * @throws Exception the reason this promise was rejected with.
   */
  public T get() throws InterruptedException, Exception {
    return doGet(true, 0);
  }

  /**
   * Waits at most the given time for this promise to settle.
   * @param timeout The maximum number of milliseconds to wait, 0 meaning
   * forever.
   * @return The value this promise was fulfilled with.
   * @throws TimeoutException if the promise didn't settle in time.  It can
   * still settle later and be waited on again.
   * @throws InterruptedException if this thread was interrupted while
   * waiting.
   * @throws IllegalArgumentException if {@code timeout} is negative.
   * @throws Exception the reason this promise was rejected with.
   */
  public T get(final long timeout) throws InterruptedException, Exception {
    return doGet(true, timeout);
  }

  /**
   * Returns the value of this promise, optionally waiting for it.
   * @param wait If false, returns immediately.
   * @return The value this promise was fulfilled with.
   * @throws IllegalStateException if {@code wait} is false and the promise
   * is still pending.
   * @throws Exception the reason this promise was rejected with.
   */
  public T get(final boolean wait) throws InterruptedException, Exception {
    if (wait) {
      return doGet(true, 0);
    }
    return settledValue();
  }

  /**
   * Waits for this promise to settle, ignoring interrupts.  The interrupt
   * status of this thread is restored before returning.
   * @return The value this promise was fulfilled with.
   * @throws Exception the reason this promise was rejected with.
   */
  public T getUninterruptibly() throws Exception {
    try {
      return doGet(false, 0);
    } catch (InterruptedException e) {
      throw new AssertionError("Impossible");
    }
  }

  private T doGet(final boolean interruptible, final long timeout)
    throws InterruptedException, Exception {
    if (timeout < 0) {
      throw new IllegalArgumentException("negative timeout: " + timeout);
    }
    if (isPending()) {
      // Work queued in the context we were created in, or behind the task
      // this thread may be running, could be what settles us.
      if (trace != null) {
        trace.drainQueue();
      }
      scheduler.drainQueueUntilSettled(this);
    }
    if (!isPending()) {
      return settledValue();
    }

    final Signal signal_cb = signal();
    // If we got settled in the mean time, the signal may have been queued
    // behind the task this thread is running.
    if (!isPending()) {
      return settledValue();
    }

    boolean interrupted = false;
    waiting = true;
    try {
      while (true) {
        try {
          boolean timedout = false;
          synchronized (signal_cb) {
            if (timeout == 0) {
              while (!signal_cb.fired) {
                signal_cb.wait();
              }
            } else {
              long timeleft = timeout * 1000000L;  // Convert to nanoseconds.
              if (timeout > 31556926000L) {  // One year in milliseconds.
                LOG.warn("Timeout (" + timeout + ") is longer than 1 year."
                         + "  this=" + this);
                if (timeleft <= 0) {
                  throw new IllegalArgumentException("timeout overflow after"
                    + " conversion to nanoseconds: " + timeout);
                }
              }
              while (!signal_cb.fired) {
                // We can't tell a timeout from a spurious wakeup, so we time
                // how long we slept to know how much longer to wait.
                long duration = System.nanoTime();
                signal_cb.wait(timeleft / 1000000L, (int) (timeleft % 1000000));
                duration = System.nanoTime() - duration;
                timeleft -= duration;
                // Not worth going through the loop again for under 100ns.
                if (timeleft < 100) {
                  timedout = true;
                  break;
                }
              }
            }
            if (timedout && !signal_cb.fired) {
              throw new TimeoutException(this, timeout);
            }
          }
          return settledValue();
        } catch (InterruptedException e) {
          LOG.debug("While waiting on {}: interrupted", this);
          if (interruptible) {
            throw e;
          }
          interrupted = true;
        }
      }
    } finally {
      waiting = false;
      if (interrupted) {
        Thread.currentThread().interrupt();  // Restore the interrupted status.
      }
    }
  }

  /** Returns the signal of this promise, subscribing it the first time.  */
  private Signal signal() {
    final Signal signal_cb;
    synchronized (this) {
      if (signal != null) {
        return signal;
      }
      signal_cb = signal = new Signal(this);
    }
    // If we start following another promise later on, the signal moves
    // over with the rest of our subscribers.
    target().addCallbacks(signal_cb, signal_cb, new Promise<Object>());
    return signal_cb;
  }

  @SuppressWarnings("unchecked")
  private T settledValue() throws Exception {
    final Promise<?> target = target();
    final State state = target.state;
    if (state == State.FULFILLED) {
      return (T) target.value;
    } else if (state == State.REJECTED) {
      throw (Exception) target.value;
    }
    throw new IllegalStateException("Not settled yet: " + this);
  }

  /** Wakes up the threads blocked in {@link #doGet}.  */
  static final class Signal implements Callback<Object, Object> {
    /** Guarded by this' monitor.  */
    boolean fired;

    private final int promise;

    Signal(final Promise<?> promise) {
      this.promise = promise.hashCode();
    }

    public Object call(final Object arg) {
      synchronized (this) {
        fired = true;
        super.notifyAll();  // Several threads can wait on the same promise.
      }
      return null;
    }

    public String toString() {
      return "wakeup threads waiting on Promise@" + promise;
    }
  }

  // ---------------- //
  // Interoperability //
  // ---------------- //

  /**
   * Returns a {@link CompletableFuture} completed with the outcome of this
   * promise.  The same future is returned every time.
   * <p>
   * Completing the future from the outside has no effect on this promise.
   */
  public CompletableFuture<T> future() {
    final CompletableFuture<T> f;
    synchronized (this) {
      if (future != null) {
        return future;
      }
      f = future = new CompletableFuture<T>();
    }
    then(new Callback<Void, T>() {
      public Void call(final T arg) {
        f.complete(arg);
        return null;
      }
      public String toString() {
        return "complete future@" + f.hashCode();
      }
    }, new Callback<Void, Exception>() {
      public Void call(final Exception arg) {
        f.completeExceptionally(arg);
        return null;
      }
      public String toString() {
        return "fail future@" + f.hashCode();
      }
    });
    return f;
  }

  /** Used when this promise was made from the given future.  */
  synchronized void setFuture(final CompletableFuture<T> f) {
    if (future == null) {
      future = f;
    }
  }

  // ------------ //
  // Combinators. //
  // ------------ //

  /**
   * Turns a collection of promises into a promise of a list of values.
   * <p>
   * Each input may be a promise, any other thenable, or a plain value.  The
   * promise returned is fulfilled once every input is fulfilled, with their
   * values in the same order as the inputs, whatever the order in which
   * they completed.  It's rejected as soon as any input is rejected, with
   * that input's reason; the inputs that complete afterwards are ignored.
   * @param inputs The inputs.  An empty collection gives a promise already
   * fulfilled with an empty list.
   */
  public static <T> Promise<ArrayList<T>> all(final Collection<?> inputs) {
    final int n = inputs.size();
    if (n == 0) {
      return fulfilled(new ArrayList<T>(0));
    }

    final ArrayList<Promise<Object>> promises = new ArrayList<Promise<Object>>(n);
    for (final Object input : inputs) {
      final Promise<Object> promise = tryConvert(input);
      promises.add(promise != null ? promise : Promise.<Object>fulfilled(input));
    }

    final Promise<ArrayList<T>> all = new Promise<ArrayList<T>>();
    final CountdownLatch counter = new CountdownLatch(n);
    final ArrayList<T> values = new ArrayList<T>(n);
    for (int i = 0; i < n; i++) {
      values.add(null);  // So that values.set(i, ...) is valid.
    }

    final Callback<Void, Exception> rejectAll = new Callback<Void, Exception>() {
      public Void call(final Exception reason) {
        all.rejectWith(reason);
        return null;
      }
      public String toString() {
        return "reject all Promise@" + all.hashCode();
      }
    };

    // Callback that stores a value at the index of its input.
    final class Collect implements Callback<Void, T> {
      private final int index;
      Collect(final int index) {
        this.index = index;
      }
      public Void call(final T arg) {
        values.set(index, arg);
        // The latch's monitor makes all the values set before visible to
        // whoever gets to zero.
        if (counter.dec() == 0) {
          all.fulfill(values);
        }
        return null;
      }
      public String toString() {
        return "collect #" + index + " of all Promise@" + all.hashCode();
      }
    }

    for (int i = 0; i < n; i++) {
      promises.get(i).subscribe(new Collect(i), rejectAll, true);
    }
    return all;
  }

  /**
   * Turns a map of promises into a promise of a map of values.
   * <p>
   * Same as {@link #all}, keyed.  The map the promise is fulfilled with has
   * the same keys in the same order: a {@link SortedMap} gives a {@link
   * TreeMap} with the same comparator, any other map a {@link
   * LinkedHashMap}.
   * @param mapping The inputs, each value being a promise, any other
   * thenable, or a plain value.
   */
  public static <K, V> Promise<Map<K, V>> forDict(final Map<K, ?> mapping) {
    if (mapping.isEmpty()) {
      return fulfilled(Promise.<K, V>newMapLike(mapping));
    }
    final ArrayList<K> keys = new ArrayList<K>(mapping.size());
    final ArrayList<Object> inputs = new ArrayList<Object>(mapping.size());
    for (final Map.Entry<K, ?> e : mapping.entrySet()) {
      keys.add(e.getKey());
      inputs.add(e.getValue());
    }
    return Promise.<V>all(inputs).then(new Callback<Map<K, V>, ArrayList<V>>() {
      public Map<K, V> call(final ArrayList<V> values) {
        final Map<K, V> result = newMapLike(mapping);
        for (int i = 0; i < keys.size(); i++) {
          result.put(keys.get(i), values.get(i));
        }
        return result;
      }
      public String toString() {
        return "zip " + keys.size() + " keys";
      }
    });
  }

  @SuppressWarnings("unchecked")
  private static <K, V> Map<K, V> newMapLike(final Map<K, ?> mapping) {
    if (mapping instanceof SortedMap) {
      return new TreeMap<K, V>(((SortedMap<K, ?>) mapping).comparator());
    }
    return new LinkedHashMap<K, V>(mapping.size());
  }

  public String toString() {
    final State state = this.state;  // volatile access before reading value.
    final Object value = this.value;
    final String str;
    if (state == State.PENDING) {
      str = "<none>";
    } else if (value instanceof Promise) {  // Nested promises
      str = "Promise@" + value.hashCode();  // are hard to read.
    } else {
      str = String.valueOf(value);
    }
    final int subscribers;
    synchronized (this) {
      subscribers = length;
    }
    return "Promise@" + super.hashCode()
      + "(state=" + state
      + ", value=" + str
      + ", subscribers=" + subscribers
      + (waiting ? ", waiting" : "")
      + (is_final ? ", final" : "")
      + ')';
  }

}
