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

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.concurrent.RunnableFuture;
import java.util.function.BiConsumer;

/**
 * The kinds of objects a {@link Promise} knows how to absorb.
 * <p>
 * The constants are declared in the order in which they're probed: an
 * object is handled by the first shape that {@link #matches} it.  So a
 * {@link CompletableFuture} is absorbed as a {@link #COMPLETION_STAGE} and
 * not as a {@link #TASK}, and an object that is both {@link DoneCapable}
 * and {@link Thenable} is absorbed through {@code done}.
 */
public enum ThenableShape {

  /** Already a {@link Promise}, used as-is.  */
  PROMISE {
    boolean matches(final Object obj) {
      return obj instanceof Promise;
    }

    @SuppressWarnings("unchecked")
    Promise<Object> convert(final Object obj) {
      return (Promise<Object>) obj;
    }
  },

  /**
   * A {@link CompletionStage}.  Its outcome is fed to the new promise as
   * soon as it's known, right away if the stage is already complete.
   */
  COMPLETION_STAGE {
    boolean matches(final Object obj) {
      return obj instanceof CompletionStage;
    }

    @SuppressWarnings("unchecked")
    Promise<Object> convert(final Object obj) {
      final CompletionStage<Object> stage = (CompletionStage<Object>) obj;
      final Promise<Object> promise = new Promise<Object>(new PromiseExecutor() {
        public void execute(final Callback<Void, Object> resolve,
                            final Callback<Void, Exception> reject) {
          stage.whenComplete(new BiConsumer<Object, Throwable>() {
            public void accept(final Object value, final Throwable failure) {
              settle(resolve, reject, value, failure);
            }
          });
        }
        public String toString() {
          return "adopt " + stage;
        }
      });
      if (stage instanceof CompletableFuture) {
        promise.setFuture((CompletableFuture<Object>) stage);
      }
      return promise;
    }
  },

  /** A {@link DoneCapable}, handed the promise's resolve and reject.  */
  DONE {
    boolean matches(final Object obj) {
      return obj instanceof DoneCapable;
    }

    Promise<Object> convert(final Object obj) {
      final DoneCapable thenable = (DoneCapable) obj;
      return new Promise<Object>(new PromiseExecutor() {
        public void execute(final Callback<Void, Object> resolve,
                            final Callback<Void, Exception> reject) throws Exception {
          thenable.done(resolve, reject);
        }
        public String toString() {
          return "done of " + thenable;
        }
      });
    }
  },

  /** A {@link Thenable}, handed the promise's resolve and reject.  */
  THEN {
    boolean matches(final Object obj) {
      return obj instanceof Thenable;
    }

    Promise<Object> convert(final Object obj) {
      final Thenable thenable = (Thenable) obj;
      return new Promise<Object>(new PromiseExecutor() {
        public void execute(final Callback<Void, Object> resolve,
                            final Callback<Void, Exception> reject) throws Exception {
          thenable.then(resolve, reject);
        }
        public String toString() {
          return "then of " + thenable;
        }
      });
    }
  },

  /**
   * A plain {@link Future}, which offers no way of being called back.  The
   * outcome is collected on the scheduler's task runner, after running the
   * task there first if it's a {@link RunnableFuture} nobody started yet,
   * and the result is absorbed as a {@link #COMPLETION_STAGE}.
   * <p>
   * With the default {@link Async} scheduler the task runner is the calling
   * thread, so absorbing a future still in progress blocks until it's done.
   */
  TASK {
    boolean matches(final Object obj) {
      return obj instanceof Future;
    }

    @SuppressWarnings("unchecked")
    Promise<Object> convert(final Object obj) {
      final Future<Object> future = (Future<Object>) obj;
      final CompletableFuture<Object> stage = new CompletableFuture<Object>();
      taskRunner().execute(new Runnable() {
        public void run() {
          try {
            if (future instanceof RunnableFuture && !future.isDone()) {
              ((RunnableFuture<Object>) future).run();
            }
            stage.complete(future.get());
          } catch (ExecutionException e) {
            stage.completeExceptionally(e.getCause() != null ? e.getCause() : e);
          } catch (CancellationException e) {
            stage.completeExceptionally(e);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stage.completeExceptionally(e);
          }
        }
        public String toString() {
          return "collect " + future;
        }
      });
      return COMPLETION_STAGE.convert(stage);
    }
  };

  /** Returns whether this shape can absorb the given object.  */
  abstract boolean matches(Object obj);

  /**
   * Absorbs an object this shape {@link #matches}.
   * @return A promise that adopts the object's eventual outcome.
   */
  abstract Promise<Object> convert(Object obj);

  /**
   * Finds the shape of an object.
   * @param obj The object to probe, may be {@code null}.
   * @return The first matching shape, or {@code null} if the object isn't
   * a thenable and must be treated as a plain value.
   */
  public static ThenableShape of(final Object obj) {
    if (obj == null) {
      return null;
    }
    for (final ThenableShape shape : values()) {
      if (shape.matches(obj)) {
        return shape;
      }
    }
    return null;
  }

  private static Executor taskRunner() {
    final Scheduler scheduler = Promise.getScheduler();
    if (scheduler instanceof Async) {
      return ((Async) scheduler).runner();
    }
    return ForkJoinPool.commonPool();
  }

  private static void settle(final Callback<Void, Object> resolve,
                             final Callback<Void, Exception> reject,
                             final Object value,
                             final Throwable failure) {
    try {
      if (failure == null) {
        resolve.call(value);
      } else {
        reject.call(toException(failure));
      }
    } catch (Exception e) {
      throw new AssertionError("Impossible: " + e);  // Ours never throw.
    }
  }

  /** Unwraps what {@link CompletableFuture} wraps, keeps a rejectable type. */
  private static Exception toException(Throwable failure) {
    if ((failure instanceof CompletionException
         || failure instanceof ExecutionException)
        && failure.getCause() != null) {
      failure = failure.getCause();
    }
    if (failure instanceof Exception) {
      return (Exception) failure;
    }
    return new ExecutionException(failure);
  }

}
