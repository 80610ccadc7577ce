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

import java.util.ArrayDeque;
import java.util.ArrayList;

/**
 * A thread-local stack of scopes, used for tracing and for deferring work
 * until a scope is exited.
 * <p>
 * {@link Promise} enters a context around every executor and every handler
 * it runs, and remembers the context that was current when it was created.
 * Work queued with {@link #onExit} runs when the scope is closed, or earlier
 * if a thread is about to block on a promise created in that scope (see
 * {@link #drainQueue}).
 * <p>
 * Typical usage:
 * <pre>
 *   try (Context ctx = Context.enter()) {
 *     ...
 *   }
 * </pre>
 */
public final class Context implements AutoCloseable {

  private static final ThreadLocal<ArrayDeque<Context>> STACK =
    new ThreadLocal<ArrayDeque<Context>>() {
      protected ArrayDeque<Context> initialValue() {
        return new ArrayDeque<Context>();
      }
    };

  /** The context that was current when this one was entered.  */
  private final Context parent;

  /**
   * Work to run on exit.
   * Need to acquire this' monitor before changing.
   */
  private ArrayList<Runnable> callbacks;

  private boolean exited;

  private Context(final Context parent) {
    this.parent = parent;
  }

  /**
   * Enters a new scope on the calling thread.
   * @return The new current context, to be closed by the same thread.
   */
  public static Context enter() {
    final ArrayDeque<Context> stack = STACK.get();
    final Context ctx = new Context(stack.peek());
    stack.push(ctx);
    return ctx;
  }

  /**
   * Returns the innermost context of the calling thread, or {@code null} if
   * the thread isn't in any scope.
   */
  public static Context current() {
    return STACK.get().peek();
  }

  /** Returns the enclosing context, or {@code null}.  */
  public Context parent() {
    return parent;
  }

  /**
   * Queues work to run when this scope is exited.  If it was already exited,
   * the work runs right away.
   * @param callback The work to run.
   */
  public void onExit(final Runnable callback) {
    synchronized (this) {
      if (!exited) {
        if (callbacks == null) {
          callbacks = new ArrayList<Runnable>(2);
        }
        callbacks.add(callback);
        return;
      }
    }
    callback.run();
  }

  /**
   * Runs all the work queued so far, in the order in which it was queued.
   * Work queued while draining runs in the same call.
   */
  public void drainQueue() {
    while (true) {
      final ArrayList<Runnable> todo;
      synchronized (this) {
        if (callbacks == null || callbacks.isEmpty()) {
          return;
        }
        todo = callbacks;
        callbacks = null;
      }
      for (final Runnable callback : todo) {
        callback.run();
      }
    }
  }

  /**
   * Exits this scope and drains its queue.
   * @throws IllegalStateException if this isn't the innermost context of
   * the calling thread.
   */
  public void close() {
    final ArrayDeque<Context> stack = STACK.get();
    if (stack.peek() != this) {
      throw new IllegalStateException("Closing " + this + " out of order,"
                                      + " innermost context is " + stack.peek());
    }
    stack.pop();
    try {
      drainQueue();
    } finally {
      synchronized (this) {
        exited = true;
      }
      // Work queued between the drain above and setting the flag.
      drainQueue();
    }
  }

  public String toString() {
    final int pending;
    synchronized (this) {
      pending = callbacks == null ? 0 : callbacks.size();
    }
    return "Context@" + super.hashCode() + "(parent="
      + (parent == null ? "none" : "Context@" + parent.hashCode())
      + ", queued=" + pending + ')';
  }

}
