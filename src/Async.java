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
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The default {@link Scheduler}: a trampoline over a task runner.
 * <p>
 * With the trampoline enabled, each thread has its own FIFO queue.  A task
 * scheduled from a thread that isn't already draining its queue is handed
 * to the task runner as a new drain pass; tasks scheduled while a pass is
 * running on a thread (typically by handlers settling more promises) are
 * merely enqueued on that thread and run by the same pass, one after the
 * other.  So however deep a chain of promises is, the handlers run at a
 * constant stack depth.
 * <p>
 * Queues are never shared between threads, so a handler blocked in {@link
 * Promise#get} doesn't hold up the notifications scheduled by other threads.
 * <p>
 * The default task runner runs the drain pass right away on the calling
 * thread.  Give it a thread pool to have handlers run off the settling
 * thread instead.
 * <p>
 * With the trampoline disabled, tasks go straight to the task runner.
 * This is only sensible with a runner that doesn't run tasks inline.
 */
public final class Async implements Scheduler {

  private static final Logger LOG = LoggerFactory.getLogger(Async.class);

  /** Runs tasks right away on the calling thread.  */
  private static final Executor IMMEDIATE = new Executor() {
    public void execute(final Runnable task) {
      task.run();
    }
    public String toString() {
      return "immediate";
    }
  };

  private final Executor runner;

  private final boolean trampoline;

  /** Where unhandled terminal rejections go, in addition to the log.  */
  private final Thread.UncaughtExceptionHandler fatalHandler;

  /** The queue of each thread.  Only ever touched by its own thread.  */
  private final ThreadLocal<Trampoline> trampolines =
    new ThreadLocal<Trampoline>() {
      protected Trampoline initialValue() {
        return new Trampoline();
      }
    };

  /** Creates a trampolined scheduler that drains on the calling thread.  */
  public Async() {
    this(IMMEDIATE, true, null);
  }

  /**
   * Creates a trampolined scheduler.
   * @param runner The task runner the drain passes are handed to.
   */
  public Async(final Executor runner) {
    this(runner, true, null);
  }

  /**
   * Constructor.
   * @param runner The task runner.
   * @param trampoline Whether to queue tasks and run them in drain passes.
   * @param fatalHandler Receives the reasons given to {@link #fatalError},
   * may be {@code null} in which case they're only logged.
   */
  public Async(final Executor runner,
               final boolean trampoline,
               final Thread.UncaughtExceptionHandler fatalHandler) {
    if (runner == null) {
      throw new NullPointerException("null runner");
    }
    this.runner = runner;
    this.trampoline = trampoline;
    this.fatalHandler = fatalHandler;
  }

  /** Returns the task runner.  */
  public Executor runner() {
    return runner;
  }

  public boolean isTrampolineEnabled() {
    return trampoline;
  }

  public void invoke(final Runnable task) {
    if (!trampoline) {
      runner.execute(task);
      return;
    }
    final Trampoline local = trampolines.get();
    if (local.draining) {
      local.queue.add(task);
      return;
    }
    runner.execute(new Runnable() {
      public void run() {
        drain(task);
      }
      public String toString() {
        return "drain pass starting with " + task;
      }
    });
  }

  public void settlePromises(final Promise<?> promise) {
    invoke(new Runnable() {
      public void run() {
        promise.setAsyncGuaranteed();
        promise.settlePromises();
      }
      public String toString() {
        return "settle Promise@" + promise.hashCode();
      }
    });
  }

  public void fatalError(final Exception reason) {
    LOG.error("Unhandled rejection of a terminal promise", reason);
    if (fatalHandler != null) {
      fatalHandler.uncaughtException(Thread.currentThread(), reason);
    }
  }

  public void drainQueueUntilSettled(final Promise<?> promise) {
    final Trampoline local = trampolines.get();
    if (!local.draining) {
      return;
    }
    Runnable task;
    while (promise.isPending() && (task = local.queue.poll()) != null) {
      runTask(task);
    }
  }

  /**
   * Runs a task and then everything it queued on this thread, unless this
   * thread is already draining, in which case the task is only queued.
   */
  private void drain(final Runnable first) {
    final Trampoline local = trampolines.get();
    if (local.draining) {
      // The runner ran us inline from inside a pass on the same thread.
      local.queue.add(first);
      return;
    }
    local.draining = true;
    try {
      runTask(first);
      Runnable task;
      while ((task = local.queue.poll()) != null) {
        runTask(task);
      }
    } finally {
      local.draining = false;
    }
  }

  private static void runTask(final Runnable task) {
    try {
      task.run();
    } catch (RuntimeException e) {
      LOG.error("Scheduled task " + task + " failed", e);
    }
  }

  /** Tasks queued by one thread.  */
  private static final class Trampoline {
    final ArrayDeque<Runnable> queue = new ArrayDeque<Runnable>();
    /** Whether this thread is in a drain pass.  */
    boolean draining;
  }

  public String toString() {
    return "Async(runner=" + runner + ", trampoline=" + trampoline
      + ", queued here=" + trampolines.get().queue.size() + ')';
  }

}
