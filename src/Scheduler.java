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

/**
 * Decouples the settlement of a {@link Promise} from the notification of
 * its subscribers.
 * <p>
 * Handlers are handed to the scheduler as tasks.  A task scheduled while
 * another one is running on the same thread is queued behind it instead of
 * running nested, so the call stack stays bounded no matter how long a
 * chain of promises is.
 * @see Async
 */
public interface Scheduler {

  /**
   * Schedules a task for deferred execution.
   * @param task The task to run.
   */
  public void invoke(Runnable task);

  /**
   * Schedules the notification of all the subscribers of a settled promise.
   * @param promise The promise whose subscribers must be notified.
   */
  public void settlePromises(Promise<?> promise);

  /**
   * Reports a rejection that reached a terminal promise nobody listens to.
   * This is a diagnostic sink: nothing is retried.
   * @param reason The rejection reason.
   */
  public void fatalError(Exception reason);

  /**
   * Runs queued tasks from the calling thread until the given promise is
   * settled, if the calling thread is the one currently running queued
   * tasks.  Otherwise does nothing.
   * <p>
   * Called before a thread blocks on a promise, so that a handler blocking
   * on work queued behind itself doesn't deadlock.
   * @param promise The promise about to be waited on.
   */
  public void drainQueueUntilSettled(Promise<?> promise);

}
