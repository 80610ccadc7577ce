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
 * A fulfillment handler and a rejection handler registered together.
 * <p>
 * Used by {@link Promise#thenAll} and {@link Promise#doneAll} to subscribe
 * several reactions in one call.  Either handler may be {@code null}, in
 * which case the value or the reason passes through unchanged.
 * @param <R> The return type of the handlers.
 * @param <T> The type of the value the fulfillment handler receives.
 */
public final class HandlerPair<R, T> {

  private final Callback<R, ? super T> onFulfilled;
  private final Callback<R, Exception> onRejected;

  private HandlerPair(final Callback<R, ? super T> onFulfilled,
                      final Callback<R, Exception> onRejected) {
    this.onFulfilled = onFulfilled;
    this.onRejected = onRejected;
  }

  /**
   * Creates a pair with both handlers.
   * @param onFulfilled The fulfillment handler, may be {@code null}.
   * @param onRejected The rejection handler, may be {@code null}.
   */
  public static <R, T> HandlerPair<R, T> of(final Callback<R, ? super T> onFulfilled,
                                            final Callback<R, Exception> onRejected) {
    return new HandlerPair<R, T>(onFulfilled, onRejected);
  }

  /** Creates a pair with only a fulfillment handler.  */
  public static <R, T> HandlerPair<R, T> onFulfilled(final Callback<R, ? super T> cb) {
    return new HandlerPair<R, T>(cb, null);
  }

  /** Creates a pair with only a rejection handler.  */
  public static <R, T> HandlerPair<R, T> onRejected(final Callback<R, Exception> eb) {
    return new HandlerPair<R, T>(null, eb);
  }

  public Callback<R, ? super T> fulfillmentHandler() {
    return onFulfilled;
  }

  public Callback<R, Exception> rejectionHandler() {
    return onRejected;
  }

  public String toString() {
    return "HandlerPair(onFulfilled=" + onFulfilled
      + ", onRejected=" + onRejected + ')';
  }

}
