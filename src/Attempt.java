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
 * The outcome of invoking a handler: either the value it returned or the
 * exception it threw.
 */
final class Attempt {

  private final Object value;

  private final Exception error;

  private Attempt(final Object value, final Exception error) {
    this.value = value;
    this.error = error;
  }

  /**
   * Invokes a handler inside a fresh {@link Context}.
   * @param handler The handler to invoke.
   * @param arg The argument to give it.
   * @return The outcome, never {@code null}.
   */
  @SuppressWarnings("unchecked")
  static Attempt call(final Callback handler, final Object arg) {
    try (Context ignored = Context.enter()) {
      return new Attempt(handler.call(arg), null);
    } catch (Exception e) {
      return new Attempt(null, e);
    }
  }

  boolean failed() {
    return error != null;
  }

  Object value() {
    return value;
  }

  Exception error() {
    return error;
  }

  public String toString() {
    return failed() ? "Attempt(failed: " + error + ')'
                    : "Attempt(returned: " + value + ')';
  }

}
