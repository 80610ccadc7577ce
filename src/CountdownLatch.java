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
 * A thread-safe counter that can only go down.
 * <p>
 * Unlike {@link java.util.concurrent.CountDownLatch}, {@link #dec} returns
 * the count it left behind, which lets exactly one caller observe the
 * transition to zero.
 */
final class CountdownLatch {

  /**
   * How many decrements are still expected.
   * Need to acquire this' monitor before changing.
   */
  private int count;

  /**
   * Constructor.
   * @param count The initial count, must be positive or zero.
   * @throws IllegalArgumentException if {@code count} is negative.
   */
  CountdownLatch(final int count) {
    if (count < 0) {
      throw new IllegalArgumentException("count needs to be greater than or"
                                         + " equal to 0, got: " + count);
    }
    this.count = count;
  }

  /**
   * Decrements the counter.
   * @return The count after this decrement.  The value is read while
   * holding the lock, as another thread may decrement again right after.
   * @throws IllegalStateException if the counter was already at zero.
   */
  synchronized int dec() {
    if (count <= 0) {
      throw new IllegalStateException("Latch already open, count=" + count);
    }
    return --count;
  }

  synchronized int count() {
    return count;
  }

  public String toString() {
    return "CountdownLatch(count=" + count() + ')';
  }

}
