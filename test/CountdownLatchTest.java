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

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CountdownLatchTest {

  @Test
  public void testCountsDown() {
    final CountdownLatch latch = new CountdownLatch(3);
    assertThat(latch.count()).isEqualTo(3);
    assertThat(latch.dec()).isEqualTo(2);
    assertThat(latch.dec()).isEqualTo(1);
    assertThat(latch.dec()).isEqualTo(0);
    assertThat(latch.toString()).isEqualTo("CountdownLatch(count=0)");
  }

  @Test
  public void testCannotGoBelowZero() {
    final CountdownLatch latch = new CountdownLatch(1);
    latch.dec();
    assertThatThrownBy(latch::dec).isInstanceOf(IllegalStateException.class);
    assertThat(latch.count()).isEqualTo(0);
  }

  @Test
  public void testZeroIsAlreadyOpen() {
    assertThatThrownBy(new CountdownLatch(0)::dec)
      .isInstanceOf(IllegalStateException.class);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeCount() {
    new CountdownLatch(-1);
  }

  @Test
  public void testOnlyOneThreadSeesZero() throws Exception {
    final int threads = 8;
    final int per_thread = 1000;
    final CountdownLatch latch = new CountdownLatch(threads * per_thread);
    final int[] zeros = new int[threads];
    final Thread[] workers = new Thread[threads];
    for (int t = 0; t < threads; t++) {
      final int id = t;
      workers[t] = new Thread(() -> {
        for (int i = 0; i < per_thread; i++) {
          if (latch.dec() == 0) {
            zeros[id]++;
          }
        }
      });
      workers[t].start();
    }
    int total = 0;
    for (int t = 0; t < threads; t++) {
      workers[t].join();
      total += zeros[t];
    }
    assertThat(total).isEqualTo(1);
    assertThat(latch.count()).isEqualTo(0);
  }

}
