/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.query;

import com.google.common.base.Preconditions;
import java.util.concurrent.CountDownLatch;

/**
 * Counting join over a fixed number of workers. Each worker arrives once when it terminates; waiters are released when
 * the last one has arrived.
 *
 * @author jiratime
 */
public class CompletionBarrier {

  private final CountDownLatch pending;

  public CompletionBarrier(final int workers) {
    Preconditions.checkArgument(workers > 0, "At least one worker is required");
    this.pending = new CountDownLatch(workers);
  }

  public void arrive() {
    pending.countDown();
  }

  public void await() throws InterruptedException {
    pending.await();
  }

  public long pending() {
    return pending.getCount();
  }
}
