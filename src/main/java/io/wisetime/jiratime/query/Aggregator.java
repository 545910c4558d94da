/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.query;

import com.google.common.math.LongMath;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds per issue totals into a grand total.
 *
 * @author jiratime
 */
public final class Aggregator {

  private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

  private Aggregator() {
  }

  /**
   * Sums totals until the queue is closed and drained.
   */
  public static long sum(final ClosableQueue<IssueTotal> results) throws InterruptedException {
    long totalSeconds = 0;
    Optional<IssueTotal> next;
    while ((next = results.take()).isPresent()) {
      final IssueTotal issueTotal = next.get();
      totalSeconds = LongMath.checkedAdd(totalSeconds, issueTotal.getSeconds());
      log.debug("Added {} seconds from issue {}, running total {}",
          issueTotal.getSeconds(), issueTotal.getIssueId(), totalSeconds);
    }
    return totalSeconds;
  }
}
