/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.query;

import com.google.common.annotations.VisibleForTesting;
import io.wisetime.jiratime.api.JiraApi;
import io.wisetime.jiratime.api.Worklog;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.apache.commons.lang3.mutable.MutableLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker that takes issue ids off the work queue until it is exhausted, totals each issue's matching worklogs and
 * emits the non zero totals. Many fetchers share one work queue and one result queue; they share nothing else.
 *
 * @author jiratime
 */
public class WorklogFetcher implements Callable<Void> {

  private static final Logger log = LoggerFactory.getLogger(WorklogFetcher.class);

  private final JiraApi jiraApi;
  private final WorklogMatcher matcher;
  private final ClosableQueue<String> workQueue;
  private final ClosableQueue<IssueTotal> results;
  private final CompletionBarrier barrier;

  public WorklogFetcher(final JiraApi jiraApi,
                        final WorklogMatcher matcher,
                        final ClosableQueue<String> workQueue,
                        final ClosableQueue<IssueTotal> results,
                        final CompletionBarrier barrier) {
    this.jiraApi = jiraApi;
    this.matcher = matcher;
    this.workQueue = workQueue;
    this.results = results;
    this.barrier = barrier;
  }

  /**
   * Arrives at the completion barrier exactly once, however the worker terminates.
   */
  @Override
  public Void call() throws IOException, InterruptedException {
    try {
      Optional<String> issueId;
      while ((issueId = workQueue.take()).isPresent()) {
        final long seconds = issueTotal(issueId.get());
        if (seconds > 0) {
          results.put(new IssueTotal(issueId.get(), seconds));
        }
      }
      return null;
    } finally {
      barrier.arrive();
    }
  }

  /**
   * Scans every page of an issue's worklogs.
   */
  @VisibleForTesting
  long issueTotal(final String issueId) throws IOException, InterruptedException {
    final MutableLong seconds = new MutableLong();
    new Pager<Worklog>((startAt, maxResults) -> jiraApi.issueWorklogs(issueId, startAt, maxResults))
        .forEachPage(worklogs -> worklogs.forEach(worklog ->
            seconds.add(matcher.countedSeconds(issueId, worklog))));

    log.debug("Issue {}: {} seconds", issueId, seconds.longValue());
    return seconds.longValue();
  }
}
